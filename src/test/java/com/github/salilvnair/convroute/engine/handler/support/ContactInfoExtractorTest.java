package com.github.salilvnair.convroute.engine.handler.support;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.github.salilvnair.convroute.support.TestConstants.EMAIL_JANE;
import static com.github.salilvnair.convroute.support.TestConstants.ORDER_NUMBER;
import static com.github.salilvnair.convroute.support.TestConstants.PHONE_JANE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContactInfoExtractorTest {

    @Test
    void normalisesOrderNumbers() {
        assertEquals(Optional.of(ORDER_NUMBER), ContactInfoExtractor.extractOrderNumber("it's " + ORDER_NUMBER));
        assertEquals(Optional.of("ORD-123"), ContactInfoExtractor.extractOrderNumber("ord-123 please"));
        assertEquals(Optional.of("ORD-4567"), ContactInfoExtractor.extractOrderNumber("order #4567 never arrived"));
        assertEquals(Optional.of("ORD-98765"), ContactInfoExtractor.extractOrderNumber("my order number 98765"));
    }

    @Test
    void lowercasesEmail() {
        assertEquals(Optional.of(EMAIL_JANE), ContactInfoExtractor.extractEmail("Contact: Jane.Doe@Example.COM thanks"));
    }

    @Test
    void keepsLeadingPlusOnPhoneNumbers() {
        assertEquals(Optional.of("+15550102000"), ContactInfoExtractor.extractPhone("call me on " + PHONE_JANE));
        assertEquals(Optional.of("5550102000"), ContactInfoExtractor.extractPhone("555-010-2000"));
        assertTrue(ContactInfoExtractor.extractPhone("call 12345").isEmpty());
    }

    @Test
    void orderNumberTakesPrecedenceOverEmailAndPhone() {
        ContactInfo contact = ContactInfoExtractor.extract(ORDER_NUMBER + " " + EMAIL_JANE + " " + PHONE_JANE).orElseThrow();

        assertEquals(ContactInfo.Type.ORDER_NUMBER, contact.type());
        assertEquals(ORDER_NUMBER, contact.value());
    }

    @Test
    void emailTakesPrecedenceOverPhone() {
        ContactInfo contact = ContactInfoExtractor.extract(PHONE_JANE + " or " + EMAIL_JANE).orElseThrow();

        assertEquals(ContactInfo.Type.EMAIL, contact.type());
    }

    @Test
    void returnsEmptyWithoutContactDetails() {
        assertTrue(ContactInfoExtractor.extract("no contact details here").isEmpty());
        assertTrue(ContactInfoExtractor.extract(null).isEmpty());
    }
}
