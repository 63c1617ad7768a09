package com.github.salilvnair.convroute.engine.handler.support;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls order numbers, email addresses and phone numbers out of free text.
 */
public final class ContactInfoExtractor {

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern ORDER_CODE = Pattern.compile("\\bORD-(\\d{3,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDER_REFERENCE = Pattern.compile(
            "\\border\\s*(?:number|no\\.?)?\\s*#\\s*(\\d{3,})\\b|\\border\\s+(?:number|no\\.?)\\s*:?\\s*(\\d{3,})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\s().-]{7,}\\d");
    private static final int MIN_PHONE_DIGITS = 10;
    private static final int MAX_PHONE_DIGITS = 15;

    private ContactInfoExtractor() {
    }

    /**
     * First match in precedence order: order number, email, phone.
     */
    public static Optional<ContactInfo> extract(String text) {
        Optional<String> order = extractOrderNumber(text);
        if (order.isPresent()) {
            return Optional.of(new ContactInfo(ContactInfo.Type.ORDER_NUMBER, order.get()));
        }
        Optional<String> email = extractEmail(text);
        if (email.isPresent()) {
            return Optional.of(new ContactInfo(ContactInfo.Type.EMAIL, email.get()));
        }
        return extractPhone(text).map(phone -> new ContactInfo(ContactInfo.Type.PHONE, phone));
    }

    public static Optional<String> extractEmail(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = EMAIL.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * Normalised to the {@code ORD-<digits>} form.
     */
    public static Optional<String> extractOrderNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher code = ORDER_CODE.matcher(text);
        if (code.find()) {
            return Optional.of("ORD-" + code.group(1));
        }
        Matcher reference = ORDER_REFERENCE.matcher(text);
        if (reference.find()) {
            String digits = reference.group(1) != null ? reference.group(1) : reference.group(2);
            return Optional.of("ORD-" + digits);
        }
        return Optional.empty();
    }

    /**
     * Digits only, keeping a leading {@code +} when present.
     */
    public static Optional<String> extractPhone(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = PHONE.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            String digits = candidate.replaceAll("\\D", "");
            if (digits.length() >= MIN_PHONE_DIGITS && digits.length() <= MAX_PHONE_DIGITS) {
                return Optional.of(candidate.startsWith("+") ? "+" + digits : digits);
            }
        }
        return Optional.empty();
    }
}
