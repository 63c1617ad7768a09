package com.github.salilvnair.convroute.store;

import com.github.salilvnair.convroute.entity.OrderRecord;
import com.github.salilvnair.convroute.repo.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaOrderStore implements OrderStore {

    // phone numbers are stored as digits only and matched on the national part
    private static final int MIN_PHONE_DIGITS = 10;

    private final OrderRepository orderRepository;

    @Override
    public Optional<OrderRecord> findOrderByNumber(String orderNumber) {
        if (orderNumber == null || orderNumber.isBlank()) {
            return Optional.empty();
        }
        return guarded("findOrderByNumber", () -> orderRepository.findFirstByOrderNumberIgnoreCase(orderNumber.trim()));
    }

    @Override
    public List<OrderRecord> findOrdersByEmail(String email) {
        if (email == null || email.isBlank()) {
            return List.of();
        }
        return guarded("findOrdersByEmail", () -> orderRepository.findByUserEmailIgnoreCaseOrderByCreatedDesc(email.trim()));
    }

    @Override
    public List<OrderRecord> findOrdersByPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return List.of();
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() < MIN_PHONE_DIGITS) {
            return List.of();
        }
        String suffix = digits.substring(digits.length() - MIN_PHONE_DIGITS);
        return guarded("findOrdersByPhone", () -> orderRepository.findByUserPhoneEndingWithOrderByCreatedDesc(suffix));
    }

    private <T> T guarded(String operation, Supplier<T> lookup) {
        try {
            return lookup.get();
        }
        catch (DataAccessException | TransactionException e) {
            log.warn("Order storage lookup failed operation={} cause={}", operation, e.getMessage());
            throw new StorageUnavailableException("Order storage is unavailable", e);
        }
    }
}
