package com.github.salilvnair.convroute.store;

import com.github.salilvnair.convroute.entity.OrderRecord;

import java.util.List;
import java.util.Optional;

/**
 * Key lookups against order storage. Absence is an empty result, never an error;
 * {@link StorageUnavailableException} signals that the store could not be reached.
 */
public interface OrderStore {

    Optional<OrderRecord> findOrderByNumber(String orderNumber);

    List<OrderRecord> findOrdersByEmail(String email);

    List<OrderRecord> findOrdersByPhone(String phone);
}
