package com.github.salilvnair.convroute.repo;

import com.github.salilvnair.convroute.entity.OrderRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<OrderRecord, Long> {

    Optional<OrderRecord> findFirstByOrderNumberIgnoreCase(String orderNumber);

    List<OrderRecord> findByUserEmailIgnoreCaseOrderByCreatedDesc(String userEmail);

    List<OrderRecord> findByUserPhoneEndingWithOrderByCreatedDesc(String phoneSuffix);
}
