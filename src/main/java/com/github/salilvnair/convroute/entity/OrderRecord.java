package com.github.salilvnair.convroute.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Entity
@Table(name = "order_order")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class OrderRecord {

    @Id
    @Column(name = "id")
    private Long id;

    @Column(name = "order_number", nullable = false, unique = true)
    private String orderNumber;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "user_name")
    private String userName;

    @Column(name = "user_email")
    private String userEmail;

    @Column(name = "user_phone")
    private String userPhone;

    @Column(name = "status")
    private String status;

    @Column(name = "total_paid")
    private BigDecimal totalPaid;

    @Column(name = "total_paid_currency")
    private String totalPaidCurrency;

    @Column(name = "shipping_address")
    private String shippingAddress;

    @Column(name = "customer_note")
    private String customerNote;

    @Column(name = "created")
    private OffsetDateTime created;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
