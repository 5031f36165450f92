package com.venueops.order.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate root for one customer order: line items plus two independent status axes.
 *
 * <p>Status columns are only written through {@code OrderRepository#updateStatusIfUnchanged},
 * a conditional update keyed on the previously read statuses, so two concurrent writers
 * can never both win. {@code version} is bumped by the same statement.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_venue_created", columnList = "venueId, createdAt"),
        @Index(name = "idx_order_venue_table", columnList = "venueId, tableId"),
        @Index(name = "idx_order_status", columnList = "orderStatus")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String venueId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus orderStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMode paymentMode;

    // Either, both or neither may be set; counter orders carry no table reference.
    private Long tableId;
    private Integer tableNumber;

    private String customerName;

    @Column(nullable = false)
    private BigDecimal totalAmount;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;
    private Instant servedAt;
    private Instant completedAt;

    @Builder
    public Order(String venueId, PaymentMode paymentMode, Long tableId, Integer tableNumber,
                 String customerName, Instant createdAt) {
        this.venueId = venueId;
        this.paymentMode = paymentMode == null ? PaymentMode.PAY_AT_TILL : paymentMode;
        this.tableId = tableId;
        this.tableNumber = tableNumber;
        this.customerName = customerName;
        this.orderStatus = OrderStatus.PLACED;
        this.paymentStatus = this.paymentMode.initialPaymentStatus();
        this.totalAmount = BigDecimal.ZERO;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size() + 1);
        items.add(item);
        recalculateTotal();
    }

    public void changePaymentMode(PaymentMode paymentMode, Instant now) {
        this.paymentMode = paymentMode;
        this.updatedAt = now;
    }

    public boolean hasTable() {
        return tableId != null || tableNumber != null;
    }

    private void recalculateTotal() {
        this.totalAmount = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
