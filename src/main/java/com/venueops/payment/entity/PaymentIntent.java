package com.venueops.payment.entity;

import com.venueops.payment.gateway.IntentStatus;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Local record of a processor-side payment intent. {@code intentRef} is the
 * idempotency key for webhook deliveries.
 */
@Entity
@Table(name = "payment_intents", indexes = {
        @Index(name = "idx_intent_order", columnList = "venueId, orderId")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_intent_ref", columnNames = "intentRef")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class PaymentIntent {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "payment_intent_seq")
    @SequenceGenerator(name = "payment_intent_seq", sequenceName = "payment_intent_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String intentRef;

    @Column(nullable = false)
    private String venueId;

    @Column(nullable = false)
    private Long orderId;

    @Column(nullable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IntentStatus status;

    @CreatedDate
    private Instant createdAt;

    @Builder
    public PaymentIntent(String intentRef, String venueId, Long orderId, BigDecimal amount) {
        this.intentRef = intentRef;
        this.venueId = venueId;
        this.orderId = orderId;
        this.amount = amount;
        this.status = IntentStatus.PENDING;
    }
}
