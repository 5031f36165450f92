package com.venueops.order.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Payment axis of an order. Unsettled states may switch freely between each other
 * (customer changes their mind about paying now or later); PAID only moves to REFUNDED.
 */
public enum PaymentStatus {
    UNPAID,
    PAYMENT_PENDING,
    PAY_LATER,
    PAID,
    REFUNDED;

    private static final Map<PaymentStatus, Set<PaymentStatus>> TRANSITIONS = new EnumMap<>(PaymentStatus.class);

    static {
        TRANSITIONS.put(UNPAID, EnumSet.of(PAYMENT_PENDING, PAY_LATER, PAID));
        TRANSITIONS.put(PAYMENT_PENDING, EnumSet.of(PAID, UNPAID, PAY_LATER));
        TRANSITIONS.put(PAY_LATER, EnumSet.of(PAID, UNPAID, PAYMENT_PENDING));
        TRANSITIONS.put(PAID, EnumSet.of(REFUNDED));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(PaymentStatus.class));
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isSettled() {
        return this == PAID || this == REFUNDED;
    }

    /** Counted as "unpaid" on the dashboard. */
    public boolean isOutstanding() {
        return this == UNPAID || this == PAY_LATER;
    }
}
