package com.venueops.order.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Preparation axis of an order. Forward edges:
 *
 * <pre>
 * PLACED   -> ACCEPTED | IN_PREP | EXPIRED
 * ACCEPTED -> IN_PREP | READY | EXPIRED
 * IN_PREP  -> READY
 * READY    -> SERVING | SERVED | COMPLETED
 * SERVING  -> SERVED
 * SERVED   -> COMPLETED
 * COMPLETED -> REFUNDED
 * </pre>
 *
 * CANCELLED and REFUNDED are reachable from every non-terminal status.
 */
public enum OrderStatus {
    PLACED,
    ACCEPTED,
    IN_PREP,
    READY,
    SERVING,
    SERVED,
    COMPLETED,
    CANCELLED,
    REFUNDED,
    EXPIRED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PLACED, EnumSet.of(ACCEPTED, IN_PREP, EXPIRED));
        TRANSITIONS.put(ACCEPTED, EnumSet.of(IN_PREP, READY, EXPIRED));
        TRANSITIONS.put(IN_PREP, EnumSet.of(READY));
        TRANSITIONS.put(READY, EnumSet.of(SERVING, SERVED, COMPLETED));
        TRANSITIONS.put(SERVING, EnumSet.of(SERVED));
        TRANSITIONS.put(SERVED, EnumSet.of(COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(REFUNDED));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(EXPIRED, EnumSet.noneOf(OrderStatus.class));
        for (OrderStatus status : values()) {
            if (!status.isTerminal()) {
                TRANSITIONS.get(status).add(CANCELLED);
                TRANSITIONS.get(status).add(REFUNDED);
            }
        }
    }

    /** Statuses that close the order for preparation purposes (table release, dashboards). */
    public static final Set<OrderStatus> TERMINAL =
            Collections.unmodifiableSet(EnumSet.of(COMPLETED, CANCELLED, REFUNDED, EXPIRED));

    /** Excluded from dashboard counts and revenue. */
    public static final Set<OrderStatus> NON_QUALIFYING =
            Collections.unmodifiableSet(EnumSet.of(CANCELLED, REFUNDED, EXPIRED));

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == REFUNDED || this == EXPIRED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }
}
