package com.venueops.order.event;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderCompletedEvent(
        Long orderId,
        String venueId,
        BigDecimal totalAmount,
        String customerName,
        Instant completedAt
) {
}
