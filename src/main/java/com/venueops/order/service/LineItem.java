package com.venueops.order.service;

import java.math.BigDecimal;

/**
 * One requested line on a new order. {@code menuItemId} is null for ad-hoc items.
 */
public record LineItem(
        Long menuItemId,
        String name,
        int quantity,
        BigDecimal unitPrice,
        String specialInstructions,
        String modifiers
) {
    public static LineItem of(Long menuItemId, String name, int quantity, BigDecimal unitPrice) {
        return new LineItem(menuItemId, name, quantity, unitPrice, null, null);
    }

    boolean isValid() {
        return quantity > 0 && unitPrice != null && unitPrice.signum() >= 0;
    }
}
