package com.venueops.kitchen.service;

/**
 * A ticket that should exist for an order, before it is persisted.
 */
public record TicketSpec(
        int lineNumber,
        Long stationId,
        String itemName,
        int quantity,
        String specialInstructions,
        Integer tableNumber,
        String tableLabel
) {
}
