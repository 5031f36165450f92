package com.venueops.kitchen.service;

import com.venueops.kitchen.entity.Station;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderItem;

import java.util.List;
import java.util.function.Function;

/**
 * Tickets are derived data: the full set for an order can be rebuilt from its line items
 * at any time. {@link #derive} is a pure function of the order; {@link #delta} decides what
 * is missing given the tickets already stored.
 */
public final class TicketDeriver {

    static final String UNKNOWN_ITEM = "Unknown Item";
    static final String GUEST = "Guest";

    private TicketDeriver() {
    }

    public static List<TicketSpec> derive(Order order, String tableLabel, Function<OrderItem, Station> stationFor) {
        return order.getItems().stream()
                .map(item -> new TicketSpec(
                        item.getLineNumber(),
                        stationFor.apply(item).getId(),
                        itemName(item),
                        item.getQuantity() > 0 ? item.getQuantity() : 1,
                        instructions(item.getSpecialInstructions(), item.getModifiers()),
                        order.getTableNumber(),
                        tableLabel))
                .toList();
    }

    /**
     * One ticket set per order: if any ticket exists the order is considered routed and
     * nothing is added, even if the stored set is smaller than the derived one.
     */
    public static List<TicketSpec> delta(List<TicketSpec> derived, long existingTickets) {
        return existingTickets > 0 ? List.of() : derived;
    }

    static String itemName(OrderItem item) {
        String name = item.getName();
        return name == null || name.isBlank() ? UNKNOWN_ITEM : name.trim();
    }

    static String instructions(String specialInstructions, String modifiers) {
        String base = specialInstructions == null ? "" : specialInstructions.trim();
        String extra = modifiers == null ? "" : modifiers.trim();
        if (extra.isEmpty()) {
            return base.isEmpty() ? null : base;
        }
        return base.isEmpty() ? extra : base + " | " + extra;
    }

    /**
     * Display label: the table's own label when the order points at a table row,
     * "Table n" for a bare table number, otherwise the customer's name.
     */
    public static String tableLabel(String storedTableLabel, Integer tableNumber, String customerName) {
        if (storedTableLabel != null && !storedTableLabel.isBlank()) {
            return storedTableLabel;
        }
        if (tableNumber != null) {
            return "Table " + tableNumber;
        }
        return customerName == null || customerName.isBlank() ? GUEST : customerName;
    }
}
