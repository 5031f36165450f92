package com.venueops.kitchen.dto;

import com.venueops.kitchen.entity.KitchenTicket;
import com.venueops.kitchen.entity.TicketStatus;

import java.time.Instant;

public record TicketResponse(
        Long id,
        Long orderId,
        Long stationId,
        String itemName,
        int quantity,
        String specialInstructions,
        Integer tableNumber,
        String tableLabel,
        TicketStatus status,
        Instant createdAt
) {
    public static TicketResponse from(KitchenTicket ticket) {
        return new TicketResponse(
                ticket.getId(),
                ticket.getOrderId(),
                ticket.getStationId(),
                ticket.getItemName(),
                ticket.getQuantity(),
                ticket.getSpecialInstructions(),
                ticket.getTableNumber(),
                ticket.getTableLabel(),
                ticket.getStatus(),
                ticket.getCreatedAt());
    }
}
