package com.venueops.kitchen.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One line item's preparation unit at one station. Tickets are derived from the order's
 * line items and are never re-created once any ticket exists for the order.
 */
@Entity
@Table(name = "kitchen_tickets", indexes = {
        @Index(name = "idx_ticket_order", columnList = "orderId"),
        @Index(name = "idx_ticket_venue_created", columnList = "venueId, createdAt"),
        @Index(name = "idx_ticket_station_status", columnList = "stationId, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class KitchenTicket {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "ticket_seq")
    @SequenceGenerator(name = "ticket_seq", sequenceName = "ticket_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String venueId;

    @Column(nullable = false)
    private Long orderId;

    @Column(nullable = false)
    private Long stationId;

    @Column(nullable = false)
    private String itemName;

    private int quantity;

    @Column(length = 1000)
    private String specialInstructions;

    private Integer tableNumber;

    private String tableLabel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TicketStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    @Builder
    public KitchenTicket(String venueId, Long orderId, Long stationId, String itemName, int quantity,
                         String specialInstructions, Integer tableNumber, String tableLabel, Instant createdAt) {
        this.venueId = venueId;
        this.orderId = orderId;
        this.stationId = stationId;
        this.itemName = itemName;
        this.quantity = quantity;
        this.specialInstructions = specialInstructions;
        this.tableNumber = tableNumber;
        this.tableLabel = tableLabel;
        this.status = TicketStatus.NEW;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void updateStatus(TicketStatus status, Instant now) {
        this.status = status;
        this.updatedAt = now;
    }
}
