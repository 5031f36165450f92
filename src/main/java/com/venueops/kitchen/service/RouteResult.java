package com.venueops.kitchen.service;

public record RouteResult(Long orderId, int ticketsCreated, long existingTickets) {

    public boolean alreadyRouted() {
        return existingTickets > 0;
    }
}
