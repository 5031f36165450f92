package com.venueops.table.dto;

import jakarta.validation.constraints.Min;

public record SeatRequest(
        String serverId,
        @Min(1) Integer guestCount,
        String reservationId
) {
}
