package com.venueops.table.dto;

import jakarta.validation.constraints.NotNull;

public record ReleaseRequest(Long tableId, Integer tableNumber, @NotNull Long orderId) {
}
