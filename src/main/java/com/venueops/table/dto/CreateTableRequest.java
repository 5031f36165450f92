package com.venueops.table.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record CreateTableRequest(
        @NotBlank String label,
        @Min(1) int seatCount,
        Integer tableNumber
) {
}
