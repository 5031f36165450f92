package com.venueops.kitchen.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateTicketStatusRequest(@NotBlank String status) {
}
