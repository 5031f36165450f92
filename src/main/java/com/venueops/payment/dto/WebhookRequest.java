package com.venueops.payment.dto;

import com.venueops.payment.gateway.IntentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record WebhookRequest(@NotBlank String intentRef, @NotNull IntentStatus status) {
}
