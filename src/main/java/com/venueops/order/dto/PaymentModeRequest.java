package com.venueops.order.dto;

import com.venueops.order.entity.PaymentMode;
import jakarta.validation.constraints.NotNull;

public record PaymentModeRequest(@NotNull PaymentMode paymentMode) {
}
