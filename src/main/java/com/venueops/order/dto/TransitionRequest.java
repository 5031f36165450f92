package com.venueops.order.dto;

import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import jakarta.validation.constraints.NotNull;

public record TransitionRequest(@NotNull OrderStatus orderStatus, PaymentStatus paymentStatus) {
}
