package com.venueops.payment.dto;

import com.venueops.payment.entity.PaymentIntent;
import com.venueops.payment.gateway.IntentStatus;

import java.math.BigDecimal;

public record PaymentIntentResponse(String intentRef, Long orderId, BigDecimal amount, IntentStatus status) {

    public static PaymentIntentResponse from(PaymentIntent intent) {
        return new PaymentIntentResponse(intent.getIntentRef(), intent.getOrderId(), intent.getAmount(), intent.getStatus());
    }
}
