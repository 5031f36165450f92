package com.venueops.payment.controller;

import com.venueops.common.access.VenueHeaders;
import com.venueops.common.access.VenueScope;
import com.venueops.common.dto.ApiResponse;
import com.venueops.order.dto.OrderResponse;
import com.venueops.payment.dto.PaymentIntentResponse;
import com.venueops.payment.dto.WebhookRequest;
import com.venueops.payment.service.PaymentService;
import com.venueops.payment.service.WebhookOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping("/orders/{orderId}/intent")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<PaymentIntentResponse> createIntent(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                           @PathVariable Long orderId) {
        return ApiResponse.ok(PaymentIntentResponse.from(
                paymentService.createIntent(VenueScope.scoped(venueId), orderId)));
    }

    @PostMapping("/orders/{orderId}/confirm")
    public ApiResponse<OrderResponse> confirm(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                              @PathVariable Long orderId) {
        return ApiResponse.ok(OrderResponse.from(
                paymentService.confirmPayment(VenueScope.scoped(venueId), orderId)));
    }

    /**
     * Processor callback. Always answers 200 for known intents so the processor stops
     * redelivering, including duplicates.
     */
    @PostMapping("/webhook")
    public ApiResponse<WebhookOutcome> webhook(@Valid @RequestBody WebhookRequest request) {
        return ApiResponse.ok(paymentService.handleWebhook(request.intentRef(), request.status()));
    }
}
