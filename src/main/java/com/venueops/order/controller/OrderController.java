package com.venueops.order.controller;

import com.venueops.common.access.VenueHeaders;
import com.venueops.common.access.VenueScope;
import com.venueops.common.dto.ApiResponse;
import com.venueops.order.dto.CreateOrderRequest;
import com.venueops.order.dto.OrderResponse;
import com.venueops.order.dto.PaymentModeRequest;
import com.venueops.order.dto.TransitionRequest;
import com.venueops.order.service.OrderLifecycleService;
import com.venueops.table.service.TableRef;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderLifecycleService orderLifecycleService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> createOrder(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                  @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok(OrderResponse.from(orderLifecycleService.createOrder(
                VenueScope.scoped(venueId),
                request.lineItems(),
                TableRef.of(request.tableId(), request.tableNumber()),
                request.paymentMode(),
                request.customerName())));
    }

    @GetMapping("/{orderId}")
    public ApiResponse<OrderResponse> getOrder(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                               @PathVariable Long orderId) {
        return ApiResponse.ok(OrderResponse.from(
                orderLifecycleService.getOrder(VenueScope.scoped(venueId), orderId)));
    }

    @GetMapping("/table/{tableId}")
    public ApiResponse<List<OrderResponse>> activeOrdersForTable(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                                 @PathVariable Long tableId) {
        return ApiResponse.ok(orderLifecycleService.listActiveOrdersForTable(VenueScope.scoped(venueId), tableId)
                .stream()
                .map(OrderResponse::from)
                .toList());
    }

    @PostMapping("/{orderId}/transition")
    public ApiResponse<OrderResponse> transition(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                 @PathVariable Long orderId,
                                                 @Valid @RequestBody TransitionRequest request) {
        return ApiResponse.ok(OrderResponse.from(orderLifecycleService.transition(
                VenueScope.scoped(venueId), orderId, request.orderStatus(), request.paymentStatus())));
    }

    @PatchMapping("/{orderId}/payment-mode")
    public ApiResponse<OrderResponse> updatePaymentMode(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                        @PathVariable Long orderId,
                                                        @Valid @RequestBody PaymentModeRequest request) {
        return ApiResponse.ok(OrderResponse.from(orderLifecycleService.updatePaymentMode(
                VenueScope.scoped(venueId), orderId, request.paymentMode())));
    }
}
