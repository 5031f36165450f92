package com.venueops.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.venueops.common.result.OperationResult;
import com.venueops.common.result.SideEffectOutcome;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderItem;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentMode;
import com.venueops.order.entity.PaymentStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OrderResponse(
        Long id,
        OrderStatus orderStatus,
        PaymentStatus paymentStatus,
        PaymentMode paymentMode,
        Long tableId,
        Integer tableNumber,
        String customerName,
        BigDecimal totalAmount,
        List<Item> items,
        Instant createdAt,
        Instant updatedAt,
        Instant servedAt,
        Instant completedAt,
        List<SideEffectOutcome> sideEffects
) {
    public record Item(Long menuItemId, String name, int quantity, BigDecimal unitPrice,
                       String specialInstructions, String modifiers) {

        static Item from(OrderItem item) {
            return new Item(item.getMenuItemId(), item.getName(), item.getQuantity(), item.getUnitPrice(),
                    item.getSpecialInstructions(), item.getModifiers());
        }
    }

    public static OrderResponse from(Order order) {
        return from(order, List.of());
    }

    public static OrderResponse from(OperationResult<Order> result) {
        return from(result.value(), result.sideEffects());
    }

    private static OrderResponse from(Order order, List<SideEffectOutcome> sideEffects) {
        return new OrderResponse(
                order.getId(),
                order.getOrderStatus(),
                order.getPaymentStatus(),
                order.getPaymentMode(),
                order.getTableId(),
                order.getTableNumber(),
                order.getCustomerName(),
                order.getTotalAmount(),
                order.getItems().stream().map(Item::from).toList(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                order.getServedAt(),
                order.getCompletedAt(),
                sideEffects);
    }
}
