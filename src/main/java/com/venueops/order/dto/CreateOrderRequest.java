package com.venueops.order.dto;

import com.venueops.order.entity.PaymentMode;
import com.venueops.order.service.LineItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

public record CreateOrderRequest(
        @NotEmpty @Valid List<Item> items,
        Long tableId,
        Integer tableNumber,
        PaymentMode paymentMode,
        String customerName
) {
    public record Item(
            Long menuItemId,
            String name,
            @Min(1) int quantity,
            @NotNull @DecimalMin("0") BigDecimal unitPrice,
            String specialInstructions,
            String modifiers
    ) {
        public LineItem toLineItem() {
            return new LineItem(menuItemId, name, quantity, unitPrice, specialInstructions, modifiers);
        }
    }

    public List<LineItem> lineItems() {
        return items.stream().map(Item::toLineItem).toList();
    }
}
