package com.venueops.order.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PaymentMode {
    PAY_AT_TILL("pay_at_till"),
    PAY_LATER("pay_later"),
    ONLINE("online");

    @JsonValue
    private final String code;

    @JsonCreator
    public static PaymentMode from(String value) {
        if (value != null) {
            for (PaymentMode mode : values()) {
                if (mode.code.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                    return mode;
                }
            }
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown payment mode: " + value);
    }

    /** Online orders start waiting on the processor; everything else starts unpaid. */
    public PaymentStatus initialPaymentStatus() {
        return this == ONLINE ? PaymentStatus.PAYMENT_PENDING : PaymentStatus.UNPAID;
    }
}
