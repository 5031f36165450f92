package com.venueops.payment.gateway;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;

import java.util.Locale;

public enum IntentStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntentStatus from(String value) {
        if (value != null) {
            for (IntentStatus status : values()) {
                if (status.name().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown payment intent status: " + value);
    }
}
