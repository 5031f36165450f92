package com.venueops.kitchen.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum TicketStatus {
    NEW("new"),
    PREPARING("preparing"),
    READY("ready"),
    BUMPED("bumped"),
    SERVED("served"),
    CANCELLED("cancelled");

    /** Tickets still on a station's screen. */
    public static final Set<TicketStatus> OPEN = EnumSet.of(NEW, PREPARING, READY);

    @JsonValue
    private final String code;

    @JsonCreator
    public static TicketStatus from(String value) {
        if (value != null) {
            for (TicketStatus status : values()) {
                if (status.code.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new BusinessException(ErrorCode.INVALID_TICKET_STATUS, "Unknown ticket status: " + value);
    }
}
