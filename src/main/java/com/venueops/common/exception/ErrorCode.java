package com.venueops.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Invalid input value"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, ErrorType.ACCESS_DENIED, "Operation requires elevated access"),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Entity was modified concurrently, re-read and retry"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INTERNAL, "Internal server error"),

    // Order
    EMPTY_ORDER(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Order must contain at least one line item"),
    INVALID_LINE_ITEM(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Line item has an invalid quantity or price"),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATUS(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Invalid order status transition"),
    INVALID_PAYMENT_STATUS(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Invalid payment status transition"),
    PAYMENT_MODE_LOCKED(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Payment mode cannot change once paid or completed"),
    PAYMENT_NOT_CONFIRMED(HttpStatus.PAYMENT_REQUIRED, ErrorType.PAYMENT_NOT_CONFIRMED, "Order cannot be completed before payment is confirmed"),

    // Payment
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Payment intent not found"),
    ALREADY_PAID(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "Order already paid"),
    PAYMENT_GATEWAY_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, ErrorType.UPSTREAM_TIMEOUT, "Payment processor did not respond in time"),
    PAYMENT_GATEWAY_ERROR(HttpStatus.BAD_GATEWAY, ErrorType.INTERNAL, "Payment processor call failed"),

    // Kitchen
    TICKET_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Kitchen ticket not found"),
    INVALID_TICKET_STATUS(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Unknown kitchen ticket status"),
    NO_KITCHEN_STATION(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INTERNAL, "No active kitchen station available"),

    // Table
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Table not found"),
    TABLE_ALREADY_OCCUPIED(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Table already has an open session"),
    TABLE_NOT_FREE(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Both tables must be free to merge"),
    MERGE_DEPTH_EXCEEDED(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Merged tables cannot take part in another merge"),
    TABLE_NOT_MERGED(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Table is not currently merged"),
    TABLE_MERGED(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Table is part of a merge, unmerge it first"),
    INVALID_TABLE_STATUS(HttpStatus.UNPROCESSABLE_ENTITY, ErrorType.INVALID_STATE, "Table cannot move to the requested status");

    private final HttpStatus status;
    private final ErrorType type;
    private final String message;
}
