package com.venueops.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Business errors carry code, taxonomy type and retryable flag")
    void businessException_RendersProblemDetail() {
        // When
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.PAYMENT_NOT_CONFIRMED, "Order cannot be completed while payment is UNPAID"));

        // Then
        ProblemDetail body = response.getBody();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        assertThat(body).isNotNull();
        assertThat(body.getType().toString()).isEqualTo("https://venueops.dev/errors/payment_not_confirmed");
        assertThat(body.getDetail()).contains("UNPAID");
        assertThat(body.getProperties())
                .containsEntry("code", "PAYMENT_NOT_CONFIRMED")
                .containsEntry("errorType", "PAYMENT_NOT_CONFIRMED")
                .containsEntry("retryable", false);
    }

    @Test
    @DisplayName("Conflicts and upstream timeouts are flagged retryable")
    void retryableTypes() {
        assertThat(ErrorCode.CONCURRENT_MODIFICATION.getType().isRetryable()).isTrue();
        assertThat(ErrorCode.PAYMENT_GATEWAY_TIMEOUT.getType().isRetryable()).isTrue();
        assertThat(ErrorCode.TABLE_NOT_MERGED.getType().isRetryable()).isFalse();
        assertThat(ErrorCode.INVALID_INPUT.getType().isRetryable()).isFalse();
    }

    @Test
    @DisplayName("Optimistic lock failures map to a retryable conflict")
    void optimisticLock_MapsToConflict() {
        // When
        ResponseEntity<ProblemDetail> response = handler.handleOptimisticLock(
                new ObjectOptimisticLockingFailureException("Order", 1L));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getProperties()).containsEntry("retryable", true);
    }

    @Test
    @DisplayName("Unexpected errors never leak their message")
    void unexpected_HidesInternalDetail() {
        // When
        ResponseEntity<ProblemDetail> response = handler.handleUnexpected(
                new IllegalStateException("connection to db-primary.internal:5432 refused"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getDetail()).isEqualTo("Internal server error");
        assertThat(response.getBody().getProperties()).containsEntry("code", "INTERNAL_ERROR");
    }
}
