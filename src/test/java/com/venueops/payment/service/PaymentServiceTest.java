package com.venueops.payment.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.common.result.OperationResult;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentMode;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.service.OrderLifecycleService;
import com.venueops.payment.entity.PaymentIntent;
import com.venueops.payment.gateway.IntentStatus;
import com.venueops.payment.gateway.PaymentGateway;
import com.venueops.payment.repository.PaymentIntentRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    private static final String VENUE = "venue-1";

    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private PaymentIntentRepository intentRepository;
    @Mock
    private OrderLifecycleService orderLifecycleService;

    private ExecutorService paymentExecutor;
    private PaymentService paymentService;
    private final VenueScope scope = VenueScope.scoped(VENUE);

    @BeforeEach
    void setUp() {
        paymentExecutor = Executors.newSingleThreadExecutor();
        TimeLimiter timeLimiter = TimeLimiter.of("paymentGateway", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .cancelRunningFuture(true)
                .build());
        paymentService = new PaymentService(paymentGateway, intentRepository, orderLifecycleService,
                timeLimiter, paymentExecutor);
    }

    @AfterEach
    void tearDown() {
        paymentExecutor.shutdownNow();
    }

    @Test
    @DisplayName("A processor that never answers fails confirmation as retryable and leaves the order alone")
    void confirmPayment_GatewayTimeout() {
        // Given
        given(intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(VENUE, 1L))
                .willReturn(Optional.of(intent("pi_slow")));
        willAnswer(invocation -> {
            Thread.sleep(5_000);
            return IntentStatus.SUCCEEDED;
        }).given(paymentGateway).getIntentStatus("pi_slow");

        // When & Then
        assertThatThrownBy(() -> paymentService.confirmPayment(scope, 1L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).isRetryable()).isTrue())
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_GATEWAY_TIMEOUT);
        verify(intentRepository, never()).updateStatusIfChanged(any(), any());
        verifyNoInteractions(orderLifecycleService);
    }

    @Test
    @DisplayName("A payment pool that cannot take more calls fails confirmation as retryable")
    void confirmPayment_PoolSaturated() {
        // Given
        ExecutorService saturated = Executors.newSingleThreadExecutor();
        saturated.shutdown();
        PaymentService service = new PaymentService(paymentGateway, intentRepository, orderLifecycleService,
                TimeLimiter.ofDefaults(), saturated);
        given(intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(VENUE, 1L))
                .willReturn(Optional.of(intent("pi_1")));

        // When & Then
        assertThatThrownBy(() -> service.confirmPayment(scope, 1L))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).isRetryable()).isTrue())
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_GATEWAY_TIMEOUT);
        verifyNoInteractions(paymentGateway, orderLifecycleService);
    }

    @Test
    @DisplayName("A processor error is reported as a gateway failure")
    void confirmPayment_GatewayError() {
        // Given
        given(intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(VENUE, 1L))
                .willReturn(Optional.of(intent("pi_1")));
        given(paymentGateway.getIntentStatus("pi_1")).willThrow(new IllegalStateException("502 from processor"));

        // When & Then
        assertThatThrownBy(() -> paymentService.confirmPayment(scope, 1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_GATEWAY_ERROR);
    }

    @Test
    @DisplayName("A succeeded intent marks the order paid through the transition rules")
    void confirmPayment_Succeeded() {
        // Given
        Order pending = order(OrderStatus.SERVED, PaymentStatus.PAYMENT_PENDING);
        Order paid = order(OrderStatus.SERVED, PaymentStatus.PAID);
        given(intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(VENUE, 1L))
                .willReturn(Optional.of(intent("pi_1")));
        given(paymentGateway.getIntentStatus("pi_1")).willReturn(IntentStatus.SUCCEEDED);
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.SUCCEEDED)).willReturn(1);
        given(orderLifecycleService.getOrder(scope, 1L)).willReturn(pending, paid);
        given(orderLifecycleService.transition(scope, 1L, OrderStatus.SERVED, PaymentStatus.PAID))
                .willReturn(OperationResult.of(paid));

        // When
        Order result = paymentService.confirmPayment(scope, 1L);

        // Then
        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        verify(orderLifecycleService).transition(scope, 1L, OrderStatus.SERVED, PaymentStatus.PAID);
    }

    @Test
    @DisplayName("Confirming without an intent is not found")
    void confirmPayment_NoIntent() {
        given(intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(VENUE, 1L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> paymentService.confirmPayment(scope, 1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_NOT_FOUND);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("A replayed webhook is acknowledged without changing the order")
    void handleWebhook_Duplicate() {
        // Given
        given(intentRepository.findByIntentRef("pi_1")).willReturn(Optional.of(intent("pi_1")));
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.SUCCEEDED)).willReturn(0);
        given(orderLifecycleService.getOrder(VenueScope.scoped(VENUE), 1L))
                .willReturn(order(OrderStatus.SERVED, PaymentStatus.PAID));

        // When
        WebhookOutcome outcome = paymentService.handleWebhook("pi_1", IntentStatus.SUCCEEDED);

        // Then
        assertThat(outcome).isEqualTo(WebhookOutcome.DUPLICATE);
        verify(orderLifecycleService, never()).transition(any(), any(), any(), any());
    }

    @Test
    @DisplayName("A redelivered webhook pays the order when the first delivery lost a concurrent write")
    void handleWebhook_RedeliveryAfterFailedApply() {
        // Given
        Order pending = order(OrderStatus.SERVED, PaymentStatus.PAYMENT_PENDING);
        given(intentRepository.findByIntentRef("pi_1")).willReturn(Optional.of(intent("pi_1")));
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.SUCCEEDED)).willReturn(1, 0);
        given(orderLifecycleService.getOrder(VenueScope.scoped(VENUE), 1L)).willReturn(pending);
        given(orderLifecycleService.transition(VenueScope.scoped(VENUE), 1L, OrderStatus.SERVED, PaymentStatus.PAID))
                .willThrow(new BusinessException(ErrorCode.CONCURRENT_MODIFICATION))
                .willReturn(OperationResult.of(order(OrderStatus.SERVED, PaymentStatus.PAID)));

        // When: the first delivery fails retryably, so the processor sends it again
        assertThatThrownBy(() -> paymentService.handleWebhook("pi_1", IntentStatus.SUCCEEDED))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.CONCURRENT_MODIFICATION);
        WebhookOutcome redelivery = paymentService.handleWebhook("pi_1", IntentStatus.SUCCEEDED);

        // Then
        assertThat(redelivery).isEqualTo(WebhookOutcome.APPLIED);
        verify(orderLifecycleService, times(2))
                .transition(VenueScope.scoped(VENUE), 1L, OrderStatus.SERVED, PaymentStatus.PAID);
    }

    @Test
    @DisplayName("A replayed success for an order refunded since is still a duplicate")
    void handleWebhook_ReplayAfterRefund() {
        // Given
        given(intentRepository.findByIntentRef("pi_1")).willReturn(Optional.of(intent("pi_1")));
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.SUCCEEDED)).willReturn(0);
        given(orderLifecycleService.getOrder(VenueScope.scoped(VENUE), 1L))
                .willReturn(order(OrderStatus.REFUNDED, PaymentStatus.REFUNDED));
        given(orderLifecycleService.transition(any(), eq(1L), eq(OrderStatus.REFUNDED), eq(PaymentStatus.PAID)))
                .willThrow(new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS));

        // When
        WebhookOutcome outcome = paymentService.handleWebhook("pi_1", IntentStatus.SUCCEEDED);

        // Then
        assertThat(outcome).isEqualTo(WebhookOutcome.DUPLICATE);
    }

    @Test
    @DisplayName("A webhook for an order that can no longer take the payment is ignored")
    void handleWebhook_NotApplicable() {
        // Given
        Order cancelled = order(OrderStatus.CANCELLED, PaymentStatus.PAYMENT_PENDING);
        given(intentRepository.findByIntentRef("pi_1")).willReturn(Optional.of(intent("pi_1")));
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.SUCCEEDED)).willReturn(1);
        given(orderLifecycleService.getOrder(VenueScope.scoped(VENUE), 1L)).willReturn(cancelled);
        given(orderLifecycleService.transition(any(), eq(1L), eq(OrderStatus.CANCELLED), eq(PaymentStatus.PAID)))
                .willThrow(new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS));

        // When
        WebhookOutcome outcome = paymentService.handleWebhook("pi_1", IntentStatus.SUCCEEDED);

        // Then
        assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED);
    }

    @Test
    @DisplayName("A failed charge only reverts an order that was waiting on it")
    void handleWebhook_FailedLeavesPayLaterAlone() {
        // Given
        given(intentRepository.findByIntentRef("pi_1")).willReturn(Optional.of(intent("pi_1")));
        given(intentRepository.updateStatusIfChanged("pi_1", IntentStatus.FAILED)).willReturn(1);
        given(orderLifecycleService.getOrder(VenueScope.scoped(VENUE), 1L))
                .willReturn(order(OrderStatus.IN_PREP, PaymentStatus.PAY_LATER));

        // When
        WebhookOutcome outcome = paymentService.handleWebhook("pi_1", IntentStatus.FAILED);

        // Then
        assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
        verify(orderLifecycleService, never()).transition(any(), any(), any(), any());
    }

    @Test
    @DisplayName("A webhook for an unknown intent is not found")
    void handleWebhook_UnknownIntent() {
        given(intentRepository.findByIntentRef("pi_missing")).willReturn(Optional.empty());

        assertThatThrownBy(() -> paymentService.handleWebhook("pi_missing", IntentStatus.SUCCEEDED))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_NOT_FOUND);
    }

    @Test
    @DisplayName("Creating an intent moves an unpaid order to payment pending")
    void createIntent_MovesToPending() {
        // Given
        Order order = order(OrderStatus.PLACED, PaymentStatus.UNPAID);
        given(orderLifecycleService.getOrder(scope, 1L)).willReturn(order);
        given(paymentGateway.createIntent(eq(order.getTotalAmount()), anyMap())).willReturn("pi_new");
        given(intentRepository.save(any(PaymentIntent.class))).willAnswer(invocation -> invocation.getArgument(0));

        // When
        PaymentIntent intent = paymentService.createIntent(scope, 1L);

        // Then
        assertThat(intent.getIntentRef()).isEqualTo("pi_new");
        assertThat(intent.getStatus()).isEqualTo(IntentStatus.PENDING);
        verify(orderLifecycleService).transition(scope, 1L, OrderStatus.PLACED, PaymentStatus.PAYMENT_PENDING);
    }

    @Test
    @DisplayName("A paid order cannot get another intent")
    void createIntent_AlreadyPaid() {
        given(orderLifecycleService.getOrder(scope, 1L)).willReturn(order(OrderStatus.SERVED, PaymentStatus.PAID));

        assertThatThrownBy(() -> paymentService.createIntent(scope, 1L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.ALREADY_PAID);
        verifyNoInteractions(paymentGateway, intentRepository);
    }

    private static PaymentIntent intent(String intentRef) {
        return PaymentIntent.builder()
                .intentRef(intentRef)
                .venueId(VENUE)
                .orderId(1L)
                .amount(new BigDecimal("18.50"))
                .build();
    }

    private static Order order(OrderStatus orderStatus, PaymentStatus paymentStatus) {
        Order order = Order.builder()
                .venueId(VENUE)
                .paymentMode(PaymentMode.ONLINE)
                .createdAt(Instant.parse("2026-03-10T12:00:00Z"))
                .build();
        ReflectionTestUtils.setField(order, "id", 1L);
        ReflectionTestUtils.setField(order, "orderStatus", orderStatus);
        ReflectionTestUtils.setField(order, "paymentStatus", paymentStatus);
        return order;
    }
}
