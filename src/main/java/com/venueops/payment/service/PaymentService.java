package com.venueops.payment.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.common.exception.ErrorType;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.service.OrderLifecycleService;
import com.venueops.payment.entity.PaymentIntent;
import com.venueops.payment.gateway.IntentStatus;
import com.venueops.payment.gateway.PaymentGateway;
import com.venueops.payment.repository.PaymentIntentRepository;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bridges the payment processor and the order's payment axis.
 *
 * <p>No database transaction is open while the processor is called. Order changes go
 * through {@link OrderLifecycleService#transition}, so payment never bypasses the
 * transition rules.
 */
@Slf4j
@Service
public class PaymentService {

    private final PaymentGateway paymentGateway;
    private final PaymentIntentRepository intentRepository;
    private final OrderLifecycleService orderLifecycleService;
    private final TimeLimiter timeLimiter;
    private final ExecutorService paymentExecutor;

    public PaymentService(PaymentGateway paymentGateway,
                          PaymentIntentRepository intentRepository,
                          OrderLifecycleService orderLifecycleService,
                          TimeLimiter paymentTimeLimiter,
                          ExecutorService paymentExecutor) {
        this.paymentGateway = paymentGateway;
        this.intentRepository = intentRepository;
        this.orderLifecycleService = orderLifecycleService;
        this.timeLimiter = paymentTimeLimiter;
        this.paymentExecutor = paymentExecutor;
    }

    public PaymentIntent createIntent(VenueScope scope, Long orderId) {
        Order order = orderLifecycleService.getOrder(scope, orderId);
        if (order.getPaymentStatus() == PaymentStatus.PAID) {
            throw new BusinessException(ErrorCode.ALREADY_PAID);
        }
        if (order.getPaymentStatus() == PaymentStatus.REFUNDED || order.getOrderStatus().isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                    "Order " + orderId + " is " + order.getOrderStatus() + "/" + order.getPaymentStatus());
        }

        String intentRef = callGateway(() -> paymentGateway.createIntent(order.getTotalAmount(), Map.of(
                "venueId", scope.venueId(),
                "orderId", String.valueOf(orderId))));
        PaymentIntent intent = intentRepository.save(PaymentIntent.builder()
                .intentRef(intentRef)
                .venueId(scope.venueId())
                .orderId(orderId)
                .amount(order.getTotalAmount())
                .build());

        if (order.getPaymentStatus() != PaymentStatus.PAYMENT_PENDING) {
            orderLifecycleService.transition(scope, orderId, order.getOrderStatus(), PaymentStatus.PAYMENT_PENDING);
        }
        log.info("Payment intent created: venueId={}, orderId={}, intentRef={}, amount={}",
                scope.venueId(), orderId, intentRef, intent.getAmount());
        return intent;
    }

    /**
     * Asks the processor for the latest intent status and applies it. A processor that does
     * not answer within the confirm timeout fails the call as retryable; the order is left
     * untouched.
     */
    public Order confirmPayment(VenueScope scope, Long orderId) {
        PaymentIntent intent = intentRepository.findFirstByVenueIdAndOrderIdOrderByIdDesc(scope.venueId(), orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));

        IntentStatus status = callGateway(() -> paymentGateway.getIntentStatus(intent.getIntentRef()));
        intentRepository.updateStatusIfChanged(intent.getIntentRef(), status);
        applyToOrder(scope, intent, status);
        return orderLifecycleService.getOrder(scope, orderId);
    }

    /**
     * Processor callback. Deliveries are at-least-once, and a delivery can fail after the
     * intent status was recorded but before the order took it. A repeat of a recorded status
     * is therefore only a duplicate once the order reflects it too; otherwise the order
     * change is applied again.
     */
    public WebhookOutcome handleWebhook(String intentRef, IntentStatus status) {
        PaymentIntent intent = intentRepository.findByIntentRef(intentRef)
                .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));

        boolean recorded = intentRepository.updateStatusIfChanged(intentRef, status) > 0;
        try {
            boolean applied = applyToOrder(VenueScope.scoped(intent.getVenueId()), intent, status);
            if (!recorded && !applied) {
                log.debug("Duplicate payment webhook ignored: intentRef={}, status={}", intentRef, status);
                return WebhookOutcome.DUPLICATE;
            }
            if (!recorded) {
                log.info("Payment webhook redelivery completed a missed order change: intentRef={}, orderId={}, status={}",
                        intentRef, intent.getOrderId(), status);
            }
            return WebhookOutcome.APPLIED;
        } catch (BusinessException e) {
            if (e.getErrorType() != ErrorType.INVALID_STATE) {
                throw e;
            }
            if (!recorded) {
                log.debug("Duplicate payment webhook for an order that has moved on: intentRef={}, orderId={}, status={}",
                        intentRef, intent.getOrderId(), status);
                return WebhookOutcome.DUPLICATE;
            }
            log.warn("Payment webhook not applicable to order, needs manual review: intentRef={}, orderId={}, status={}, reason={}",
                    intentRef, intent.getOrderId(), status, e.getMessage());
            return WebhookOutcome.IGNORED;
        }
    }

    /**
     * Moves the order's payment axis to match the intent. Returns false when the order
     * already reflects the status or does not need to follow it.
     */
    private boolean applyToOrder(VenueScope scope, PaymentIntent intent, IntentStatus status) {
        Order order = orderLifecycleService.getOrder(scope, intent.getOrderId());
        PaymentStatus target = switch (status) {
            case SUCCEEDED -> PaymentStatus.PAID;
            case FAILED -> PaymentStatus.UNPAID;
            case PENDING -> null;
        };
        if (target == null || order.getPaymentStatus() == target) {
            return false;
        }
        if (status == IntentStatus.FAILED && order.getPaymentStatus() != PaymentStatus.PAYMENT_PENDING) {
            return false;
        }
        orderLifecycleService.transition(scope, order.getId(), order.getOrderStatus(), target);
        log.info("Payment status applied: venueId={}, orderId={}, intentRef={}, {} -> {}",
                scope.venueId(), order.getId(), intent.getIntentRef(), order.getPaymentStatus(), target);
        return true;
    }

    private <T> T callGateway(Supplier<T> call) {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, paymentExecutor));
        } catch (TimeoutException e) {
            log.warn("Payment gateway timed out after {}", timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_TIMEOUT);
        } catch (RejectedExecutionException e) {
            log.warn("Payment gateway pool saturated by unanswered calls, rejecting: {}", e.getMessage());
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BusinessException businessException) {
                throw businessException;
            }
            log.error("Payment gateway call failed", cause);
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, "Interrupted while calling payment gateway");
        } catch (BusinessException e) {
            throw e;
        } catch (Exception e) {
            log.error("Payment gateway call failed", e);
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR);
        }
    }
}
