package com.venueops.order.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReceiptNotificationListener {

    private final ReceiptNotifier receiptNotifier;

    /**
     * Runs after the completing transaction commits, off the request thread.
     * A delivery failure is logged and dropped; the order stays COMPLETED.
     */
    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void onOrderCompleted(OrderCompletedEvent event) {
        try {
            receiptNotifier.sendReceipt(event);
        } catch (RuntimeException e) {
            log.warn("Receipt notification failed: venueId={}, orderId={}", event.venueId(), event.orderId(), e);
        }
    }
}
