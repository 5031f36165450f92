package com.venueops.order.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier until a mail/SMS provider is wired in.
 */
@Slf4j
@Component
public class LoggingReceiptNotifier implements ReceiptNotifier {

    @Override
    public void sendReceipt(OrderCompletedEvent event) {
        log.info("Receipt ready: venueId={}, orderId={}, total={}, customer={}",
                event.venueId(), event.orderId(), event.totalAmount(), event.customerName());
    }
}
