package com.venueops.order.event;

/**
 * Outbound receipt delivery (email, SMS). Implementations may throw; callers treat
 * delivery as fire-and-forget.
 */
public interface ReceiptNotifier {

    void sendReceipt(OrderCompletedEvent event);
}
