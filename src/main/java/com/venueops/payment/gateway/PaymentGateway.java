package com.venueops.payment.gateway;

import java.math.BigDecimal;
import java.util.Map;

/**
 * External payment processor. Calls go over the network and may hang; callers bound
 * them with a time limit.
 */
public interface PaymentGateway {

    /** Registers a payment intent with the processor and returns its reference. */
    String createIntent(BigDecimal amount, Map<String, String> metadata);

    IntentStatus getIntentStatus(String intentRef);
}
