package com.venueops.payment.gateway;

import com.venueops.common.config.VenueOpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory processor for local runs. A new intent reports PENDING until
 * {@code venue-ops.payment.simulated-settle-after} has passed, then SUCCEEDED, which
 * stands in for the customer finishing checkout.
 */
@Slf4j
@Component
public class SimulatedPaymentGateway implements PaymentGateway {

    private final Map<String, Instant> createdAt = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration settleAfter;

    public SimulatedPaymentGateway(Clock clock, VenueOpsProperties properties) {
        this.clock = clock;
        this.settleAfter = properties.payment().simulatedSettleAfter();
    }

    @Override
    public String createIntent(BigDecimal amount, Map<String, String> metadata) {
        String intentRef = "pi_" + UUID.randomUUID().toString().replace("-", "");
        createdAt.put(intentRef, clock.instant());
        log.debug("Simulated intent created: ref={}, amount={}, metadata={}", intentRef, amount, metadata);
        return intentRef;
    }

    @Override
    public IntentStatus getIntentStatus(String intentRef) {
        Instant created = createdAt.get(intentRef);
        if (created == null) {
            throw new IllegalArgumentException("Unknown intent: " + intentRef);
        }
        return clock.instant().isBefore(created.plus(settleAfter)) ? IntentStatus.PENDING : IntentStatus.SUCCEEDED;
    }
}
