package com.venueops.kitchen.scheduler;

import com.venueops.common.access.AccessLevel;
import com.venueops.kitchen.service.BackfillResult;
import com.venueops.kitchen.service.BackfillScope;
import com.venueops.kitchen.service.KitchenTicketRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep that creates tickets for recent orders whose direct routing failed.
 * Runs as a system job, so it is the one caller allowed to act across venues.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "venue-ops.kitchen.backfill", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class TicketBackfillScheduler {

    private final KitchenTicketRouter ticketRouter;

    @Scheduled(fixedDelayString = "${venue-ops.kitchen.backfill.interval:PT1M}",
            initialDelayString = "${venue-ops.kitchen.backfill.interval:PT1M}")
    public void backfillLiveOrders() {
        try {
            BackfillResult result = ticketRouter.backfillAllVenues(AccessLevel.ELEVATED, BackfillScope.LIVE);
            if (result.ticketsCreated() > 0 || result.failed() > 0) {
                log.info("Scheduled ticket backfill: scanned={}, created={}, failed={}",
                        result.scanned(), result.ticketsCreated(), result.failed());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled ticket backfill failed", e);
        }
    }
}
