package com.venueops.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings under the {@code venue-ops} prefix. Missing sections fall back to the
 * defaults below so the engine runs with an empty configuration.
 */
@ConfigurationProperties(prefix = "venue-ops")
public record VenueOpsProperties(
        String defaultTimezone,
        Dashboard dashboard,
        Kitchen kitchen,
        Payment payment
) {

    public VenueOpsProperties {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            defaultTimezone = "Europe/London";
        }
        if (dashboard == null) {
            dashboard = new Dashboard(0);
        }
        if (kitchen == null) {
            kitchen = new Kitchen(false, null);
        }
        if (payment == null) {
            payment = new Payment(null, null);
        }
    }

    public static VenueOpsProperties defaults() {
        return new VenueOpsProperties(null, null, null, null);
    }

    public ZoneId defaultZone() {
        return ZoneId.of(defaultTimezone);
    }

    public record Dashboard(int liveWindowMinutes) {
        public Dashboard {
            if (liveWindowMinutes <= 0) {
                liveWindowMinutes = 30;
            }
        }
    }

    public record Kitchen(boolean keywordRouting, Backfill backfill) {
        public Kitchen {
            if (backfill == null) {
                backfill = new Backfill(true, null);
            }
        }
    }

    public record Backfill(boolean enabled, Duration interval) {
        public Backfill {
            if (interval == null) {
                interval = Duration.ofMinutes(1);
            }
        }
    }

    /**
     * {@code simulatedSettleAfter} only applies to the in-memory processor used for local runs.
     */
    public record Payment(Duration confirmTimeout, Duration simulatedSettleAfter) {
        public Payment {
            if (confirmTimeout == null) {
                confirmTimeout = Duration.ofSeconds(5);
            }
            if (simulatedSettleAfter == null) {
                simulatedSettleAfter = Duration.ofSeconds(10);
            }
        }
    }
}
