package com.venueops.kitchen.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public enum BackfillScope {

    /** The last 30 minutes. */
    LIVE {
        @Override
        public Instant since(Instant now, ZoneId zone) {
            return now.minus(LIVE_WINDOW);
        }
    },

    /** Since local midnight in the venue's timezone. */
    TODAY {
        @Override
        public Instant since(Instant now, ZoneId zone) {
            return LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
        }
    };

    private static final Duration LIVE_WINDOW = Duration.ofMinutes(30);

    public abstract Instant since(Instant now, ZoneId zone);
}
