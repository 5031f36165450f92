package com.venueops.dashboard.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * The time buckets for one dashboard read.
 *
 * <p>{@code todayStart} and {@code tomorrowStart} are local midnights in the venue's zone
 * (so a DST day is 23 or 25 hours long), and {@code liveCutoff} is {@code now - window},
 * never earlier than {@code todayStart}, so the live bucket cannot reach into yesterday.
 * All intervals are half-open: history is {@code [.., todayStart)}, earlier-today is
 * {@code [todayStart, liveCutoff)} and live is {@code [liveCutoff, tomorrowStart)}.
 */
public record DashboardWindow(Instant todayStart, Instant liveCutoff, Instant tomorrowStart) {

    public static DashboardWindow of(Instant now, ZoneId zone, int liveWindowMinutes) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant todayStart = today.atStartOfDay(zone).toInstant();
        Instant windowStart = now.minus(Duration.ofMinutes(liveWindowMinutes));
        Instant liveCutoff = windowStart.isBefore(todayStart) ? todayStart : windowStart;
        return new DashboardWindow(todayStart, liveCutoff, today.plusDays(1).atStartOfDay(zone).toInstant());
    }
}
