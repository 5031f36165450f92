package com.venueops.dashboard.service;

import java.math.BigDecimal;
import java.time.Instant;

public record DashboardCounts(
        long liveCount,
        long earlierTodayCount,
        long historyCount,
        long todayOrdersCount,
        long unpaidCount,
        BigDecimal revenue,
        BigDecimal paidRevenue,
        long tablesSetUp,
        long tablesInUse,
        String timezone,
        Instant todayStart,
        Instant liveCutoff
) {
}
