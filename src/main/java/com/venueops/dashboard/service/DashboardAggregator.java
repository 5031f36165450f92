package com.venueops.dashboard.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.config.VenueOpsProperties;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.repository.OrderCountsView;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.entity.TableSessionStatus;
import com.venueops.table.repository.TableSessionRepository;
import com.venueops.table.repository.VenueTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Read-only dashboard counters. Counts cover orders whose status is not cancelled,
 * refunded or expired.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DashboardAggregator {

    private static final Set<PaymentStatus> OUTSTANDING = EnumSet.of(PaymentStatus.UNPAID, PaymentStatus.PAY_LATER);
    private static final Set<TableSessionStatus> IN_USE = EnumSet.of(TableSessionStatus.OCCUPIED, TableSessionStatus.SERVED);

    private final OrderRepository orderRepository;
    private final VenueTableRepository tableRepository;
    private final TableSessionRepository sessionRepository;
    private final VenueOpsProperties properties;
    private final Clock clock;

    /**
     * @param timezone          IANA zone id; the configured default when blank
     * @param liveWindowMinutes length of the live bucket; the configured default when null
     */
    public DashboardCounts counts(VenueScope scope, String timezone, Integer liveWindowMinutes) {
        ZoneId zone = resolveZone(timezone);
        int minutes = liveWindowMinutes == null ? properties.dashboard().liveWindowMinutes() : liveWindowMinutes;
        if (minutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "liveWindowMinutes must be positive");
        }

        DashboardWindow window = DashboardWindow.of(clock.instant(), zone, minutes);
        OrderCountsView row = orderRepository.aggregateCounts(scope.venueId(), window.todayStart(),
                window.liveCutoff(), window.tomorrowStart(), OrderStatus.NON_QUALIFYING, OUTSTANDING, PaymentStatus.PAID);

        DashboardCounts counts = new DashboardCounts(
                asLong(row.getLive()),
                asLong(row.getEarlierToday()),
                asLong(row.getHistory()),
                asLong(row.getToday()),
                asLong(row.getUnpaid()),
                asAmount(row.getRevenue()),
                asAmount(row.getPaidRevenue()),
                tableRepository.countByVenueId(scope.venueId()),
                sessionRepository.countOpenByStatus(scope.venueId(), IN_USE),
                zone.getId(),
                window.todayStart(),
                window.liveCutoff());
        log.debug("Dashboard counts: venueId={}, live={}, earlierToday={}, history={}",
                scope.venueId(), counts.liveCount(), counts.earlierTodayCount(), counts.historyCount());
        return counts;
    }

    private ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return properties.defaultZone();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown timezone: " + timezone);
        }
    }

    private static long asLong(Number value) {
        return value == null ? 0L : value.longValue();
    }

    private static BigDecimal asAmount(Number value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        return value instanceof BigDecimal decimal ? decimal : new BigDecimal(value.toString());
    }
}
