package com.venueops.kitchen.service;

import com.venueops.catalog.service.CatalogLookup;
import com.venueops.common.access.AccessLevel;
import com.venueops.common.access.VenueScope;
import com.venueops.common.config.VenueOpsProperties;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.kitchen.entity.KitchenTicket;
import com.venueops.kitchen.entity.Station;
import com.venueops.kitchen.entity.TicketStatus;
import com.venueops.kitchen.repository.KitchenTicketRepository;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.entity.VenueTable;
import com.venueops.table.repository.VenueTableRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Creates kitchen tickets from order line items, one ticket set per order.
 *
 * <p>The existence check and the insert run in one transaction that holds a row lock on
 * the order, so a direct route racing a backfill for the same order creates exactly one
 * set; whichever gets the lock first wins and the other sees the existing tickets.
 */
@Slf4j
@Service
public class KitchenTicketRouter {

    static final Set<OrderStatus> BACKFILL_ORDER_STATUSES = EnumSet.of(
            OrderStatus.PLACED, OrderStatus.ACCEPTED, OrderStatus.IN_PREP,
            OrderStatus.READY, OrderStatus.SERVING, OrderStatus.SERVED);

    static final Set<PaymentStatus> BACKFILL_PAYMENT_STATUSES = EnumSet.of(
            PaymentStatus.PAID, PaymentStatus.UNPAID, PaymentStatus.PAYMENT_PENDING);

    private final StationRegistry stationRegistry;
    private final StationResolver stationResolver;
    private final CatalogLookup catalogLookup;
    private final OrderRepository orderRepository;
    private final KitchenTicketRepository ticketRepository;
    private final VenueTableRepository tableRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ZoneId defaultZone;

    public KitchenTicketRouter(StationRegistry stationRegistry,
                               StationResolver stationResolver,
                               CatalogLookup catalogLookup,
                               OrderRepository orderRepository,
                               KitchenTicketRepository ticketRepository,
                               VenueTableRepository tableRepository,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               VenueOpsProperties properties) {
        this.stationRegistry = stationRegistry;
        this.stationResolver = stationResolver;
        this.catalogLookup = catalogLookup;
        this.orderRepository = orderRepository;
        this.ticketRepository = ticketRepository;
        this.tableRepository = tableRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.defaultZone = properties.defaultZone();
    }

    public List<Station> ensureStations(VenueScope scope) {
        return stationRegistry.ensureStations(scope.venueId());
    }

    /**
     * Creates one ticket per line item unless the order already has tickets, in which
     * case nothing is written and the existing count is returned.
     */
    public RouteResult routeOrder(VenueScope scope, Long orderId) {
        // Seeding runs outside the routing transaction; a lost insert race there must not
        // poison the lock-check-insert unit below.
        List<Station> stations = stationRegistry.ensureStations(scope.venueId());
        Station defaultStation = stationRegistry.defaultStation(stations);

        RouteResult result = transactionTemplate.execute(status -> {
            Order order = orderRepository.findByIdAndVenueIdWithLock(orderId, scope.venueId())
                    .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

            long existing = ticketRepository.countByOrderId(orderId);
            if (existing > 0) {
                return new RouteResult(orderId, 0, existing);
            }

            String tableLabel = TicketDeriver.tableLabel(
                    storedTableLabel(order), order.getTableNumber(), order.getCustomerName());
            List<TicketSpec> specs = TicketDeriver.delta(
                    TicketDeriver.derive(order, tableLabel, item -> stationResolver.resolve(
                            stations, defaultStation,
                            catalogLookup.categoryOf(scope.venueId(), item.getMenuItemId()),
                            item.getName())),
                    existing);

            Instant now = clock.instant();
            List<KitchenTicket> tickets = specs.stream()
                    .map(spec -> KitchenTicket.builder()
                            .venueId(scope.venueId())
                            .orderId(orderId)
                            .stationId(spec.stationId())
                            .itemName(spec.itemName())
                            .quantity(spec.quantity())
                            .specialInstructions(spec.specialInstructions())
                            .tableNumber(spec.tableNumber())
                            .tableLabel(spec.tableLabel())
                            .createdAt(now)
                            .build())
                    .toList();
            ticketRepository.saveAll(tickets);
            return new RouteResult(orderId, tickets.size(), 0);
        });

        if (result.ticketsCreated() > 0) {
            log.info("Kitchen tickets created: venueId={}, orderId={}, count={}",
                    scope.venueId(), orderId, result.ticketsCreated());
        } else {
            log.debug("Order already routed, skipping: venueId={}, orderId={}, existing={}",
                    scope.venueId(), orderId, result.existingTickets());
        }
        return result;
    }

    /**
     * Routes every order in the window that should have tickets but has none.
     * A failing order is logged and counted; the scan continues.
     */
    public BackfillResult backfill(VenueScope scope, BackfillScope window) {
        Instant since = window.since(clock.instant(), defaultZone);
        List<Long> orderIds = orderRepository.findIdsMissingTickets(
                scope.venueId(), since, BACKFILL_ORDER_STATUSES, BACKFILL_PAYMENT_STATUSES);
        if (orderIds.isEmpty()) {
            return BackfillResult.EMPTY;
        }

        int processed = 0;
        int created = 0;
        int failed = 0;
        for (Long orderId : orderIds) {
            try {
                RouteResult result = routeOrder(scope, orderId);
                processed++;
                created += result.ticketsCreated();
            } catch (RuntimeException e) {
                failed++;
                log.error("Ticket backfill failed for order: venueId={}, orderId={}",
                        scope.venueId(), orderId, e);
            }
        }

        log.info("Ticket backfill finished: venueId={}, window={}, scanned={}, processed={}, created={}, failed={}",
                scope.venueId(), window, orderIds.size(), processed, created, failed);
        return new BackfillResult(orderIds.size(), processed, created, failed);
    }

    /**
     * Maintenance sweep across every venue with recent active orders.
     */
    public BackfillResult backfillAllVenues(AccessLevel accessLevel, BackfillScope window) {
        VenueScope.requireElevated(accessLevel);
        Instant since = window.since(clock.instant(), defaultZone);
        List<String> venueIds = orderRepository.findVenueIdsWithOrdersSince(since, BACKFILL_ORDER_STATUSES);

        BackfillResult total = BackfillResult.EMPTY;
        for (String venueId : venueIds) {
            try {
                total = total.plus(backfill(VenueScope.elevated(venueId), window));
            } catch (RuntimeException e) {
                log.error("Ticket backfill failed for venue: venueId={}", venueId, e);
            }
        }
        return total;
    }

    /**
     * Self-healing read: today's missing tickets are created before the list is returned.
     */
    public List<KitchenTicket> listTickets(VenueScope scope, Long stationId, String status) {
        TicketStatus statusFilter = status == null || status.isBlank() ? null : TicketStatus.from(status);
        backfill(scope, BackfillScope.TODAY);
        Instant todayStart = BackfillScope.TODAY.since(clock.instant(), defaultZone);
        return ticketRepository.search(scope.venueId(), todayStart, stationId, statusFilter);
    }

    @Transactional
    public KitchenTicket updateTicketStatus(VenueScope scope, Long ticketId, String newStatus) {
        TicketStatus status = TicketStatus.from(newStatus);
        KitchenTicket ticket = ticketRepository.findByIdAndVenueId(ticketId, scope.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));

        TicketStatus previous = ticket.getStatus();
        ticket.updateStatus(status, clock.instant());
        log.info("Ticket status updated: venueId={}, ticketId={}, {} -> {}",
                scope.venueId(), ticketId, previous, status);
        return ticket;
    }

    /** Pulls an order's open tickets off the station screens. */
    @Transactional
    public int cancelTicketsForOrder(VenueScope scope, Long orderId) {
        List<KitchenTicket> open = ticketRepository.findByVenueIdAndOrderIdAndStatusIn(
                scope.venueId(), orderId, TicketStatus.OPEN);
        Instant now = clock.instant();
        open.forEach(ticket -> ticket.updateStatus(TicketStatus.CANCELLED, now));
        if (!open.isEmpty()) {
            log.info("Open tickets cancelled: venueId={}, orderId={}, count={}",
                    scope.venueId(), orderId, open.size());
        }
        return open.size();
    }

    private String storedTableLabel(Order order) {
        if (order.getTableId() == null) {
            return null;
        }
        return tableRepository.findByIdAndVenueId(order.getTableId(), order.getVenueId())
                .map(VenueTable::getLabel)
                .orElse(null);
    }
}
