package com.venueops.order.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.common.result.OperationResult;
import com.venueops.common.result.SideEffectOutcome;
import com.venueops.kitchen.service.KitchenTicketRouter;
import com.venueops.kitchen.service.RouteResult;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderItem;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentMode;
import com.venueops.order.entity.PaymentStatus;
import com.venueops.order.event.OrderCompletedEvent;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.service.ReleaseOutcome;
import com.venueops.table.service.TableRef;
import com.venueops.table.service.TableSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the order's two status axes. Every status change goes through {@link #transition},
 * which checks the transition tables and writes with a compare-and-set on the statuses it
 * read.
 *
 * <p>The order write commits on its own. Ticket seeding, table release, ticket
 * cancellation and the receipt run afterwards as best-effort side effects: each one's
 * failure is logged and reported in the {@link OperationResult}, never thrown.
 */
@Slf4j
@Service
public class OrderLifecycleService {

    static final String KITCHEN_TICKETS = "kitchen-tickets";
    static final String TABLE_OCCUPANCY = "table-occupancy";
    static final String TABLE_RELEASE = "table-release";
    static final String TICKET_CANCELLATION = "ticket-cancellation";
    static final String RECEIPT = "receipt-notification";

    private static final int MAX_ATTEMPTS = 2;

    private final OrderRepository orderRepository;
    private final KitchenTicketRouter ticketRouter;
    private final TableSessionManager tableSessionManager;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public OrderLifecycleService(OrderRepository orderRepository,
                                 KitchenTicketRouter ticketRouter,
                                 TableSessionManager tableSessionManager,
                                 ApplicationEventPublisher eventPublisher,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.orderRepository = orderRepository;
        this.ticketRouter = ticketRouter;
        this.tableSessionManager = tableSessionManager;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Places an order in PLACED with the payment status implied by its payment mode,
     * then seeds kitchen tickets and marks the table occupied.
     */
    public OperationResult<Order> createOrder(VenueScope scope, List<LineItem> lineItems, TableRef tableRef,
                                              PaymentMode paymentMode, String customerName) {
        if (lineItems == null || lineItems.isEmpty()) {
            throw new BusinessException(ErrorCode.EMPTY_ORDER);
        }
        for (int i = 0; i < lineItems.size(); i++) {
            LineItem item = lineItems.get(i);
            if (item == null || !item.isValid()) {
                throw new BusinessException(ErrorCode.INVALID_LINE_ITEM,
                        "Line item " + (i + 1) + " needs quantity > 0 and a non-negative price");
            }
        }

        TableRef ref = tableRef == null ? TableRef.of(null, null) : tableRef;
        Order order = transactionTemplate.execute(status -> {
            Order created = Order.builder()
                    .venueId(scope.venueId())
                    .paymentMode(paymentMode)
                    .tableId(ref.tableId())
                    .tableNumber(ref.tableNumber())
                    .customerName(customerName)
                    .createdAt(clock.instant())
                    .build();
            lineItems.forEach(item -> created.addItem(OrderItem.builder()
                    .menuItemId(item.menuItemId())
                    .name(item.name())
                    .quantity(item.quantity())
                    .unitPrice(item.unitPrice())
                    .specialInstructions(item.specialInstructions())
                    .modifiers(item.modifiers())
                    .build()));
            return orderRepository.save(created);
        });
        log.info("Order created: venueId={}, orderId={}, items={}, total={}, payment={}",
                scope.venueId(), order.getId(), lineItems.size(), order.getTotalAmount(), order.getPaymentStatus());

        List<SideEffectOutcome> sideEffects = new ArrayList<>();
        sideEffects.add(seedTickets(scope, order));
        if (!ref.isEmpty()) {
            sideEffects.add(occupyTable(scope, ref, order));
        }
        return OperationResult.of(order, sideEffects);
    }

    /**
     * Moves the order to {@code targetOrderStatus} and, optionally, the payment axis to
     * {@code targetPaymentStatus}. Passing the current order status with a new payment
     * status changes the payment axis only.
     *
     * <p>If another writer changes the order between read and write, the order is re-read
     * and the request re-validated once. A request that was legal against the first read
     * but not the second fails with {@code CONCURRENT_MODIFICATION}.
     */
    public OperationResult<Order> transition(VenueScope scope, Long orderId,
                                             OrderStatus targetOrderStatus, PaymentStatus targetPaymentStatus) {
        if (targetOrderStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Target order status is required");
        }

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            boolean retry = attempt > 1;
            Applied applied = transactionTemplate.execute(status -> {
                Order current = orderRepository.findByIdAndVenueId(orderId, scope.venueId())
                        .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

                StatusChange change;
                try {
                    change = StatusChange.plan(current, targetOrderStatus, targetPaymentStatus);
                } catch (BusinessException e) {
                    if (retry) {
                        throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                                "Order " + orderId + " changed concurrently and is now "
                                        + current.getOrderStatus() + "/" + current.getPaymentStatus());
                    }
                    throw e;
                }

                Instant now = clock.instant();
                int updated = orderRepository.updateStatusIfUnchanged(
                        orderId, scope.venueId(),
                        change.fromOrder(), change.fromPayment(),
                        change.toOrder(), change.toPayment(),
                        change.servedAt(current, now), change.completedAt(current, now), now);
                if (updated == 0) {
                    return null;
                }
                Order reloaded = orderRepository.findWithItemsByIdAndVenueId(orderId, scope.venueId())
                        .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
                return new Applied(change, reloaded);
            });

            if (applied != null) {
                StatusChange change = applied.change();
                log.info("Order transitioned: venueId={}, orderId={}, {}/{} -> {}/{}",
                        scope.venueId(), orderId, change.fromOrder(), change.fromPayment(),
                        change.toOrder(), change.toPayment());
                return OperationResult.of(applied.order(), afterTransition(scope, applied.order(), change));
            }
            log.warn("Order status changed during transition, re-reading: venueId={}, orderId={}, attempt={}",
                    scope.venueId(), orderId, attempt);
        }
        throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                "Order " + orderId + " kept changing, re-read and retry");
    }

    /**
     * Changes the customer's declared payment intent. Locked once the order is paid,
     * refunded, completed or otherwise closed.
     */
    @Transactional
    public Order updatePaymentMode(VenueScope scope, Long orderId, PaymentMode paymentMode) {
        if (paymentMode == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payment mode is required");
        }
        Order order = orderRepository.findByIdAndVenueIdWithLock(orderId, scope.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));

        if (order.getPaymentStatus().isSettled() || order.getOrderStatus().isTerminal()) {
            throw new BusinessException(ErrorCode.PAYMENT_MODE_LOCKED);
        }
        PaymentMode previous = order.getPaymentMode();
        if (previous != paymentMode) {
            order.changePaymentMode(paymentMode, clock.instant());
            log.info("Payment mode changed: venueId={}, orderId={}, {} -> {}",
                    scope.venueId(), orderId, previous, paymentMode);
        }
        return order;
    }

    @Transactional(readOnly = true)
    public Order getOrder(VenueScope scope, Long orderId) {
        return orderRepository.findWithItemsByIdAndVenueId(orderId, scope.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public List<Order> listActiveOrdersForTable(VenueScope scope, Long tableId) {
        return orderRepository.findByVenueIdAndTableIdAndOrderStatusNotInOrderByCreatedAtAsc(
                scope.venueId(), tableId, OrderStatus.TERMINAL);
    }

    private List<SideEffectOutcome> afterTransition(VenueScope scope, Order order, StatusChange change) {
        List<SideEffectOutcome> sideEffects = new ArrayList<>();
        if (change.closesOrder() && order.hasTable()) {
            sideEffects.add(releaseTable(scope, order));
        }
        if (change.toOrder() == OrderStatus.CANCELLED) {
            sideEffects.add(cancelTickets(scope, order));
        }
        if (change.toOrder() == OrderStatus.COMPLETED && change.fromOrder() != OrderStatus.COMPLETED) {
            sideEffects.add(publishReceipt(order));
        }
        return sideEffects;
    }

    private SideEffectOutcome seedTickets(VenueScope scope, Order order) {
        try {
            RouteResult result = ticketRouter.routeOrder(scope, order.getId());
            return SideEffectOutcome.success(KITCHEN_TICKETS, result.ticketsCreated() + " tickets created");
        } catch (RuntimeException e) {
            log.error("Kitchen ticket creation failed, backfill will retry: venueId={}, orderId={}",
                    scope.venueId(), order.getId(), e);
            return SideEffectOutcome.failure(KITCHEN_TICKETS, e.getMessage());
        }
    }

    private SideEffectOutcome occupyTable(VenueScope scope, TableRef ref, Order order) {
        try {
            String detail = tableSessionManager.occupyForOrder(scope, ref, order.getId())
                    .map(state -> "table " + state.tableId() + " " + state.status())
                    .orElse("no matching table");
            return SideEffectOutcome.success(TABLE_OCCUPANCY, detail);
        } catch (RuntimeException e) {
            log.warn("Table occupancy update failed: venueId={}, orderId={}, table={}",
                    scope.venueId(), order.getId(), ref, e);
            return SideEffectOutcome.failure(TABLE_OCCUPANCY, e.getMessage());
        }
    }

    private SideEffectOutcome releaseTable(VenueScope scope, Order order) {
        try {
            ReleaseOutcome outcome = tableSessionManager.release(
                    scope, TableRef.of(order.getTableId(), order.getTableNumber()), order.getId());
            return SideEffectOutcome.success(TABLE_RELEASE, outcome.name());
        } catch (RuntimeException e) {
            log.warn("Table release failed, table needs manual reset: venueId={}, orderId={}, tableId={}, tableNumber={}",
                    scope.venueId(), order.getId(), order.getTableId(), order.getTableNumber(), e);
            return SideEffectOutcome.failure(TABLE_RELEASE, e.getMessage());
        }
    }

    private SideEffectOutcome cancelTickets(VenueScope scope, Order order) {
        try {
            int cancelled = ticketRouter.cancelTicketsForOrder(scope, order.getId());
            return SideEffectOutcome.success(TICKET_CANCELLATION, cancelled + " tickets cancelled");
        } catch (RuntimeException e) {
            log.warn("Ticket cancellation failed: venueId={}, orderId={}", scope.venueId(), order.getId(), e);
            return SideEffectOutcome.failure(TICKET_CANCELLATION, e.getMessage());
        }
    }

    private SideEffectOutcome publishReceipt(Order order) {
        try {
            eventPublisher.publishEvent(new OrderCompletedEvent(
                    order.getId(), order.getVenueId(), order.getTotalAmount(),
                    order.getCustomerName(), order.getCompletedAt()));
            return SideEffectOutcome.success(RECEIPT, "queued");
        } catch (RuntimeException e) {
            log.warn("Receipt event could not be published: venueId={}, orderId={}",
                    order.getVenueId(), order.getId(), e);
            return SideEffectOutcome.failure(RECEIPT, e.getMessage());
        }
    }

    private record Applied(StatusChange change, Order order) {
    }
}
