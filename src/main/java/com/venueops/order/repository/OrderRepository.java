package com.venueops.order.repository;

import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Every query is scoped by venue id; callers never see another venue's rows.
 */
public interface OrderRepository extends JpaRepository<Order, Long> {

    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id AND o.venueId = :venueId")
    Optional<Order> findWithItemsByIdAndVenueId(@Param("id") Long id, @Param("venueId") String venueId);

    Optional<Order> findByIdAndVenueId(Long id, String venueId);

    /**
     * SELECT ... FOR UPDATE on the order row. Ticket routing takes this lock before its
     * existence check so a direct route and a concurrent backfill serialize per order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id AND o.venueId = :venueId")
    Optional<Order> findByIdAndVenueIdWithLock(@Param("id") Long id, @Param("venueId") String venueId);

    /**
     * Compare-and-set on both status axes. Returns 0 when another writer changed either
     * status since the caller read it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Order o
               SET o.orderStatus = :toOrder,
                   o.paymentStatus = :toPayment,
                   o.servedAt = :servedAt,
                   o.completedAt = :completedAt,
                   o.updatedAt = :now,
                   o.version = o.version + 1
             WHERE o.id = :id
               AND o.venueId = :venueId
               AND o.orderStatus = :fromOrder
               AND o.paymentStatus = :fromPayment
            """)
    int updateStatusIfUnchanged(@Param("id") Long id,
                                @Param("venueId") String venueId,
                                @Param("fromOrder") OrderStatus fromOrder,
                                @Param("fromPayment") PaymentStatus fromPayment,
                                @Param("toOrder") OrderStatus toOrder,
                                @Param("toPayment") PaymentStatus toPayment,
                                @Param("servedAt") Instant servedAt,
                                @Param("completedAt") Instant completedAt,
                                @Param("now") Instant now);

    // Table linkage

    long countByVenueIdAndTableIdAndIdNotAndOrderStatusNotIn(
            String venueId, Long tableId, Long excludedOrderId, Collection<OrderStatus> statuses);

    long countByVenueIdAndTableNumberAndIdNotAndOrderStatusNotIn(
            String venueId, Integer tableNumber, Long excludedOrderId, Collection<OrderStatus> statuses);

    List<Order> findByVenueIdAndTableIdAndOrderStatusNotInOrderByCreatedAtAsc(
            String venueId, Long tableId, Collection<OrderStatus> statuses);

    // Kitchen backfill

    @Query("""
            SELECT o.id FROM Order o
             WHERE o.venueId = :venueId
               AND o.createdAt >= :since
               AND o.orderStatus IN :orderStatuses
               AND o.paymentStatus IN :paymentStatuses
               AND NOT EXISTS (SELECT t.id FROM KitchenTicket t WHERE t.orderId = o.id)
             ORDER BY o.createdAt ASC
            """)
    List<Long> findIdsMissingTickets(@Param("venueId") String venueId,
                                     @Param("since") Instant since,
                                     @Param("orderStatuses") Collection<OrderStatus> orderStatuses,
                                     @Param("paymentStatuses") Collection<PaymentStatus> paymentStatuses);

    @Query("""
            SELECT DISTINCT o.venueId FROM Order o
             WHERE o.createdAt >= :since
               AND o.orderStatus IN :orderStatuses
            """)
    List<String> findVenueIdsWithOrdersSince(@Param("since") Instant since,
                                             @Param("orderStatuses") Collection<OrderStatus> orderStatuses);

    // Dashboard

    /**
     * All dashboard buckets from one statement, so the buckets come from one consistent
     * snapshot and always add up. Buckets are half-open: history is before
     * {@code todayStart}, earlier-today is up to {@code liveCutoff}, live is from it up to
     * {@code tomorrowStart}. Rows stamped on a later local day count nowhere.
     */
    @Query("""
            SELECT COALESCE(SUM(CASE WHEN o.createdAt >= :liveCutoff AND o.createdAt < :tomorrowStart
                                     THEN 1 ELSE 0 END), 0) AS live,
                   COALESCE(SUM(CASE WHEN o.createdAt >= :todayStart AND o.createdAt < :liveCutoff
                                     THEN 1 ELSE 0 END), 0) AS earlierToday,
                   COALESCE(SUM(CASE WHEN o.createdAt < :todayStart THEN 1 ELSE 0 END), 0) AS history,
                   COALESCE(SUM(CASE WHEN o.createdAt >= :todayStart AND o.createdAt < :tomorrowStart
                                     THEN 1 ELSE 0 END), 0) AS today,
                   COALESCE(SUM(CASE WHEN o.createdAt >= :todayStart AND o.createdAt < :tomorrowStart
                                          AND o.paymentStatus IN :outstanding
                                     THEN 1 ELSE 0 END), 0) AS unpaid,
                   COALESCE(SUM(CASE WHEN o.createdAt >= :todayStart AND o.createdAt < :tomorrowStart
                                     THEN o.totalAmount ELSE 0 END), 0) AS revenue,
                   COALESCE(SUM(CASE WHEN o.createdAt >= :todayStart AND o.createdAt < :tomorrowStart
                                          AND o.paymentStatus = :paid
                                     THEN o.totalAmount ELSE 0 END), 0) AS paidRevenue
              FROM Order o
             WHERE o.venueId = :venueId
               AND o.orderStatus NOT IN :excluded
            """)
    OrderCountsView aggregateCounts(@Param("venueId") String venueId,
                                    @Param("todayStart") Instant todayStart,
                                    @Param("liveCutoff") Instant liveCutoff,
                                    @Param("tomorrowStart") Instant tomorrowStart,
                                    @Param("excluded") Collection<OrderStatus> excluded,
                                    @Param("outstanding") Collection<PaymentStatus> outstanding,
                                    @Param("paid") PaymentStatus paid);
}
