package com.venueops.table.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.repository.OrderRepository;
import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import com.venueops.table.entity.VenueTable;
import com.venueops.table.repository.TableSessionRepository;
import com.venueops.table.repository.VenueTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns table occupancy: seating, merge/unmerge and release on order completion.
 *
 * <p>Every state-opening operation locks the table row first and checks that no other
 * session is open, so the one-open-session-per-table rule holds under concurrent calls.
 * Merge and unmerge lock both rows in id order and run as one transaction; a failure
 * leaves neither table changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TableSessionManager {

    private static final Set<TableSessionStatus> SEATABLE =
            EnumSet.of(TableSessionStatus.FREE, TableSessionStatus.RESERVED);

    private static final Set<TableSessionStatus> RELEASABLE =
            EnumSet.of(TableSessionStatus.OCCUPIED, TableSessionStatus.SERVED);

    private static final Set<TableSessionStatus> RESERVABLE =
            EnumSet.of(TableSessionStatus.FREE, TableSessionStatus.OCCUPIED);

    private final VenueTableRepository tableRepository;
    private final TableSessionRepository sessionRepository;
    private final OrderRepository orderRepository;
    private final Clock clock;

    @Transactional
    public TableState createTable(VenueScope scope, String label, int seatCount, Integer tableNumber) {
        if (label == null || label.isBlank() || seatCount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table needs a label and a positive seat count");
        }
        VenueTable table = tableRepository.save(VenueTable.builder()
                .venueId(scope.venueId())
                .label(label.trim())
                .seatCount(seatCount)
                .tableNumber(tableNumber)
                .build());
        TableSession session = openSession(table, TableSessionStatus.FREE, null, null, null, null);

        log.info("Table created: venueId={}, tableId={}, label={}", scope.venueId(), table.getId(), table.getLabel());
        return TableState.of(table, session);
    }

    public List<TableState> listTables(VenueScope scope) {
        Map<Long, TableSession> openByTable = sessionRepository.findByVenueIdAndClosedAtIsNull(scope.venueId())
                .stream()
                .collect(Collectors.toMap(TableSession::getTableId, Function.identity(),
                        (first, second) -> first.getOpenedAt().isAfter(second.getOpenedAt()) ? first : second));
        return tableRepository.findByVenueIdOrderByIdAsc(scope.venueId()).stream()
                .map(table -> TableState.of(table, openByTable.get(table.getId())))
                .toList();
    }

    public TableState getTable(VenueScope scope, Long tableId) {
        VenueTable table = findTable(scope, tableId);
        return TableState.of(table, currentSession(table.getId()).orElse(null));
    }

    /**
     * Opens an OCCUPIED session. A FREE or RESERVED placeholder session is closed first;
     * any other open session means the table is taken.
     */
    @Transactional
    public TableState seat(VenueScope scope, Long tableId, String serverId, Integer guestCount, String reservationId) {
        VenueTable table = lockTable(scope, tableId);
        TableSession session = seatLocked(table, null, serverId, guestCount, reservationId);

        log.info("Table seated: venueId={}, tableId={}, guests={}", scope.venueId(), tableId, guestCount);
        return TableState.of(table, session);
    }

    /**
     * Marks the order's table occupied when the order is placed. Tables that are already
     * occupied, merged or being cleaned are left as they are.
     */
    @Transactional
    public Optional<TableState> occupyForOrder(VenueScope scope, TableRef ref, Long orderId) {
        Optional<VenueTable> found = resolveTable(scope, ref);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        VenueTable table = lockTable(scope, found.get().getId());
        TableSessionStatus current = effectiveStatus(table.getId());
        if (!SEATABLE.contains(current)) {
            return Optional.of(TableState.of(table, currentSession(table.getId()).orElse(null)));
        }
        TableSession session = seatLocked(table, orderId, null, null, null);
        log.info("Table occupied by order: venueId={}, tableId={}, orderId={}", scope.venueId(), table.getId(), orderId);
        return Optional.of(TableState.of(table, session));
    }

    /**
     * Combines two free tables into one logical table headed by {@code primaryTableId}.
     */
    @Transactional
    public MergeResult merge(VenueScope scope, Long primaryTableId, Long secondaryTableId) {
        if (primaryTableId == null || primaryTableId.equals(secondaryTableId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "A table cannot be merged with itself");
        }
        List<VenueTable> locked = lockInOrder(scope, primaryTableId, secondaryTableId);
        VenueTable primary = locked.get(0).getId().equals(primaryTableId) ? locked.get(0) : locked.get(1);
        VenueTable secondary = primary == locked.get(0) ? locked.get(1) : locked.get(0);

        // Depth 1 only: neither side may already be a member, and the secondary may not head a group.
        if (primary.isMergeMember() || secondary.isMergeMember()
                || tableRepository.existsByVenueIdAndMergedWithTableId(scope.venueId(), secondary.getId())) {
            throw new BusinessException(ErrorCode.MERGE_DEPTH_EXCEEDED);
        }
        if (effectiveStatus(primary.getId()) != TableSessionStatus.FREE
                || effectiveStatus(secondary.getId()) != TableSessionStatus.FREE) {
            throw new BusinessException(ErrorCode.TABLE_NOT_FREE);
        }

        Instant now = clock.instant();
        primary.absorb(secondary);
        secondary.attachTo(primary);

        TableSession primarySession = currentSession(primary.getId())
                .map(session -> {
                    session.changeStatus(TableSessionStatus.MERGED);
                    return session;
                })
                .orElseGet(() -> openSession(primary, TableSessionStatus.MERGED, null, null, null, null));
        closeOpenSessions(secondary.getId(), now);
        TableSession secondarySession = openSession(secondary, TableSessionStatus.MERGED, null, null, null, null);

        log.info("Tables merged: venueId={}, primary={}, secondary={}, label={}, seats={}",
                scope.venueId(), primary.getId(), secondary.getId(), primary.getLabel(), primary.getSeatCount());
        return new MergeResult(TableState.of(primary, primarySession), TableState.of(secondary, secondarySession));
    }

    /**
     * Reverses a merge. Accepts the member table, or the primary when it heads exactly
     * one member.
     */
    @Transactional
    public MergeResult unmerge(VenueScope scope, Long tableId) {
        VenueTable table = findTable(scope, tableId);
        Long primaryId;
        Long secondaryId;
        if (table.isMergeMember()) {
            primaryId = table.getMergedWithTableId();
            secondaryId = table.getId();
        } else {
            List<VenueTable> members = tableRepository.findByVenueIdAndMergedWithTableId(scope.venueId(), tableId);
            if (members.size() != 1) {
                throw new BusinessException(ErrorCode.TABLE_NOT_MERGED);
            }
            primaryId = table.getId();
            secondaryId = members.get(0).getId();
        }

        List<VenueTable> locked = lockInOrder(scope, primaryId, secondaryId);
        VenueTable primary = locked.get(0).getId().equals(primaryId) ? locked.get(0) : locked.get(1);
        VenueTable secondary = primary == locked.get(0) ? locked.get(1) : locked.get(0);
        if (!primaryId.equals(secondary.getMergedWithTableId())) {
            throw new BusinessException(ErrorCode.TABLE_NOT_MERGED);
        }

        Instant now = clock.instant();
        secondary.restore();
        if (!tableRepository.existsByVenueIdAndMergedWithTableId(scope.venueId(), primary.getId())) {
            primary.restore();
        }
        closeOpenSessions(primary.getId(), now);
        closeOpenSessions(secondary.getId(), now);
        TableSession primarySession = openSession(primary, TableSessionStatus.FREE, null, null, null, null);
        TableSession secondarySession = openSession(secondary, TableSessionStatus.FREE, null, null, null, null);

        log.info("Tables unmerged: venueId={}, primary={}, secondary={}", scope.venueId(), primary.getId(), secondary.getId());
        return new MergeResult(TableState.of(primary, primarySession), TableState.of(secondary, secondarySession));
    }

    /**
     * Frees the order's table once no other active order holds it. The sibling count
     * excludes the order being released.
     */
    @Transactional
    public ReleaseOutcome release(VenueScope scope, TableRef ref, Long orderId) {
        Optional<VenueTable> found = resolveTable(scope, ref);
        if (found.isEmpty()) {
            return ReleaseOutcome.NO_TABLE;
        }
        VenueTable table = lockTable(scope, found.get().getId());

        if (countOtherActiveOrders(scope, ref, table, orderId) > 0) {
            log.info("Table kept occupied, other active orders remain: venueId={}, tableId={}, releasedOrderId={}",
                    scope.venueId(), table.getId(), orderId);
            return ReleaseOutcome.STILL_OCCUPIED;
        }

        Optional<TableSession> open = currentSession(table.getId());
        if (open.isEmpty() || !RELEASABLE.contains(open.get().getStatus())) {
            return ReleaseOutcome.NOT_OCCUPIED;
        }
        open.get().closeAsFree(clock.instant());

        log.info("Table released: venueId={}, tableId={}, orderId={}", scope.venueId(), table.getId(), orderId);
        return ReleaseOutcome.RELEASED;
    }

    @Transactional
    public TableState markCleaning(VenueScope scope, Long tableId) {
        return override(scope, tableId, TableSessionStatus.CLEANING);
    }

    @Transactional
    public TableState markFree(VenueScope scope, Long tableId) {
        return override(scope, tableId, TableSessionStatus.FREE);
    }

    /** Hook for the reservation system: FREE or OCCUPIED tables can be held. */
    @Transactional
    public TableState markReserved(VenueScope scope, Long tableId, String reservationId) {
        VenueTable table = lockTable(scope, tableId);
        rejectMerged(scope, table);
        if (!RESERVABLE.contains(effectiveStatus(tableId))) {
            throw new BusinessException(ErrorCode.INVALID_TABLE_STATUS,
                    "Only free or occupied tables can be reserved");
        }
        closeOpenSessions(tableId, clock.instant());
        TableSession session = openSession(table, TableSessionStatus.RESERVED, null, null, null, reservationId);

        log.info("Table reserved: venueId={}, tableId={}, reservationId={}", scope.venueId(), tableId, reservationId);
        return TableState.of(table, session);
    }

    public TableSessionStatus effectiveStatus(Long tableId) {
        return currentSession(tableId).map(TableSession::getStatus).orElse(TableSessionStatus.FREE);
    }

    // Manual staff correction: close whatever is open and start over in the target state.
    private TableState override(VenueScope scope, Long tableId, TableSessionStatus target) {
        VenueTable table = lockTable(scope, tableId);
        rejectMerged(scope, table);
        TableSessionStatus previous = effectiveStatus(tableId);
        closeOpenSessions(tableId, clock.instant());
        TableSession session = openSession(table, target, null, null, null, null);

        log.info("Table status overridden: venueId={}, tableId={}, {} -> {}", scope.venueId(), tableId, previous, target);
        return TableState.of(table, session);
    }

    private TableSession seatLocked(VenueTable table, Long orderId, String serverId,
                                    Integer guestCount, String reservationId) {
        Optional<TableSession> open = currentSession(table.getId());
        if (open.isPresent() && !SEATABLE.contains(open.get().getStatus())) {
            throw new BusinessException(ErrorCode.TABLE_ALREADY_OCCUPIED);
        }
        String reservation = reservationId;
        if (open.isPresent() && reservation == null) {
            reservation = open.get().getReservationId();
        }
        closeOpenSessions(table.getId(), clock.instant());
        return openSession(table, TableSessionStatus.OCCUPIED, orderId, serverId, guestCount, reservation);
    }

    private TableSession openSession(VenueTable table, TableSessionStatus status, Long orderId,
                                     String serverId, Integer guestCount, String reservationId) {
        if (!sessionRepository.findByTableIdAndClosedAtIsNull(table.getId()).isEmpty()) {
            throw new BusinessException(ErrorCode.TABLE_ALREADY_OCCUPIED);
        }
        return sessionRepository.save(TableSession.builder()
                .tableId(table.getId())
                .venueId(table.getVenueId())
                .status(status)
                .openedAt(clock.instant())
                .orderId(orderId)
                .serverId(serverId)
                .guestCount(guestCount)
                .reservationId(reservationId)
                .build());
    }

    private void closeOpenSessions(Long tableId, Instant now) {
        sessionRepository.findByTableIdAndClosedAtIsNull(tableId).forEach(session -> session.close(now));
        sessionRepository.flush();
    }

    private Optional<TableSession> currentSession(Long tableId) {
        return sessionRepository.findFirstByTableIdAndClosedAtIsNullOrderByOpenedAtDesc(tableId);
    }

    private long countOtherActiveOrders(VenueScope scope, TableRef ref, VenueTable table, Long orderId) {
        long count = orderRepository.countByVenueIdAndTableIdAndIdNotAndOrderStatusNotIn(
                scope.venueId(), table.getId(), orderId, OrderStatus.TERMINAL);
        Integer tableNumber = ref.tableNumber() != null ? ref.tableNumber() : table.getTableNumber();
        if (count == 0 && tableNumber != null) {
            count = orderRepository.countByVenueIdAndTableNumberAndIdNotAndOrderStatusNotIn(
                    scope.venueId(), tableNumber, orderId, OrderStatus.TERMINAL);
        }
        return count;
    }

    private void rejectMerged(VenueScope scope, VenueTable table) {
        if (table.isMergeMember() || tableRepository.existsByVenueIdAndMergedWithTableId(scope.venueId(), table.getId())) {
            throw new BusinessException(ErrorCode.TABLE_MERGED);
        }
    }

    private Optional<VenueTable> resolveTable(VenueScope scope, TableRef ref) {
        if (ref == null || ref.isEmpty()) {
            return Optional.empty();
        }
        if (ref.tableId() != null) {
            return tableRepository.findByIdAndVenueId(ref.tableId(), scope.venueId());
        }
        return tableRepository.findFirstByVenueIdAndTableNumberOrderByIdAsc(scope.venueId(), ref.tableNumber());
    }

    private VenueTable findTable(VenueScope scope, Long tableId) {
        return tableRepository.findByIdAndVenueId(tableId, scope.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.TABLE_NOT_FOUND));
    }

    private VenueTable lockTable(VenueScope scope, Long tableId) {
        return tableRepository.findByIdAndVenueIdWithLock(tableId, scope.venueId())
                .orElseThrow(() -> new BusinessException(ErrorCode.TABLE_NOT_FOUND));
    }

    private List<VenueTable> lockInOrder(VenueScope scope, Long first, Long second) {
        Long low = Math.min(first, second);
        Long high = Math.max(first, second);
        return List.of(lockTable(scope, low), lockTable(scope, high));
    }
}
