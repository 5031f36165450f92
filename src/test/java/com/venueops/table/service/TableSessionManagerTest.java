package com.venueops.table.service;

import com.venueops.common.access.VenueScope;
import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.PaymentMode;
import com.venueops.order.repository.OrderRepository;
import com.venueops.support.EngineTestConfig;
import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import com.venueops.table.repository.TableSessionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(EngineTestConfig.class)
class TableSessionManagerTest {

    private final VenueScope scope = VenueScope.scoped("venue-1");

    @Autowired
    private TableSessionManager tableSessionManager;

    @Autowired
    private TableSessionRepository sessionRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Test
    @DisplayName("A new table starts free with one open session")
    void createTable() {
        TableState table = tableSessionManager.createTable(scope, "T1", 2, 1);

        assertThat(table.status()).isEqualTo(TableSessionStatus.FREE);
        assertThat(sessionRepository.findByTableIdAndClosedAtIsNull(table.tableId())).hasSize(1);
    }

    @Test
    @DisplayName("Seating a free table occupies it; seating it again is a conflict")
    void seat_SecondSeatConflicts() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T1", 4, 1);

        // When
        TableState seated = tableSessionManager.seat(scope, table.tableId(), "server-7", 3, null);

        // Then
        assertThat(seated.status()).isEqualTo(TableSessionStatus.OCCUPIED);
        assertThat(sessionRepository.findByTableIdAndClosedAtIsNull(table.tableId())).hasSize(1);
        assertThatThrownBy(() -> tableSessionManager.seat(scope, table.tableId(), "server-8", 2, null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_ALREADY_OCCUPIED);
    }

    @Test
    @DisplayName("Seating a reserved table keeps the reservation on the new session")
    void seat_ReservedTableKeepsReservation() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T1", 4, 1);
        tableSessionManager.markReserved(scope, table.tableId(), "res-42");

        // When
        TableState seated = tableSessionManager.seat(scope, table.tableId(), null, 4, null);

        // Then
        TableSession session = sessionRepository.findById(seated.sessionId()).orElseThrow();
        assertThat(session.getStatus()).isEqualTo(TableSessionStatus.OCCUPIED);
        assertThat(session.getReservationId()).isEqualTo("res-42");
    }

    @Test
    @DisplayName("Merging two free tables combines label and seats; unmerge restores both")
    void mergeAndUnmerge() {
        // Given
        TableState t1 = tableSessionManager.createTable(scope, "T1", 2, 1);
        TableState t2 = tableSessionManager.createTable(scope, "T2", 4, 2);

        // When
        MergeResult merged = tableSessionManager.merge(scope, t1.tableId(), t2.tableId());

        // Then
        assertThat(merged.primary().label()).isEqualTo("T1+T2");
        assertThat(merged.primary().seatCount()).isEqualTo(6);
        assertThat(merged.primary().status()).isEqualTo(TableSessionStatus.MERGED);
        assertThat(merged.secondary().status()).isEqualTo(TableSessionStatus.MERGED);
        assertThat(merged.secondary().mergedWithTableId()).isEqualTo(t1.tableId());

        // When
        MergeResult restored = tableSessionManager.unmerge(scope, t2.tableId());

        // Then
        assertThat(restored.primary().label()).isEqualTo("T1");
        assertThat(restored.primary().seatCount()).isEqualTo(2);
        assertThat(restored.secondary().label()).isEqualTo("T2");
        assertThat(restored.secondary().seatCount()).isEqualTo(4);
        assertThat(restored.secondary().mergedWithTableId()).isNull();
        assertThat(List.of(tableSessionManager.getTable(scope, t1.tableId()), tableSessionManager.getTable(scope, t2.tableId())))
                .extracting(TableState::status)
                .containsOnly(TableSessionStatus.FREE);
        assertThat(sessionRepository.findByTableIdAndClosedAtIsNull(t1.tableId())).hasSize(1);
        assertThat(sessionRepository.findByTableIdAndClosedAtIsNull(t2.tableId())).hasSize(1);
    }

    @Test
    @DisplayName("Unmerge also accepts the primary table")
    void unmerge_ByPrimary() {
        // Given
        TableState t1 = tableSessionManager.createTable(scope, "T1", 2, 1);
        TableState t2 = tableSessionManager.createTable(scope, "T2", 2, 2);
        tableSessionManager.merge(scope, t1.tableId(), t2.tableId());

        // When
        MergeResult restored = tableSessionManager.unmerge(scope, t1.tableId());

        // Then
        assertThat(restored.primary().tableId()).isEqualTo(t1.tableId());
        assertThat(restored.primary().label()).isEqualTo("T1");
    }

    @Test
    @DisplayName("Merged tables cannot join a second merge")
    void merge_DepthExceeded() {
        // Given
        TableState a = tableSessionManager.createTable(scope, "A", 2, 1);
        TableState b = tableSessionManager.createTable(scope, "B", 2, 2);
        TableState c = tableSessionManager.createTable(scope, "C", 2, 3);
        tableSessionManager.merge(scope, a.tableId(), b.tableId());

        // When & Then
        assertThatThrownBy(() -> tableSessionManager.merge(scope, c.tableId(), b.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.MERGE_DEPTH_EXCEEDED);
        assertThatThrownBy(() -> tableSessionManager.merge(scope, c.tableId(), a.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.MERGE_DEPTH_EXCEEDED);
        assertThat(tableSessionManager.getTable(scope, c.tableId()).label()).isEqualTo("C");
    }

    @Test
    @DisplayName("Only free tables can be merged")
    void merge_OccupiedTable() {
        // Given
        TableState t1 = tableSessionManager.createTable(scope, "T1", 2, 1);
        TableState t2 = tableSessionManager.createTable(scope, "T2", 2, 2);
        tableSessionManager.seat(scope, t2.tableId(), null, 2, null);

        // When & Then
        assertThatThrownBy(() -> tableSessionManager.merge(scope, t1.tableId(), t2.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_NOT_FREE);
        assertThat(tableSessionManager.getTable(scope, t1.tableId()).label()).isEqualTo("T1");
    }

    @Test
    @DisplayName("A table with no merge cannot be unmerged")
    void unmerge_NotMerged() {
        TableState t1 = tableSessionManager.createTable(scope, "T1", 2, 1);

        assertThatThrownBy(() -> tableSessionManager.unmerge(scope, t1.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_NOT_MERGED);
    }

    @Test
    @DisplayName("Status overrides are refused while a table is merged")
    void override_MergedTable() {
        TableState t1 = tableSessionManager.createTable(scope, "T1", 2, 1);
        TableState t2 = tableSessionManager.createTable(scope, "T2", 2, 2);
        tableSessionManager.merge(scope, t1.tableId(), t2.tableId());

        assertThatThrownBy(() -> tableSessionManager.markCleaning(scope, t1.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_MERGED);
        assertThatThrownBy(() -> tableSessionManager.markFree(scope, t2.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_MERGED);
    }

    @Test
    @DisplayName("Releasing the last active order frees the table")
    void release_LastOrder() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T5", 4, 5);
        Order order = saveOrder(table.tableId(), 5);
        tableSessionManager.occupyForOrder(scope, TableRef.of(table.tableId(), 5), order.getId());

        // When
        ReleaseOutcome outcome = tableSessionManager.release(scope, TableRef.of(table.tableId(), 5), order.getId());

        // Then
        assertThat(outcome).isEqualTo(ReleaseOutcome.RELEASED);
        assertThat(tableSessionManager.effectiveStatus(table.tableId())).isEqualTo(TableSessionStatus.FREE);
        assertThat(sessionRepository.findByTableIdOrderByOpenedAtAsc(table.tableId()))
                .filteredOn(session -> session.getStatus() == TableSessionStatus.FREE && !session.isOpen())
                .isNotEmpty();
    }

    @Test
    @DisplayName("A table stays occupied while another active order holds it")
    void release_SiblingOrderKeepsTable() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T5", 4, 5);
        Order first = saveOrder(table.tableId(), 5);
        saveOrder(table.tableId(), 5);
        tableSessionManager.occupyForOrder(scope, TableRef.of(table.tableId(), 5), first.getId());

        // When
        ReleaseOutcome outcome = tableSessionManager.release(scope, TableRef.of(table.tableId(), 5), first.getId());

        // Then
        assertThat(outcome).isEqualTo(ReleaseOutcome.STILL_OCCUPIED);
        assertThat(tableSessionManager.effectiveStatus(table.tableId())).isEqualTo(TableSessionStatus.OCCUPIED);
    }

    @Test
    @DisplayName("A sibling order found only by table number also keeps the table")
    void release_SiblingByTableNumber() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T6", 4, 6);
        Order first = saveOrder(table.tableId(), 6);
        saveOrder(null, 6);
        tableSessionManager.seat(scope, table.tableId(), null, 2, null);

        // When
        ReleaseOutcome outcome = tableSessionManager.release(scope, TableRef.of(table.tableId(), 6), first.getId());

        // Then
        assertThat(outcome).isEqualTo(ReleaseOutcome.STILL_OCCUPIED);
    }

    @Test
    @DisplayName("A reservation is not cleared by an order release")
    void release_ReservedTableUntouched() {
        // Given
        TableState table = tableSessionManager.createTable(scope, "T7", 2, 7);
        Order order = saveOrder(table.tableId(), 7);
        tableSessionManager.markReserved(scope, table.tableId(), "res-1");

        // When
        ReleaseOutcome outcome = tableSessionManager.release(scope, TableRef.of(table.tableId(), 7), order.getId());

        // Then
        assertThat(outcome).isEqualTo(ReleaseOutcome.NOT_OCCUPIED);
        assertThat(tableSessionManager.effectiveStatus(table.tableId())).isEqualTo(TableSessionStatus.RESERVED);
    }

    @Test
    @DisplayName("An order without a table has nothing to release")
    void release_NoTable() {
        assertThat(tableSessionManager.release(scope, TableRef.of(null, null), 1L)).isEqualTo(ReleaseOutcome.NO_TABLE);
        assertThat(tableSessionManager.release(scope, TableRef.of(null, 99), 1L)).isEqualTo(ReleaseOutcome.NO_TABLE);
    }

    @Test
    @DisplayName("Another venue's table is not visible")
    void getTable_OtherVenue() {
        TableState table = tableSessionManager.createTable(scope, "T1", 2, 1);

        assertThatThrownBy(() -> tableSessionManager.getTable(VenueScope.scoped("venue-2"), table.tableId()))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.TABLE_NOT_FOUND);
    }

    private Order saveOrder(Long tableId, Integer tableNumber) {
        return orderRepository.save(Order.builder()
                .venueId(scope.venueId())
                .paymentMode(PaymentMode.PAY_AT_TILL)
                .tableId(tableId)
                .tableNumber(tableNumber)
                .createdAt(EngineTestConfig.NOW)
                .build());
    }
}
