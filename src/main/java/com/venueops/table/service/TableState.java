package com.venueops.table.service;

import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import com.venueops.table.entity.VenueTable;

/**
 * A table together with its effective status: the open session's status, or FREE when
 * no session is open.
 */
public record TableState(
        Long tableId,
        String label,
        int seatCount,
        Integer tableNumber,
        Long mergedWithTableId,
        TableSessionStatus status,
        Long sessionId,
        Long orderId
) {
    public static TableState of(VenueTable table, TableSession openSession) {
        return new TableState(
                table.getId(),
                table.getLabel(),
                table.getSeatCount(),
                table.getTableNumber(),
                table.getMergedWithTableId(),
                openSession == null ? TableSessionStatus.FREE : openSession.getStatus(),
                openSession == null ? null : openSession.getId(),
                openSession == null ? null : openSession.getOrderId());
    }
}
