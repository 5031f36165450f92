package com.venueops.table.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One continuous occupancy interval of a table; open while {@code closedAt} is null.
 * At most one open session exists per table.
 */
@Entity
@Table(name = "table_sessions", indexes = {
        @Index(name = "idx_session_table_closed", columnList = "tableId, closedAt"),
        @Index(name = "idx_session_venue", columnList = "venueId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableSession {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "table_session_seq")
    @SequenceGenerator(name = "table_session_seq", sequenceName = "table_session_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private Long tableId;

    @Column(nullable = false)
    private String venueId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TableSessionStatus status;

    @Column(nullable = false)
    private Instant openedAt;

    private Instant closedAt;

    private Long orderId;

    private String serverId;

    private Integer guestCount;

    private String reservationId;

    @Builder
    public TableSession(Long tableId, String venueId, TableSessionStatus status, Instant openedAt,
                        Long orderId, String serverId, Integer guestCount, String reservationId) {
        this.tableId = tableId;
        this.venueId = venueId;
        this.status = status;
        this.openedAt = openedAt;
        this.orderId = orderId;
        this.serverId = serverId;
        this.guestCount = guestCount;
        this.reservationId = reservationId;
    }

    public boolean isOpen() {
        return closedAt == null;
    }

    public void close(Instant now) {
        this.closedAt = now;
    }

    /** Order release: the session ends as FREE with its close time stamped. */
    public void closeAsFree(Instant now) {
        this.status = TableSessionStatus.FREE;
        this.closedAt = now;
    }

    public void changeStatus(TableSessionStatus status) {
        this.status = status;
    }
}
