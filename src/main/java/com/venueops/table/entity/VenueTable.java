package com.venueops.table.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A physical table (or counter position). When merged, the primary carries the combined
 * label and seat count and each member points at it through {@code mergedWithTableId};
 * the pre-merge values are kept so an unmerge restores them exactly.
 */
@Entity
@Table(name = "venue_tables", indexes = {
        @Index(name = "idx_table_venue", columnList = "venueId"),
        @Index(name = "idx_table_merged_with", columnList = "mergedWithTableId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VenueTable {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "venue_table_seq")
    @SequenceGenerator(name = "venue_table_seq", sequenceName = "venue_table_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String venueId;

    @Column(nullable = false)
    private String label;

    private int seatCount;

    private Integer tableNumber;

    private Long mergedWithTableId;

    private String preMergeLabel;

    private Integer preMergeSeatCount;

    @Builder
    public VenueTable(String venueId, String label, int seatCount, Integer tableNumber) {
        this.venueId = venueId;
        this.label = label;
        this.seatCount = seatCount;
        this.tableNumber = tableNumber;
    }

    public boolean isMergeMember() {
        return mergedWithTableId != null;
    }

    /** Primary side of a merge: remembers its own values, then takes on the combined ones. */
    public void absorb(VenueTable member) {
        this.preMergeLabel = this.label;
        this.preMergeSeatCount = this.seatCount;
        this.label = this.label + "+" + member.getLabel();
        this.seatCount = this.seatCount + member.getSeatCount();
    }

    public void attachTo(VenueTable primary) {
        this.preMergeLabel = this.label;
        this.preMergeSeatCount = this.seatCount;
        this.mergedWithTableId = primary.getId();
    }

    public void restore() {
        if (preMergeLabel != null) {
            this.label = preMergeLabel;
        }
        if (preMergeSeatCount != null) {
            this.seatCount = preMergeSeatCount;
        }
        this.preMergeLabel = null;
        this.preMergeSeatCount = null;
        this.mergedWithTableId = null;
    }
}
