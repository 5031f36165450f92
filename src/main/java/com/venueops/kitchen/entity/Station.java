package com.venueops.kitchen.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

@Entity
@Table(name = "kitchen_stations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_station_venue_name", columnNames = {"venueId", "name"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Station {

    public static final String EXPO_TYPE = "expo";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "station_seq")
    @SequenceGenerator(name = "station_seq", sequenceName = "station_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String venueId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String stationType;

    private int displayOrder;

    private String colorCode;

    private boolean active;

    @CreatedDate
    private Instant createdAt;

    @Builder
    public Station(String venueId, String name, String stationType, int displayOrder,
                   String colorCode, boolean active) {
        this.venueId = venueId;
        this.name = name;
        this.stationType = stationType;
        this.displayOrder = displayOrder;
        this.colorCode = colorCode;
        this.active = active;
    }

    public boolean isExpo() {
        return EXPO_TYPE.equalsIgnoreCase(stationType);
    }

    public void activate() {
        this.active = true;
    }
}
