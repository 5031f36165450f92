package com.venueops.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Venue menu row. Only the category is read by the engine, for kitchen station routing;
 * menu maintenance itself happens elsewhere.
 */
@Entity
@Table(name = "menu_items", indexes = {
        @Index(name = "idx_menu_item_venue", columnList = "venueId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "menu_item_seq")
    @SequenceGenerator(name = "menu_item_seq", sequenceName = "menu_item_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false)
    private String venueId;

    @Column(nullable = false)
    private String name;

    private String category;

    @Column(nullable = false)
    private BigDecimal price;

    private boolean available;

    @Builder
    public MenuItem(String venueId, String name, String category, BigDecimal price, boolean available) {
        this.venueId = venueId;
        this.name = name;
        this.category = category;
        this.price = price;
        this.available = available;
    }
}
