package com.venueops.kitchen.service;

import com.venueops.kitchen.entity.Station;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Station set seeded for a venue that has none. Expo always comes first.
 */
@Getter
@RequiredArgsConstructor
public enum DefaultStation {
    EXPO("Expo", Station.EXPO_TYPE, 0, "#3b82f6"),
    GRILL("Grill", "grill", 1, "#ef4444"),
    FRYER("Fryer", "fryer", 2, "#f59e0b"),
    BARISTA("Barista", "barista", 3, "#8b5cf6"),
    COLD_PREP("Cold Prep", "cold", 4, "#06b6d4");

    private final String displayName;
    private final String stationType;
    private final int displayOrder;
    private final String colorCode;

    public Station toStation(String venueId) {
        return Station.builder()
                .venueId(venueId)
                .name(displayName)
                .stationType(stationType)
                .displayOrder(displayOrder)
                .colorCode(colorCode)
                .active(true)
                .build();
    }
}
