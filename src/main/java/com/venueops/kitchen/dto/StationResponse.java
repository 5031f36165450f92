package com.venueops.kitchen.dto;

import com.venueops.kitchen.entity.Station;

public record StationResponse(Long id, String name, String stationType, int displayOrder, String colorCode) {

    public static StationResponse from(Station station) {
        return new StationResponse(station.getId(), station.getName(), station.getStationType(),
                station.getDisplayOrder(), station.getColorCode());
    }
}
