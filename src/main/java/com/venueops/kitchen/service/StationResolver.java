package com.venueops.kitchen.service;

import com.venueops.common.config.VenueOpsProperties;
import com.venueops.kitchen.entity.Station;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the station for one line item.
 * <ol>
 *   <li>a non-expo station whose type equals the category, or whose name and the category
 *       contain one another (case-insensitive)</li>
 *   <li>the keyword tiers, when enabled</li>
 *   <li>the default (expo) station</li>
 * </ol>
 */
@Slf4j
@Component
public class StationResolver {

    private final KeywordStationMatcher keywordMatcher = new KeywordStationMatcher();
    private final boolean keywordRouting;

    public StationResolver(VenueOpsProperties properties) {
        this.keywordRouting = properties.kitchen().keywordRouting();
    }

    public Station resolve(List<Station> stations, Station defaultStation,
                           Optional<String> category, String itemName) {
        Optional<Station> byCategory = category.flatMap(value -> matchCategory(stations, value));
        if (byCategory.isPresent()) {
            return byCategory.get();
        }
        if (keywordRouting) {
            Optional<Station> byKeyword = keywordMatcher.match(itemName, stations);
            if (byKeyword.isPresent()) {
                log.debug("Station matched by keyword: item={}, station={}", itemName, byKeyword.get().getName());
                return byKeyword.get();
            }
        }
        return defaultStation;
    }

    static Optional<Station> matchCategory(List<Station> stations, String category) {
        String wanted = category.trim().toLowerCase(Locale.ROOT);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        return stations.stream()
                .filter(station -> !station.isExpo())
                .filter(station -> {
                    String name = station.getName().toLowerCase(Locale.ROOT);
                    return name.contains(wanted)
                            || wanted.contains(name)
                            || wanted.equals(station.getStationType().toLowerCase(Locale.ROOT));
                })
                .findFirst();
    }
}
