package com.venueops.kitchen.service;

import com.venueops.common.config.VenueOpsProperties;
import com.venueops.kitchen.entity.Station;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StationResolverTest {

    private final List<Station> stations = defaultStations();
    private final Station expo = stations.get(0);

    private final StationResolver keywordResolver = new StationResolver(properties(true));
    private final StationResolver categoryOnlyResolver = new StationResolver(properties(false));

    @Test
    @DisplayName("A catalog category equal to a station type routes there")
    void resolve_CategoryMatchesType() {
        Station station = categoryOnlyResolver.resolve(stations, expo, Optional.of("grill"), "House Special");

        assertThat(station.getName()).isEqualTo("Grill");
    }

    @Test
    @DisplayName("Category and station name may contain one another")
    void resolve_CategoryContainsStationName() {
        assertThat(categoryOnlyResolver.resolve(stations, expo, Optional.of("Barista Drinks"), "Anything").getName())
                .isEqualTo("Barista");
        assertThat(categoryOnlyResolver.resolve(stations, expo, Optional.of("cold"), "Anything").getName())
                .isEqualTo("Cold Prep");
    }

    @Test
    @DisplayName("A category naming the expo station does not route to expo by match")
    void resolve_ExpoIsNeverACategoryMatch() {
        Station station = categoryOnlyResolver.resolve(stations, expo, Optional.of("expo"), "Burger");

        assertThat(station).isSameAs(expo);
    }

    @Test
    @DisplayName("Without keyword routing, unmatched items go to expo")
    void resolve_KeywordRoutingDisabled() {
        Station station = categoryOnlyResolver.resolve(stations, expo, Optional.empty(), "Flat White");

        assertThat(station).isSameAs(expo);
    }

    @Test
    @DisplayName("Category wins over item-name keywords")
    void resolve_CategoryBeatsKeyword() {
        Station station = keywordResolver.resolve(stations, expo, Optional.of("fryer"), "Latte");

        assertThat(station.getName()).isEqualTo("Fryer");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Iced Latte, Barista",
            "Strawberry Milkshake, Barista",
            "English Breakfast Tea, Barista",
            "Ribeye Steak, Grill",
            "Chips, Fryer",
            "Chicken Wings, Fryer",
            "Chicken Caesar Salad, Cold Prep",
            "Tomato Soup, Grill",
            "Chicken Noodle Soup, Grill",
            "Poke Bowl, Cold Prep",
            "Chocolate Cake, Cold Prep",
            "Margherita Pizza, Expo",
            "Mystery Box, Expo"
    })
    @DisplayName("Keyword tiers fall back to the next station type the venue actually has")
    void resolve_KeywordTiers(String itemName, String expectedStation) {
        Station station = keywordResolver.resolve(stations, expo, Optional.empty(), itemName);

        assertThat(station.getName()).isEqualTo(expectedStation);
    }

    @Test
    @DisplayName("Keywords match at word start only")
    void containsWord_WordStart() {
        assertThat(KeywordStationMatcher.containsWord("ribeye steak", "tea")).isFalse();
        assertThat(KeywordStationMatcher.containsWord("green tea", "tea")).isTrue();
        assertThat(KeywordStationMatcher.containsWord("tea-smoked duck", "tea")).isTrue();
    }

    @Test
    @DisplayName("A drink bowl is not a cold prep item")
    void resolve_DrinkBowlIsBarista() {
        Station station = keywordResolver.resolve(stations, expo, Optional.empty(), "Acai Bowl");

        assertThat(station.getName()).isEqualTo("Barista");
    }

    private static List<Station> defaultStations() {
        List<Station> stations = new ArrayList<>();
        long id = 1;
        for (DefaultStation defaults : DefaultStation.values()) {
            Station station = defaults.toStation("venue-1");
            ReflectionTestUtils.setField(station, "id", id++);
            stations.add(station);
        }
        return stations;
    }

    private static VenueOpsProperties properties(boolean keywordRouting) {
        return new VenueOpsProperties("Europe/London",
                new VenueOpsProperties.Dashboard(30),
                new VenueOpsProperties.Kitchen(keywordRouting,
                        new VenueOpsProperties.Backfill(false, Duration.ofMinutes(1))),
                new VenueOpsProperties.Payment(Duration.ofSeconds(5), Duration.ofSeconds(10)));
    }
}
