package com.venueops.kitchen.service;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.kitchen.entity.Station;
import com.venueops.kitchen.repository.StationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Guarantees every venue has an active station set with an Expo station.
 *
 * <p>Safe to call on every request. A default the venue already has but deactivated is
 * switched back on rather than inserted again. Inserts are not wrapped in a surrounding
 * transaction: each default station is flushed on its own so that a concurrent caller
 * seeding the same venue only loses the duplicate row (unique on venue + name), never
 * the whole set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StationRegistry {

    private final StationRepository stationRepository;

    public List<Station> ensureStations(String venueId) {
        List<Station> active = stationRepository.findByVenueIdAndActiveTrueOrderByDisplayOrderAsc(venueId);

        if (active.isEmpty()) {
            log.info("No active kitchen stations found, seeding defaults: venueId={}", venueId);
            seed(venueId, EnumSet.allOf(DefaultStation.class));
        } else if (active.stream().noneMatch(Station::isExpo)) {
            log.info("Venue has no active expo station, adding one: venueId={}", venueId);
            seed(venueId, EnumSet.of(DefaultStation.EXPO));
        } else {
            return active;
        }

        List<Station> stations = stationRepository.findByVenueIdAndActiveTrueOrderByDisplayOrderAsc(venueId);
        if (stations.stream().noneMatch(Station::isExpo)) {
            throw new BusinessException(ErrorCode.NO_KITCHEN_STATION,
                    "Failed to set up an expo station for venue " + venueId);
        }
        return stations;
    }

    /**
     * The station unmatched items land on: the first expo station.
     */
    public Station defaultStation(List<Station> stations) {
        return stations.stream()
                .filter(Station::isExpo)
                .findFirst()
                .orElseThrow(() -> new BusinessException(ErrorCode.NO_KITCHEN_STATION));
    }

    private void seed(String venueId, Set<DefaultStation> defaults) {
        List<Station> inactive = stationRepository.findByVenueId(venueId).stream()
                .filter(station -> !station.isActive())
                .toList();
        for (DefaultStation station : defaults) {
            Optional<Station> existing = inactive.stream()
                    .filter(candidate -> candidate.getName().equalsIgnoreCase(station.getDisplayName())
                            || (station == DefaultStation.EXPO && candidate.isExpo()))
                    .findFirst();
            if (existing.isPresent()) {
                existing.get().activate();
                stationRepository.saveAndFlush(existing.get());
                log.info("Kitchen station reactivated: venueId={}, stationId={}, name={}",
                        venueId, existing.get().getId(), existing.get().getName());
                continue;
            }
            try {
                stationRepository.saveAndFlush(station.toStation(venueId));
            } catch (DataIntegrityViolationException e) {
                log.debug("Station already present, skipping: venueId={}, name={}",
                        venueId, station.getDisplayName());
            }
        }
    }
}
