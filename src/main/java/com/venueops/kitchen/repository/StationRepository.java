package com.venueops.kitchen.repository;

import com.venueops.kitchen.entity.Station;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StationRepository extends JpaRepository<Station, Long> {

    List<Station> findByVenueIdAndActiveTrueOrderByDisplayOrderAsc(String venueId);

    List<Station> findByVenueId(String venueId);
}
