package com.venueops.table.repository;

import com.venueops.table.entity.VenueTable;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface VenueTableRepository extends JpaRepository<VenueTable, Long> {

    Optional<VenueTable> findByIdAndVenueId(Long id, String venueId);

    Optional<VenueTable> findFirstByVenueIdAndTableNumberOrderByIdAsc(String venueId, Integer tableNumber);

    List<VenueTable> findByVenueIdOrderByIdAsc(String venueId);

    List<VenueTable> findByVenueIdAndMergedWithTableId(String venueId, Long mergedWithTableId);

    boolean existsByVenueIdAndMergedWithTableId(String venueId, Long mergedWithTableId);

    long countByVenueId(String venueId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM VenueTable t WHERE t.id = :id AND t.venueId = :venueId")
    Optional<VenueTable> findByIdAndVenueIdWithLock(@Param("id") Long id, @Param("venueId") String venueId);
}
