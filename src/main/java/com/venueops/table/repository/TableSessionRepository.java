package com.venueops.table.repository;

import com.venueops.table.entity.TableSession;
import com.venueops.table.entity.TableSessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TableSessionRepository extends JpaRepository<TableSession, Long> {

    Optional<TableSession> findFirstByTableIdAndClosedAtIsNullOrderByOpenedAtDesc(Long tableId);

    List<TableSession> findByTableIdAndClosedAtIsNull(Long tableId);

    List<TableSession> findByVenueIdAndClosedAtIsNull(String venueId);

    List<TableSession> findByTableIdOrderByOpenedAtAsc(Long tableId);

    @Query("""
            SELECT COUNT(s) FROM TableSession s
             WHERE s.venueId = :venueId
               AND s.closedAt IS NULL
               AND s.status IN :statuses
            """)
    long countOpenByStatus(@Param("venueId") String venueId,
                           @Param("statuses") Collection<TableSessionStatus> statuses);
}
