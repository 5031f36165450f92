package com.venueops.kitchen.repository;

import com.venueops.kitchen.entity.KitchenTicket;
import com.venueops.kitchen.entity.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface KitchenTicketRepository extends JpaRepository<KitchenTicket, Long> {

    long countByOrderId(Long orderId);

    Optional<KitchenTicket> findByIdAndVenueId(Long id, String venueId);

    List<KitchenTicket> findByVenueIdAndOrderIdAndStatusIn(String venueId, Long orderId,
                                                           Collection<TicketStatus> statuses);

    @Query("""
            SELECT t FROM KitchenTicket t
             WHERE t.venueId = :venueId
               AND t.createdAt >= :since
               AND (:stationId IS NULL OR t.stationId = :stationId)
               AND (:status IS NULL OR t.status = :status)
             ORDER BY t.createdAt DESC, t.id DESC
            """)
    List<KitchenTicket> search(@Param("venueId") String venueId,
                               @Param("since") Instant since,
                               @Param("stationId") Long stationId,
                               @Param("status") TicketStatus status);
}
