package com.venueops.payment.repository;

import com.venueops.payment.entity.PaymentIntent;
import com.venueops.payment.gateway.IntentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface PaymentIntentRepository extends JpaRepository<PaymentIntent, Long> {

    Optional<PaymentIntent> findByIntentRef(String intentRef);

    Optional<PaymentIntent> findFirstByVenueIdAndOrderIdOrderByIdDesc(String venueId, Long orderId);

    /**
     * Records a status reported by the processor. Returns 0 when the intent already has
     * that status, which is how a replayed webhook is recognised.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE PaymentIntent p
               SET p.status = :status
             WHERE p.intentRef = :intentRef
               AND p.status <> :status
            """)
    int updateStatusIfChanged(@Param("intentRef") String intentRef, @Param("status") IntentStatus status);
}
