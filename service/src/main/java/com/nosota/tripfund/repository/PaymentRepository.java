package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    List<Payment> findBySettlementIdOrderByPaidAtAsc(UUID settlementId);

    List<Payment> findBySettlementIdInOrderByPaidAtAsc(Collection<UUID> settlementIds);

    Optional<Payment> findByIdAndSettlementId(UUID id, UUID settlementId);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payment p WHERE p.settlementId = :settlementId")
    BigDecimal sumAmountBySettlementId(@Param("settlementId") UUID settlementId);

    /**
     * Deletes payments of every settlement of the trip.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Payment p WHERE p.settlementId IN " +
            "(SELECT s.id FROM Settlement s WHERE s.tripId = :tripId)")
    int deleteByTripId(@Param("tripId") UUID tripId);
}
