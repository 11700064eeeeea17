package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.Settlement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for {@link Settlement} entity operations.
 *
 * <p>Settlements are replaced wholesale per trip, so besides lookups this only
 * offers a bulk delete by trip.
 */
@Repository
public interface SettlementRepository extends JpaRepository<Settlement, UUID> {

    /**
     * Settlements of a trip in the order the planner emitted them.
     *
     * @param tripId Trip UUID
     * @return List of settlements
     */
    List<Settlement> findByTripIdOrderByPlanOrderAsc(UUID tripId);

    /**
     * Deletes all settlements of a trip. Payments must be deleted first.
     *
     * @param tripId Trip UUID
     * @return Number of deleted settlements
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Settlement s WHERE s.tripId = :tripId")
    int deleteByTripId(@Param("tripId") UUID tripId);
}
