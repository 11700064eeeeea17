package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.Trip;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID> {

    Optional<Trip> findByIdAndDeletedAtIsNull(UUID id);

    /**
     * Loads a non-deleted trip and locks its row until the surrounding transaction ends.
     *
     * <p>Serializes spend window transitions and expense mutations of the same trip.
     * Trips never lock each other.
     *
     * @param id Trip UUID
     * @return Locked trip, or empty if missing or soft-deleted
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trip t WHERE t.id = :id AND t.deletedAt IS NULL")
    Optional<Trip> findByIdForUpdate(@Param("id") UUID id);
}
