package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.TripMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TripMemberRepository extends JpaRepository<TripMember, UUID> {

    Optional<TripMember> findByTripIdAndUserIdAndDeletedAtIsNull(UUID tripId, String userId);

    List<TripMember> findByTripIdAndDeletedAtIsNullOrderByCreatedAtAsc(UUID tripId);

    boolean existsByTripIdAndUserIdAndDeletedAtIsNull(UUID tripId, String userId);
}
