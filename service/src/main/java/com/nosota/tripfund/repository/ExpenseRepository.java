package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.Expense;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseRepository extends JpaRepository<Expense, UUID> {

    Optional<Expense> findByIdAndDeletedAtIsNull(UUID id);

    /**
     * Non-deleted expenses of a trip, oldest first.
     */
    List<Expense> findByTripIdAndDeletedAtIsNullOrderByDateAscCreatedAtAsc(UUID tripId);
}
