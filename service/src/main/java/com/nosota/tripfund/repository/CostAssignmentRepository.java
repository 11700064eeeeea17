package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.CostAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CostAssignmentRepository extends JpaRepository<CostAssignment, UUID> {

    List<CostAssignment> findByExpenseIdOrderByCreatedAtAsc(UUID expenseId);

    List<CostAssignment> findByExpenseIdInOrderByCreatedAtAsc(Collection<UUID> expenseIds);

    Optional<CostAssignment> findByIdAndExpenseId(UUID id, UUID expenseId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CostAssignment a WHERE a.expenseId = :expenseId")
    int deleteByExpenseId(@Param("expenseId") UUID expenseId);
}
