package com.nosota.tripfund.repository;

import com.nosota.tripfund.api.model.MilestoneTriggerType;
import com.nosota.tripfund.api.model.SettlementStatus;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.dto.*;
import com.nosota.tripfund.model.*;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * {@link TripLedgerStore} backed by the Spring Data repositories.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaTripLedgerStore implements TripLedgerStore {

    private final TripRepository tripRepository;
    private final TripMemberRepository tripMemberRepository;
    private final ExpenseRepository expenseRepository;
    private final CostAssignmentRepository costAssignmentRepository;
    private final AppUserRepository appUserRepository;
    private final SettlementRepository settlementRepository;
    private final PaymentRepository paymentRepository;
    private final TimelineItemRepository timelineItemRepository;
    private final Clock clock;

    @Override
    public Optional<TripSnapshot> findActiveTrip(UUID tripId) {
        return tripRepository.findByIdAndDeletedAtIsNull(tripId).map(this::toSnapshot);
    }

    @Override
    public Optional<TripSnapshot> lockTrip(UUID tripId) {
        return tripRepository.findByIdForUpdate(tripId).map(this::toSnapshot);
    }

    @Override
    public Optional<TripMemberRole> findMemberRole(UUID tripId, String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return tripMemberRepository.findByTripIdAndUserIdAndDeletedAtIsNull(tripId, userId)
                .map(TripMember::getRole);
    }

    @Override
    public List<LedgerExpense> listExpenses(UUID tripId) {
        List<Expense> expenses = expenseRepository.findByTripIdAndDeletedAtIsNullOrderByDateAscCreatedAtAsc(tripId);
        if (expenses.isEmpty()) {
            return List.of();
        }

        List<UUID> expenseIds = expenses.stream().map(Expense::getId).toList();
        Map<UUID, List<CostAssignment>> assignmentsByExpense = costAssignmentRepository
                .findByExpenseIdInOrderByCreatedAtAsc(expenseIds).stream()
                .collect(Collectors.groupingBy(CostAssignment::getExpenseId, LinkedHashMap::new, Collectors.toList()));

        Set<String> userIds = new HashSet<>();
        expenses.forEach(e -> userIds.add(e.getPaidById()));
        assignmentsByExpense.values().forEach(list -> list.forEach(a -> userIds.add(a.getUserId())));
        Map<String, ParticipantRef> participants = loadParticipants(userIds);

        List<LedgerExpense> result = new ArrayList<>(expenses.size());
        for (Expense expense : expenses) {
            List<LedgerAssignment> assignments = assignmentsByExpense
                    .getOrDefault(expense.getId(), List.of()).stream()
                    .map(a -> new LedgerAssignment(
                            participants.get(a.getUserId()),
                            a.getShareAmount(),
                            a.getNormalizedShareAmount(),
                            a.getSplitType()))
                    .toList();

            result.add(LedgerExpense.builder()
                    .id(expense.getId())
                    .amount(expense.getAmount())
                    .currency(expense.getCurrency())
                    .fxRate(expense.getFxRate())
                    .normalizedAmount(expense.getNormalizedAmount())
                    .date(expense.getDate())
                    .status(expense.getStatus())
                    .paidBy(participants.get(expense.getPaidById()))
                    .categoryId(expense.getCategoryId())
                    .assignments(assignments)
                    .build());
        }

        log.debug("Loaded ledger for trip {}: {} expenses, {} participants",
                tripId, result.size(), participants.size());
        return result;
    }

    @Override
    public int replaceSettlements(UUID tripId, List<SettlementDraft> drafts) {
        int deleted = deleteSettlements(tripId);

        LocalDateTime now = LocalDateTime.now(clock);
        List<Settlement> settlements = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            SettlementDraft draft = drafts.get(i);
            Settlement settlement = new Settlement();
            settlement.setTripId(tripId);
            settlement.setFromUserId(draft.fromUserId());
            settlement.setToUserId(draft.toUserId());
            settlement.setAmount(draft.amount());
            settlement.setCurrency(draft.currency());
            settlement.setStatus(SettlementStatus.PENDING);
            settlement.setPlanOrder(i);
            settlement.setNotes(draft.notes());
            settlement.setCreatedAt(now);
            settlement.setUpdatedAt(now);
            settlements.add(settlement);
        }
        settlementRepository.saveAll(settlements);

        log.debug("Replaced settlements of trip {}: deleted={}, created={}", tripId, deleted, settlements.size());
        return settlements.size();
    }

    @Override
    public int deleteSettlements(UUID tripId) {
        int payments = paymentRepository.deleteByTripId(tripId);
        int settlements = settlementRepository.deleteByTripId(tripId);
        if (payments > 0) {
            log.info("Deleted {} payments together with {} settlements of trip {}", payments, settlements, tripId);
        }
        return settlements;
    }

    @Override
    public void setSpendStatus(UUID tripId, SpendStatus spendStatus) {
        Trip trip = tripRepository.findByIdAndDeletedAtIsNull(tripId)
                .orElseThrow(() -> new EntityNotFoundException("Trip not found: " + tripId));
        trip.setSpendStatus(spendStatus);
        tripRepository.save(trip);
    }

    @Override
    public void syncSpendWindowMilestone(UUID tripId, boolean completed, MilestoneTriggerType triggerType) {
        timelineItemRepository.findFirstByTripIdAndTitleAndDeletedAtIsNull(tripId, TimelineItem.SPENDING_WINDOW_CLOSES)
                .ifPresent(item -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    item.setCompleted(completed);
                    item.setCompletedAt(completed ? now : null);
                    item.setTriggerType(completed ? triggerType : null);
                    if (completed && item.getFirstCompletedAt() == null) {
                        item.setFirstCompletedAt(now);
                    }
                    timelineItemRepository.save(item);
                });
    }

    private Map<String, ParticipantRef> loadParticipants(Set<String> userIds) {
        Map<String, ParticipantRef> participants = new HashMap<>();
        for (AppUser user : appUserRepository.findByIdIn(userIds)) {
            participants.put(user.getId(),
                    new ParticipantRef(user.getId(), user.getName(), user.getEmail(), user.getPhotoUrl()));
        }
        // users without a synced profile are still part of the math
        for (String userId : userIds) {
            participants.computeIfAbsent(userId, ParticipantRef::of);
        }
        return participants;
    }

    private TripSnapshot toSnapshot(Trip trip) {
        return new TripSnapshot(trip.getId(), trip.getBaseCurrency(), trip.getSpendStatus());
    }
}
