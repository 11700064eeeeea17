package com.nosota.tripfund.service;

import com.nosota.tripfund.api.dto.CostAssignmentDTO;
import com.nosota.tripfund.api.dto.ExpenseDTO;
import com.nosota.tripfund.api.dto.UserSummaryDTO;
import com.nosota.tripfund.api.model.ExpenseStatus;
import com.nosota.tripfund.api.model.Money;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.SplitType;
import com.nosota.tripfund.api.request.*;
import com.nosota.tripfund.error.*;
import com.nosota.tripfund.mapper.ExpenseMapper;
import com.nosota.tripfund.mapper.UserMapper;
import com.nosota.tripfund.model.CostAssignment;
import com.nosota.tripfund.model.Expense;
import com.nosota.tripfund.model.Trip;
import com.nosota.tripfund.repository.*;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for expenses and their cost assignments.
 *
 * <p>Rules enforced on every change:
 * <ul>
 *   <li>the caller is a member of the trip</li>
 *   <li>the trip's spend window is OPEN ({@link SpendWindowClosedException} otherwise)</li>
 *   <li>the expense itself is OPEN for amount and assignment changes
 *       ({@link ExpenseLockedException} otherwise)</li>
 * </ul>
 *
 * <p>Mutations lock the trip row first so they serialize with spend window transitions.
 *
 * <p>normalizedAmount = amount × fxRate and every assignment's normalizedShareAmount =
 * shareAmount × fxRate are recomputed whenever amount or fxRate change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    static final String TRIP_CLOSED_ADD = "Cannot add spends. The trip organizer has closed spending for this trip.";
    static final String TRIP_CLOSED_EDIT = "Cannot edit spends. The trip organizer has closed spending for this trip.";
    static final String TRIP_CLOSED_DELETE = "Cannot delete spends. The trip organizer has closed spending for this trip.";
    static final String EXPENSE_LOCKED = "Cannot edit closed spend. Items and assignments are locked.";

    private static final int NORMALIZED_SCALE = 6;
    private static final BigDecimal ASSIGNMENT_TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final TripRepository tripRepository;
    private final TripMemberRepository tripMemberRepository;
    private final ExpenseRepository expenseRepository;
    private final CostAssignmentRepository costAssignmentRepository;
    private final AppUserRepository appUserRepository;
    private final SplitCalculator splitCalculator;
    private final Clock clock;

    // ==================== Expenses ====================

    /**
     * Records a new expense. The payer defaults to the caller and must be a trip member.
     */
    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO createExpense(UUID tripId, String actingUserId, CreateExpenseRequest request)
            throws TripNotFoundException, ForbiddenOperationException, SpendWindowClosedException {
        Trip trip = tripRepository.findByIdForUpdate(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
        requireMember(tripId, actingUserId);
        if (trip.getSpendStatus() == SpendStatus.CLOSED) {
            throw new SpendWindowClosedException(TRIP_CLOSED_ADD);
        }

        String paidById = request.paidById() != null ? request.paidById() : actingUserId;
        requireParticipant(tripId, paidById, "Payer");

        // Money rejects unknown currency codes
        String currency = Money.of(request.amount(), request.currency()).currencyCode();
        BigDecimal fxRate = request.fxRate() != null ? request.fxRate() : BigDecimal.ONE;
        LocalDateTime now = LocalDateTime.now(clock);

        Expense expense = new Expense();
        expense.setTripId(tripId);
        expense.setDescription(request.description());
        expense.setAmount(request.amount());
        expense.setCurrency(currency);
        expense.setFxRate(fxRate);
        expense.setNormalizedAmount(normalize(request.amount(), fxRate));
        expense.setDate(request.date() != null ? request.date() : now);
        expense.setStatus(ExpenseStatus.OPEN);
        expense.setPaidById(paidById);
        expense.setCategoryId(request.categoryId());
        expense.setNotes(request.notes());
        expense.setCreatedAt(now);
        expense.setUpdatedAt(now);
        expense = expenseRepository.save(expense);

        log.info("Expense {} created on trip {}: {} {} paid by {} (normalized={} {})",
                expense.getId(), tripId, expense.getAmount(), currency, paidById,
                expense.getNormalizedAmount(), trip.getBaseCurrency());
        return toExpenseDTO(expense, List.of());
    }

    public ExpenseDTO getExpense(UUID expenseId, String actingUserId)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException {
        Expense expense = findExpense(expenseId);
        requireActiveTrip(expense.getTripId());
        requireMember(expense.getTripId(), actingUserId);
        return toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId));
    }

    /**
     * Non-deleted expenses of a trip, oldest first.
     */
    public List<ExpenseDTO> getTripExpenses(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        requireActiveTrip(tripId);
        requireMember(tripId, actingUserId);

        List<ExpenseDTO> result = new ArrayList<>();
        for (Expense expense : expenseRepository.findByTripIdAndDeletedAtIsNullOrderByDateAscCreatedAtAsc(tripId)) {
            result.add(toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expense.getId())));
        }
        return result;
    }

    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO updateExpense(UUID expenseId, String actingUserId, UpdateExpenseRequest request)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = lockForEdit(expenseId, actingUserId, TRIP_CLOSED_EDIT);

        if (request.description() != null) {
            expense.setDescription(request.description());
        }
        if (request.currency() != null) {
            expense.setCurrency(Money.zero(request.currency()).currencyCode());
        }
        if (request.date() != null) {
            expense.setDate(request.date());
        }
        if (request.categoryId() != null) {
            expense.setCategoryId(request.categoryId());
        }
        if (request.notes() != null) {
            expense.setNotes(request.notes());
        }

        List<CostAssignment> assignments = costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId);
        if (request.amount() != null || request.fxRate() != null) {
            if (request.amount() != null) {
                expense.setAmount(request.amount());
            }
            if (request.fxRate() != null) {
                expense.setFxRate(request.fxRate());
            }
            expense.setNormalizedAmount(normalize(expense.getAmount(), expense.getFxRate()));
            for (CostAssignment assignment : assignments) {
                assignment.setNormalizedShareAmount(normalize(assignment.getShareAmount(), expense.getFxRate()));
            }
            costAssignmentRepository.saveAll(assignments);
            log.debug("Expense {} renormalized: amount={}, fxRate={}, normalized={}, {} assignments synced",
                    expenseId, expense.getAmount(), expense.getFxRate(), expense.getNormalizedAmount(),
                    assignments.size());
        }

        expense.setUpdatedAt(LocalDateTime.now(clock));
        expense = expenseRepository.save(expense);

        log.info("Expense {} updated by {}", expenseId, actingUserId);
        return toExpenseDTO(expense, assignments);
    }

    /**
     * Soft-deletes an expense; it disappears from balances immediately.
     */
    @Transactional(rollbackOn = Exception.class)
    public void deleteExpense(UUID expenseId, String actingUserId)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException {
        Expense expense = findExpense(expenseId);
        Trip trip = tripRepository.findByIdForUpdate(expense.getTripId())
                .orElseThrow(() -> new TripNotFoundException(expense.getTripId()));
        requireMember(trip.getId(), actingUserId);
        if (trip.getSpendStatus() == SpendStatus.CLOSED) {
            throw new SpendWindowClosedException(TRIP_CLOSED_DELETE);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        expense.setDeletedAt(now);
        expense.setUpdatedAt(now);
        expenseRepository.save(expense);

        log.info("Expense {} deleted from trip {} by {}", expenseId, trip.getId(), actingUserId);
    }

    /**
     * Closes an expense, locking its amount and assignments.
     *
     * <p>Assignments must cover the expense within 0.01% unless {@code force} is set.
     *
     * @throws AssignmentMismatchException if assignments do not total 100% and force is not set
     * @throws IllegalStateException       if the expense is already closed
     */
    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO finalizeExpense(UUID expenseId, String actingUserId, boolean force)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            AssignmentMismatchException {
        Expense expense = findExpense(expenseId);
        tripRepository.findByIdForUpdate(expense.getTripId())
                .orElseThrow(() -> new TripNotFoundException(expense.getTripId()));
        requireMember(expense.getTripId(), actingUserId);

        if (expense.getStatus() == ExpenseStatus.CLOSED) {
            throw new IllegalStateException("Spend is already closed");
        }

        List<CostAssignment> assignments = costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId);
        BigDecimal percentage = assignedPercentage(expense, assignments);
        if (!force && percentage.subtract(ONE_HUNDRED).abs().compareTo(ASSIGNMENT_TOLERANCE) > 0) {
            throw new AssignmentMismatchException(percentage.setScale(1, RoundingMode.HALF_UP));
        }

        expense.setStatus(ExpenseStatus.CLOSED);
        expense.setUpdatedAt(LocalDateTime.now(clock));
        expenseRepository.save(expense);

        log.info("Expense {} finalized by {}: assigned={}%, forced={}", expenseId, actingUserId,
                percentage.setScale(2, RoundingMode.HALF_UP), force);
        return toExpenseDTO(expense, assignments);
    }

    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO reopenExpense(UUID expenseId, String actingUserId)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException {
        Expense expense = findExpense(expenseId);
        tripRepository.findByIdForUpdate(expense.getTripId())
                .orElseThrow(() -> new TripNotFoundException(expense.getTripId()));
        requireMember(expense.getTripId(), actingUserId);

        if (expense.getStatus() != ExpenseStatus.CLOSED) {
            throw new IllegalStateException("Spend is not closed");
        }

        expense.setStatus(ExpenseStatus.OPEN);
        expense.setUpdatedAt(LocalDateTime.now(clock));
        expenseRepository.save(expense);

        log.info("Expense {} reopened by {}", expenseId, actingUserId);
        return toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId));
    }

    // ==================== Assignments ====================

    /**
     * Replaces all assignments of an expense with shares derived by {@link SplitCalculator}.
     */
    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO replaceAssignments(UUID expenseId, String actingUserId, ReplaceAssignmentsRequest request)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = lockForEdit(expenseId, actingUserId, TRIP_CLOSED_EDIT);

        List<AssignmentRequest> entries = request.assignments();
        for (AssignmentRequest entry : entries) {
            requireParticipant(expense.getTripId(), entry.userId(), "Assignee");
        }
        List<BigDecimal> shares = splitCalculator.calculateShares(expense.getAmount(), expense.getCurrency(), entries);

        costAssignmentRepository.deleteByExpenseId(expenseId);

        LocalDateTime now = LocalDateTime.now(clock);
        List<CostAssignment> assignments = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            AssignmentRequest entry = entries.get(i);
            // keeps creation order stable for equal timestamps
            assignments.add(newAssignment(expense, entry.userId(), shares.get(i), entry.splitType(),
                    entry.splitValue(), now.plusNanos(i * 1000L)));
        }
        assignments = costAssignmentRepository.saveAll(assignments);
        touch(expense);

        log.info("Expense {} assignments replaced by {}: {} entries", expenseId, actingUserId, assignments.size());
        return toExpenseDTO(expense, assignments);
    }

    /**
     * Adds a single EXACT assignment.
     */
    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO addAssignment(UUID expenseId, String actingUserId, AddAssignmentRequest request)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = lockForEdit(expenseId, actingUserId, TRIP_CLOSED_EDIT);
        requireParticipant(expense.getTripId(), request.userId(), "Assignee");

        BigDecimal share = Money.round(request.shareAmount(), expense.getCurrency());
        costAssignmentRepository.save(newAssignment(expense, request.userId(), share, SplitType.EXACT,
                request.shareAmount(), LocalDateTime.now(clock)));
        touch(expense);

        log.info("Assignment added to expense {}: user={}, share={}", expenseId, request.userId(), share);
        return toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId));
    }

    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO updateAssignment(UUID expenseId, UUID assignmentId, String actingUserId,
                                       UpdateAssignmentRequest request)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = lockForEdit(expenseId, actingUserId, TRIP_CLOSED_EDIT);
        CostAssignment assignment = findAssignment(expenseId, assignmentId);

        BigDecimal share = Money.round(request.shareAmount(), expense.getCurrency());
        assignment.setShareAmount(share);
        assignment.setNormalizedShareAmount(normalize(share, expense.getFxRate()));
        assignment.setSplitType(SplitType.EXACT);
        assignment.setSplitValue(request.shareAmount());
        costAssignmentRepository.save(assignment);
        touch(expense);

        log.info("Assignment {} of expense {} updated: share={}", assignmentId, expenseId, share);
        return toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId));
    }

    @Transactional(rollbackOn = Exception.class)
    public ExpenseDTO deleteAssignment(UUID expenseId, UUID assignmentId, String actingUserId)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = lockForEdit(expenseId, actingUserId, TRIP_CLOSED_EDIT);
        CostAssignment assignment = findAssignment(expenseId, assignmentId);

        costAssignmentRepository.delete(assignment);
        touch(expense);

        log.info("Assignment {} removed from expense {}", assignmentId, expenseId);
        return toExpenseDTO(expense, costAssignmentRepository.findByExpenseIdOrderByCreatedAtAsc(expenseId));
    }

    // ==================== Helpers ====================

    /**
     * Loads the expense, locks its trip and checks membership, spend window and expense status.
     */
    private Expense lockForEdit(UUID expenseId, String actingUserId, String closedTripMessage)
            throws ExpenseNotFoundException, TripNotFoundException, ForbiddenOperationException,
            SpendWindowClosedException, ExpenseLockedException {
        Expense expense = findExpense(expenseId);
        Trip trip = tripRepository.findByIdForUpdate(expense.getTripId())
                .orElseThrow(() -> new TripNotFoundException(expense.getTripId()));
        requireMember(trip.getId(), actingUserId);

        if (trip.getSpendStatus() == SpendStatus.CLOSED) {
            throw new SpendWindowClosedException(closedTripMessage);
        }
        if (expense.getStatus() == ExpenseStatus.CLOSED) {
            throw new ExpenseLockedException(EXPENSE_LOCKED);
        }
        return expense;
    }

    private Expense findExpense(UUID expenseId) throws ExpenseNotFoundException {
        return expenseRepository.findByIdAndDeletedAtIsNull(expenseId)
                .orElseThrow(() -> new ExpenseNotFoundException(expenseId));
    }

    private CostAssignment findAssignment(UUID expenseId, UUID assignmentId) {
        return costAssignmentRepository.findByIdAndExpenseId(assignmentId, expenseId)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Assignment %s not found on expense %s", assignmentId, expenseId)));
    }

    private void requireActiveTrip(UUID tripId) throws TripNotFoundException {
        if (tripRepository.findByIdAndDeletedAtIsNull(tripId).isEmpty()) {
            throw new TripNotFoundException(tripId);
        }
    }

    private void requireMember(UUID tripId, String userId) throws ForbiddenOperationException {
        if (userId == null || !tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, userId)) {
            throw new ForbiddenOperationException("You are not a member of this trip");
        }
    }

    private void requireParticipant(UUID tripId, String userId, String role) {
        if (!tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, userId)) {
            throw new IllegalArgumentException(String.format("%s %s is not a member of the trip", role, userId));
        }
    }

    private CostAssignment newAssignment(Expense expense, String userId, BigDecimal share, SplitType splitType,
                                         BigDecimal splitValue, LocalDateTime createdAt) {
        CostAssignment assignment = new CostAssignment();
        assignment.setExpenseId(expense.getId());
        assignment.setUserId(userId);
        assignment.setShareAmount(share);
        assignment.setNormalizedShareAmount(normalize(share, expense.getFxRate()));
        assignment.setSplitType(splitType);
        assignment.setSplitValue(splitType == SplitType.EQUAL ? null : splitValue);
        assignment.setCreatedAt(createdAt);
        return assignment;
    }

    private void touch(Expense expense) {
        expense.setUpdatedAt(LocalDateTime.now(clock));
        expenseRepository.save(expense);
    }

    private static BigDecimal normalize(BigDecimal amount, BigDecimal fxRate) {
        return amount.multiply(fxRate).setScale(NORMALIZED_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal assignedPercentage(Expense expense, List<CostAssignment> assignments) {
        BigDecimal normalizedAmount = expense.getNormalizedAmount();
        if (normalizedAmount == null || normalizedAmount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal assigned = assignments.stream()
                .map(CostAssignment::getNormalizedShareAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return assigned.multiply(ONE_HUNDRED).divide(normalizedAmount, 4, RoundingMode.HALF_UP);
    }

    private ExpenseDTO toExpenseDTO(Expense expense, List<CostAssignment> assignments) {
        UserSummaryDTO paidBy = appUserRepository.findById(expense.getPaidById())
                .map(UserMapper.INSTANCE::toSummary)
                .orElse(new UserSummaryDTO(expense.getPaidById(), expense.getPaidById(), null, null));
        List<CostAssignmentDTO> assignmentDTOs = ExpenseMapper.INSTANCE.toDTOList(assignments);

        return new ExpenseDTO(
                expense.getId(),
                expense.getTripId(),
                expense.getDescription(),
                expense.getAmount(),
                expense.getCurrency(),
                expense.getFxRate(),
                expense.getNormalizedAmount(),
                expense.getDate(),
                expense.getStatus(),
                paidBy,
                expense.getCategoryId(),
                expense.getNotes(),
                assignmentDTOs,
                assignedPercentage(expense, assignments).setScale(2, RoundingMode.HALF_UP),
                expense.getCreatedAt(),
                expense.getUpdatedAt());
    }
}
