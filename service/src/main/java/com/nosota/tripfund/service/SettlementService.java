package com.nosota.tripfund.service;

import com.nosota.tripfund.api.dto.PaymentDTO;
import com.nosota.tripfund.api.model.SettlementStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.api.request.RecordPaymentRequest;
import com.nosota.tripfund.api.request.UpdatePaymentRequest;
import com.nosota.tripfund.api.response.PaymentResponse;
import com.nosota.tripfund.api.response.SettlementResponse;
import com.nosota.tripfund.error.*;
import com.nosota.tripfund.mapper.PaymentMapper;
import com.nosota.tripfund.model.AppUser;
import com.nosota.tripfund.model.Payment;
import com.nosota.tripfund.model.Settlement;
import com.nosota.tripfund.model.TripMember;
import com.nosota.tripfund.repository.*;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Service for reading settlements and recording repayments against them.
 *
 * <p>Settlements themselves are created and removed only by {@link SpendWindowService};
 * this service never inserts or deletes settlement rows.
 *
 * <p>Status is derived from the recorded payments:
 * <pre>
 *   remaining ≤ tolerance  → PAID
 *   paid &gt; tolerance       → PARTIALLY_PAID
 *   otherwise              → PENDING
 * </pre>
 * and changed through {@link SettlementStatusStateMachine}. The creditor confirms a PAID
 * settlement by verifying it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final SettlementRepository settlementRepository;
    private final PaymentRepository paymentRepository;
    private final TripRepository tripRepository;
    private final TripMemberRepository tripMemberRepository;
    private final AppUserRepository appUserRepository;
    private final SettlementStatusStateMachine stateMachine;
    private final Clock clock;

    @Value("${settlement.tolerance:0.01}")
    private BigDecimal tolerance;

    /**
     * Persisted settlements of a trip in plan order. Empty while the spend window is OPEN.
     */
    public List<SettlementResponse> getTripSettlements(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        if (tripRepository.findByIdAndDeletedAtIsNull(tripId).isEmpty()) {
            throw new TripNotFoundException(tripId);
        }
        requireMember(tripId, actingUserId);

        List<Settlement> settlements = settlementRepository.findByTripIdOrderByPlanOrderAsc(tripId);
        if (settlements.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<Payment>> paymentsBySettlement = paymentRepository
                .findBySettlementIdInOrderByPaidAtAsc(settlements.stream().map(Settlement::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(Payment::getSettlementId));
        Map<String, String> names = loadNames(settlements);

        return settlements.stream()
                .map(s -> toResponse(s, paymentsBySettlement.getOrDefault(s.getId(), List.of()), names))
                .toList();
    }

    public SettlementResponse getSettlement(UUID settlementId, String actingUserId)
            throws SettlementNotFoundException, ForbiddenOperationException {
        Settlement settlement = findSettlement(settlementId);
        requireMember(settlement.getTripId(), actingUserId);
        return toResponse(settlement);
    }

    /**
     * Records a repayment. Only the creditor or a trip organizer may record payments.
     *
     * @throws PaymentExceedsSettlementException if payments would exceed the settlement amount
     * @throws IllegalStateException             if the settlement is already verified
     */
    @Transactional(rollbackOn = Exception.class)
    public PaymentResponse recordPayment(UUID settlementId, String actingUserId, RecordPaymentRequest request)
            throws SettlementNotFoundException, TripNotFoundException, ForbiddenOperationException,
            PaymentExceedsSettlementException {
        Settlement settlement = lockSettlement(settlementId);
        if (!settlement.getToUserId().equals(actingUserId) && !isOrganizer(settlement.getTripId(), actingUserId)) {
            throw new ForbiddenOperationException("Only the payment receiver or trip organizers can record payments");
        }
        requireNotVerified(settlement);

        BigDecimal totalPaid = paymentRepository.sumAmountBySettlementId(settlementId).add(request.amount());
        requireWithinAmount(settlement, totalPaid);

        LocalDateTime now = LocalDateTime.now(clock);
        Payment payment = new Payment();
        payment.setSettlementId(settlementId);
        payment.setAmount(request.amount());
        payment.setPaidAt(request.paidAt() != null ? request.paidAt() : now);
        payment.setPaymentMethod(request.paymentMethod());
        payment.setPaymentReference(request.paymentReference());
        payment.setNotes(request.notes());
        payment.setRecordedById(actingUserId);
        payment.setCreatedAt(now);
        payment = paymentRepository.save(payment);

        applyDerivedStatus(settlement, totalPaid);

        log.info("Payment {} of {} {} recorded on settlement {} by {} (total paid {})",
                payment.getId(), payment.getAmount(), settlement.getCurrency(), settlementId, actingUserId, totalPaid);
        return new PaymentResponse(PaymentMapper.INSTANCE.toDTO(payment), toResponse(settlement));
    }

    @Transactional(rollbackOn = Exception.class)
    public PaymentResponse updatePayment(UUID settlementId, UUID paymentId, String actingUserId,
                                         UpdatePaymentRequest request)
            throws SettlementNotFoundException, PaymentNotFoundException, TripNotFoundException,
            ForbiddenOperationException, PaymentExceedsSettlementException {
        Settlement settlement = lockSettlement(settlementId);
        Payment payment = paymentRepository.findByIdAndSettlementId(paymentId, settlementId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        requirePaymentEditor(settlement, payment, actingUserId);
        requireNotVerified(settlement);

        if (request.amount() != null) {
            BigDecimal totalPaid = paymentRepository.sumAmountBySettlementId(settlementId)
                    .subtract(payment.getAmount())
                    .add(request.amount());
            requireWithinAmount(settlement, totalPaid);
            payment.setAmount(request.amount());
        }
        if (request.paidAt() != null) {
            payment.setPaidAt(request.paidAt());
        }
        if (request.paymentMethod() != null) {
            payment.setPaymentMethod(request.paymentMethod());
        }
        if (request.paymentReference() != null) {
            payment.setPaymentReference(request.paymentReference());
        }
        if (request.notes() != null) {
            payment.setNotes(request.notes());
        }
        payment = paymentRepository.saveAndFlush(payment);

        applyDerivedStatus(settlement, paymentRepository.sumAmountBySettlementId(settlementId));

        log.info("Payment {} on settlement {} updated by {}", paymentId, settlementId, actingUserId);
        return new PaymentResponse(PaymentMapper.INSTANCE.toDTO(payment), toResponse(settlement));
    }

    /**
     * Deletes a payment; the settlement status falls back accordingly.
     *
     * @return Response with no payment and the updated settlement
     */
    @Transactional(rollbackOn = Exception.class)
    public PaymentResponse deletePayment(UUID settlementId, UUID paymentId, String actingUserId)
            throws SettlementNotFoundException, PaymentNotFoundException, TripNotFoundException,
            ForbiddenOperationException {
        Settlement settlement = lockSettlement(settlementId);
        Payment payment = paymentRepository.findByIdAndSettlementId(paymentId, settlementId)
                .orElseThrow(() -> new PaymentNotFoundException(paymentId));
        requirePaymentEditor(settlement, payment, actingUserId);
        requireNotVerified(settlement);

        paymentRepository.delete(payment);
        paymentRepository.flush();

        applyDerivedStatus(settlement, paymentRepository.sumAmountBySettlementId(settlementId));

        log.info("Payment {} deleted from settlement {} by {}", paymentId, settlementId, actingUserId);
        return new PaymentResponse(null, toResponse(settlement));
    }

    /**
     * Creditor confirms receipt of a fully paid settlement.
     *
     * @throws IllegalStateException if the settlement is not PAID
     */
    @Transactional(rollbackOn = Exception.class)
    public SettlementResponse verifySettlement(UUID settlementId, String actingUserId)
            throws SettlementNotFoundException, TripNotFoundException, ForbiddenOperationException {
        Settlement settlement = lockSettlement(settlementId);
        if (!settlement.getToUserId().equals(actingUserId)) {
            throw new ForbiddenOperationException("Only the payment receiver can verify a settlement");
        }
        if (settlement.getStatus() != SettlementStatus.PAID) {
            throw new IllegalStateException("Only PAID settlements can be verified, current status: "
                    + settlement.getStatus());
        }
        stateMachine.validateTransition(settlement.getStatus(), SettlementStatus.VERIFIED);

        settlement.setStatus(SettlementStatus.VERIFIED);
        settlement.setUpdatedAt(LocalDateTime.now(clock));
        settlementRepository.save(settlement);

        log.info("Settlement {} verified by {}", settlementId, actingUserId);
        return toResponse(settlement);
    }

    /**
     * Derives the payment status from the amount paid so far.
     */
    SettlementStatus deriveStatus(BigDecimal settlementAmount, BigDecimal totalPaid) {
        BigDecimal remaining = settlementAmount.subtract(totalPaid);
        if (remaining.compareTo(tolerance) <= 0) {
            return SettlementStatus.PAID;
        }
        if (totalPaid.compareTo(tolerance) > 0) {
            return SettlementStatus.PARTIALLY_PAID;
        }
        return SettlementStatus.PENDING;
    }

    private void applyDerivedStatus(Settlement settlement, BigDecimal totalPaid) {
        SettlementStatus next = deriveStatus(settlement.getAmount(), totalPaid);
        if (next != settlement.getStatus()) {
            stateMachine.validateTransition(settlement.getStatus(), next);
            log.info("Settlement {} status {} → {}", settlement.getId(), settlement.getStatus(), next);
            settlement.setStatus(next);
        }
        settlement.setUpdatedAt(LocalDateTime.now(clock));
        settlementRepository.save(settlement);
    }

    /**
     * Locks the settlement's trip so payments serialize with spend window transitions.
     */
    private Settlement lockSettlement(UUID settlementId) throws SettlementNotFoundException, TripNotFoundException {
        Settlement settlement = findSettlement(settlementId);
        UUID tripId = settlement.getTripId();
        tripRepository.findByIdForUpdate(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
        // the settlement may have been replaced while we waited for the lock
        return findSettlement(settlementId);
    }

    private Settlement findSettlement(UUID settlementId) throws SettlementNotFoundException {
        return settlementRepository.findById(settlementId)
                .orElseThrow(() -> new SettlementNotFoundException(settlementId));
    }

    private void requireWithinAmount(Settlement settlement, BigDecimal totalPaid)
            throws PaymentExceedsSettlementException {
        if (totalPaid.compareTo(settlement.getAmount().add(tolerance)) > 0) {
            throw new PaymentExceedsSettlementException(totalPaid, settlement.getAmount());
        }
    }

    private void requireNotVerified(Settlement settlement) {
        if (stateMachine.isFinalState(settlement.getStatus())) {
            throw new IllegalStateException("Settlement " + settlement.getId() + " is already verified");
        }
    }

    private void requirePaymentEditor(Settlement settlement, Payment payment, String actingUserId)
            throws ForbiddenOperationException {
        boolean recorder = payment.getRecordedById().equals(actingUserId);
        boolean receiver = settlement.getToUserId().equals(actingUserId);
        if (!recorder && !receiver && !isOrganizer(settlement.getTripId(), actingUserId)) {
            throw new ForbiddenOperationException("Only the recorder, the receiver or trip organizers can change payments");
        }
    }

    private void requireMember(UUID tripId, String actingUserId) throws ForbiddenOperationException {
        if (actingUserId == null
                || !tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, actingUserId)) {
            throw new ForbiddenOperationException("You are not a member of this trip");
        }
    }

    private boolean isOrganizer(UUID tripId, String userId) {
        return tripMemberRepository.findByTripIdAndUserIdAndDeletedAtIsNull(tripId, userId)
                .map(TripMember::getRole)
                .map(TripMemberRole::isOrganizer)
                .orElse(false);
    }

    private SettlementResponse toResponse(Settlement settlement) {
        List<Payment> payments = paymentRepository.findBySettlementIdOrderByPaidAtAsc(settlement.getId());
        return toResponse(settlement, payments, loadNames(List.of(settlement)));
    }

    private SettlementResponse toResponse(Settlement settlement, List<Payment> payments, Map<String, String> names) {
        BigDecimal totalPaid = payments.stream().map(Payment::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal remaining = settlement.getAmount().subtract(totalPaid).max(BigDecimal.ZERO);
        List<PaymentDTO> paymentDTOs = PaymentMapper.INSTANCE.toDTOList(payments);

        return new SettlementResponse(
                settlement.getId(),
                settlement.getTripId(),
                settlement.getFromUserId(),
                names.getOrDefault(settlement.getFromUserId(), settlement.getFromUserId()),
                settlement.getToUserId(),
                names.getOrDefault(settlement.getToUserId(), settlement.getToUserId()),
                settlement.getAmount(),
                settlement.getCurrency(),
                settlement.getStatus(),
                settlement.getNotes(),
                settlement.getCreatedAt(),
                totalPaid,
                remaining,
                paymentDTOs);
    }

    private Map<String, String> loadNames(List<Settlement> settlements) {
        Set<String> userIds = new HashSet<>();
        settlements.forEach(s -> {
            userIds.add(s.getFromUserId());
            userIds.add(s.getToUserId());
        });
        return appUserRepository.findByIdIn(userIds).stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getName));
    }
}
