package com.nosota.tripfund.service;

import com.nosota.tripfund.api.dto.TripMemberDTO;
import com.nosota.tripfund.api.model.Money;
import com.nosota.tripfund.api.model.RsvpStatus;
import com.nosota.tripfund.api.model.SpendStatus;
import com.nosota.tripfund.api.model.TripMemberRole;
import com.nosota.tripfund.api.request.AddMemberRequest;
import com.nosota.tripfund.api.request.CreateTripRequest;
import com.nosota.tripfund.api.request.UpdateRsvpRequest;
import com.nosota.tripfund.api.response.TripResponse;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.TripNotFoundException;
import com.nosota.tripfund.error.UserNotFoundException;
import com.nosota.tripfund.mapper.TripMapper;
import com.nosota.tripfund.model.AppUser;
import com.nosota.tripfund.model.Trip;
import com.nosota.tripfund.model.TripMember;
import com.nosota.tripfund.repository.AppUserRepository;
import com.nosota.tripfund.repository.TripMemberRepository;
import com.nosota.tripfund.repository.TripRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Trip and membership management.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripService {

    private final TripRepository tripRepository;
    private final TripMemberRepository tripMemberRepository;
    private final AppUserRepository appUserRepository;
    private final TimelineService timelineService;
    private final Clock clock;

    /**
     * Creates a trip with the caller as OWNER and seeds its default milestones.
     *
     * @throws UserNotFoundException if the caller has no synced profile
     */
    @Transactional(rollbackOn = Exception.class)
    public TripResponse createTrip(String actingUserId, CreateTripRequest request) throws UserNotFoundException {
        appUserRepository.findById(actingUserId).orElseThrow(() -> new UserNotFoundException(actingUserId));
        if (request.startDate() != null && request.endDate() != null
                && request.endDate().isBefore(request.startDate())) {
            throw new IllegalArgumentException("Trip end date must not be before its start date");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Trip trip = new Trip();
        trip.setName(request.name());
        trip.setDescription(request.description());
        trip.setBaseCurrency(Money.zero(request.baseCurrency()).currencyCode());
        trip.setStartDate(request.startDate());
        trip.setEndDate(request.endDate());
        trip.setSpendStatus(SpendStatus.OPEN);
        trip.setCreatedById(actingUserId);
        trip.setCreatedAt(now);
        trip = tripRepository.save(trip);

        tripMemberRepository.save(newMember(trip.getId(), actingUserId, TripMemberRole.OWNER, RsvpStatus.ACCEPTED, now));
        timelineService.seedDefaultMilestones(trip);

        log.info("Trip {} '{}' created by {} (baseCurrency={})",
                trip.getId(), trip.getName(), actingUserId, trip.getBaseCurrency());
        return TripMapper.INSTANCE.toResponse(trip);
    }

    public TripResponse getTrip(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        Trip trip = findTrip(tripId);
        requireMember(tripId, actingUserId);
        return TripMapper.INSTANCE.toResponse(trip);
    }

    public List<TripMemberDTO> getMembers(UUID tripId, String actingUserId)
            throws TripNotFoundException, ForbiddenOperationException {
        findTrip(tripId);
        requireMember(tripId, actingUserId);

        List<TripMember> members = tripMemberRepository.findByTripIdAndDeletedAtIsNullOrderByCreatedAtAsc(tripId);
        Map<String, AppUser> users = appUserRepository
                .findByIdIn(members.stream().map(TripMember::getUserId).toList()).stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));
        return members.stream()
                .map(member -> toMemberDTO(member, users.get(member.getUserId())))
                .toList();
    }

    /**
     * Adds a user to the trip. Organizers only; ADMIN can not grant OWNER.
     */
    @Transactional(rollbackOn = Exception.class)
    public TripMemberDTO addMember(UUID tripId, String actingUserId, AddMemberRequest request)
            throws TripNotFoundException, ForbiddenOperationException, UserNotFoundException {
        findTrip(tripId);
        TripMember actor = tripMemberRepository.findByTripIdAndUserIdAndDeletedAtIsNull(tripId, actingUserId)
                .orElseThrow(() -> new ForbiddenOperationException("You are not a member of this trip"));
        if (!actor.getRole().isOrganizer()) {
            throw new ForbiddenOperationException("Only trip organizers can add members");
        }

        TripMemberRole role = request.role() != null ? request.role() : TripMemberRole.MEMBER;
        if (role == TripMemberRole.OWNER && actor.getRole() != TripMemberRole.OWNER) {
            throw new ForbiddenOperationException("Only the trip owner can add another owner");
        }
        AppUser user = appUserRepository.findById(request.userId())
                .orElseThrow(() -> new UserNotFoundException(request.userId()));
        if (tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, request.userId())) {
            throw new IllegalStateException("User " + request.userId() + " is already a member of this trip");
        }

        RsvpStatus rsvp = request.rsvpStatus() != null ? request.rsvpStatus() : RsvpStatus.PENDING;
        TripMember member = tripMemberRepository.save(
                newMember(tripId, request.userId(), role, rsvp, LocalDateTime.now(clock)));

        log.info("User {} added to trip {} as {} by {}", request.userId(), tripId, role, actingUserId);
        return toMemberDTO(member, user);
    }

    /**
     * Updates the caller's own RSVP. RSVP does not affect balances.
     */
    @Transactional(rollbackOn = Exception.class)
    public TripMemberDTO updateRsvp(UUID tripId, String actingUserId, UpdateRsvpRequest request)
            throws TripNotFoundException, ForbiddenOperationException {
        findTrip(tripId);
        TripMember member = tripMemberRepository.findByTripIdAndUserIdAndDeletedAtIsNull(tripId, actingUserId)
                .orElseThrow(() -> new ForbiddenOperationException("You are not a member of this trip"));
        member.setRsvpStatus(request.rsvpStatus());
        member = tripMemberRepository.save(member);

        log.info("User {} RSVP on trip {} set to {}", actingUserId, tripId, request.rsvpStatus());
        return toMemberDTO(member, appUserRepository.findById(actingUserId).orElse(null));
    }

    private Trip findTrip(UUID tripId) throws TripNotFoundException {
        return tripRepository.findByIdAndDeletedAtIsNull(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
    }

    private void requireMember(UUID tripId, String userId) throws ForbiddenOperationException {
        if (userId == null || !tripMemberRepository.existsByTripIdAndUserIdAndDeletedAtIsNull(tripId, userId)) {
            throw new ForbiddenOperationException("You are not a member of this trip");
        }
    }

    private static TripMember newMember(UUID tripId, String userId, TripMemberRole role, RsvpStatus rsvp,
                                        LocalDateTime now) {
        TripMember member = new TripMember();
        member.setTripId(tripId);
        member.setUserId(userId);
        member.setRole(role);
        member.setRsvpStatus(rsvp);
        member.setCreatedAt(now);
        return member;
    }

    private static TripMemberDTO toMemberDTO(TripMember member, AppUser user) {
        return new TripMemberDTO(
                member.getUserId(),
                user != null ? user.getName() : member.getUserId(),
                user != null ? user.getEmail() : null,
                member.getRole(),
                member.getRsvpStatus(),
                member.getCreatedAt());
    }
}
