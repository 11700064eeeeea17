package com.nosota.tripfund.api;

import com.nosota.tripfund.api.dto.TimelineItemDTO;
import com.nosota.tripfund.api.dto.TripMemberDTO;
import com.nosota.tripfund.api.request.AddMemberRequest;
import com.nosota.tripfund.api.request.CreateTripRequest;
import com.nosota.tripfund.api.request.SpendStatusRequest;
import com.nosota.tripfund.api.request.UpdateRsvpRequest;
import com.nosota.tripfund.api.response.SpendStatusResponse;
import com.nosota.tripfund.api.response.TripBalanceSummaryResponse;
import com.nosota.tripfund.api.response.TripResponse;
import com.nosota.tripfund.api.response.UserBalanceResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of TripApi for consuming the tripfund service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class TripFundClientConfig {
 *     @Bean
 *     public WebClient tripFundWebClient(WebClient.Builder builder,
 *                                        @Value("${services.tripfund.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public TripClient tripClient(WebClient tripFundWebClient) {
 *         return new TripClient(tripFundWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class TripClient implements TripApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<TripResponse> createTrip(String actingUserId, CreateTripRequest request) {
        log.debug("Calling createTrip: name={}", request.name());

        return webClient.post()
                .uri("/api/v1/trips")
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(TripResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TripResponse> getTrip(String actingUserId, UUID tripId) {
        log.debug("Calling getTrip: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(TripResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TripMemberDTO>> getMembers(String actingUserId, UUID tripId) {
        log.debug("Calling getMembers: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/members", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TripMemberDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<TripMemberDTO> addMember(String actingUserId, UUID tripId, AddMemberRequest request) {
        log.debug("Calling addMember: tripId={}, userId={}", tripId, request.userId());

        return webClient.post()
                .uri("/api/v1/trips/{tripId}/members", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(TripMemberDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<TripMemberDTO> updateRsvp(String actingUserId, UUID tripId, UpdateRsvpRequest request) {
        log.debug("Calling updateRsvp: tripId={}, rsvp={}", tripId, request.rsvpStatus());

        return webClient.put()
                .uri("/api/v1/trips/{tripId}/members/me/rsvp", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(TripMemberDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<SpendStatusResponse> changeSpendStatus(String actingUserId, UUID tripId,
                                                                 SpendStatusRequest request) {
        log.debug("Calling changeSpendStatus: tripId={}, request={}", tripId, request);

        WebClient.RequestBodySpec spec = webClient.post()
                .uri("/api/v1/trips/{tripId}/spend-status", tripId)
                .header(ApiHeaders.USER_ID, actingUserId);
        if (request != null) {
            spec.bodyValue(request);
        }
        return spec.retrieve()
                .toEntity(SpendStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TripBalanceSummaryResponse> getBalances(String actingUserId, UUID tripId) {
        log.debug("Calling getBalances: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/balances", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(TripBalanceSummaryResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UserBalanceResponse> getUserBalance(String actingUserId, UUID tripId, String userId) {
        log.debug("Calling getUserBalance: tripId={}, userId={}", tripId, userId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/balances/{userId}", tripId, userId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(UserBalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TimelineItemDTO>> getTimeline(String actingUserId, UUID tripId) {
        log.debug("Calling getTimeline: tripId={}", tripId);

        return webClient.get()
                .uri("/api/v1/trips/{tripId}/timeline", tripId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TimelineItemDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<TimelineItemDTO> toggleMilestone(String actingUserId, UUID tripId, UUID itemId) {
        log.debug("Calling toggleMilestone: tripId={}, itemId={}", tripId, itemId);

        return webClient.post()
                .uri("/api/v1/trips/{tripId}/timeline/{itemId}/toggle", tripId, itemId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .retrieve()
                .toEntity(TimelineItemDTO.class)
                .block();
    }
}
