package com.nosota.tripfund.api;

import com.nosota.tripfund.api.request.UpsertUserRequest;
import com.nosota.tripfund.api.response.UserResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of UserApi.
 *
 * <p>Not a Spring @Component; register it as a bean in the consuming service,
 * see {@link TripClient} for a configuration example.
 */
@RequiredArgsConstructor
@Slf4j
public class UserClient implements UserApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<UserResponse> upsertUser(String actingUserId, String userId, UpsertUserRequest request) {
        log.debug("Calling upsertUser: userId={}", userId);

        return webClient.put()
                .uri("/api/v1/users/{userId}", userId)
                .header(ApiHeaders.USER_ID, actingUserId)
                .bodyValue(request)
                .retrieve()
                .toEntity(UserResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<UserResponse> getUser(String userId) {
        log.debug("Calling getUser: userId={}", userId);

        return webClient.get()
                .uri("/api/v1/users/{userId}", userId)
                .retrieve()
                .toEntity(UserResponse.class)
                .block();
    }
}
