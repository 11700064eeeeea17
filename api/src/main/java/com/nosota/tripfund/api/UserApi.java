package com.nosota.tripfund.api;

import com.nosota.tripfund.api.request.UpsertUserRequest;
import com.nosota.tripfund.api.response.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * User profile API.
 *
 * <p>Profiles are synced from the identity provider after sign-in; they supply the
 * display fields shown in balances and settlements.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>UserController - in service module (server-side implementation)</li>
 *   <li>UserClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/users")
public interface UserApi {

    /**
     * Creates or updates the caller's profile. A user may only sync their own profile.
     *
     * @param actingUserId Caller ID
     * @param userId       Profile ID (must equal the caller)
     * @param request      Profile fields
     * @return Stored profile
     */
    @PutMapping("/{userId}")
    ResponseEntity<UserResponse> upsertUser(
            @RequestHeader(ApiHeaders.USER_ID) String actingUserId,
            @PathVariable("userId") String userId,
            @Valid @RequestBody UpsertUserRequest request) throws Exception;

    @GetMapping("/{userId}")
    ResponseEntity<UserResponse> getUser(
            @PathVariable("userId") String userId) throws Exception;
}
