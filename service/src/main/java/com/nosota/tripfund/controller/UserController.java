package com.nosota.tripfund.controller;

import com.nosota.tripfund.api.UserApi;
import com.nosota.tripfund.api.request.UpsertUserRequest;
import com.nosota.tripfund.api.response.UserResponse;
import com.nosota.tripfund.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class UserController implements UserApi {

    private final UserService userService;

    @Override
    public ResponseEntity<UserResponse> upsertUser(String actingUserId, String userId, UpsertUserRequest request)
            throws Exception {
        return ResponseEntity.ok(userService.upsertUser(actingUserId, userId, request));
    }

    @Override
    public ResponseEntity<UserResponse> getUser(String userId) throws Exception {
        return ResponseEntity.ok(userService.getUser(userId));
    }
}
