package com.nosota.tripfund.service;

import com.nosota.tripfund.api.request.UpsertUserRequest;
import com.nosota.tripfund.api.response.UserResponse;
import com.nosota.tripfund.error.ForbiddenOperationException;
import com.nosota.tripfund.error.UserNotFoundException;
import com.nosota.tripfund.mapper.UserMapper;
import com.nosota.tripfund.model.AppUser;
import com.nosota.tripfund.repository.AppUserRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Keeps user profiles in sync with the identity provider.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final AppUserRepository appUserRepository;
    private final Clock clock;

    /**
     * Creates the profile on first sign-in and refreshes it afterwards.
     *
     * @throws ForbiddenOperationException if a user tries to sync someone else's profile
     */
    @Transactional(rollbackOn = Exception.class)
    public UserResponse upsertUser(String actingUserId, String userId, UpsertUserRequest request)
            throws ForbiddenOperationException {
        if (!userId.equals(actingUserId)) {
            throw new ForbiddenOperationException("Users can only sync their own profile");
        }

        AppUser user = appUserRepository.findById(userId).orElseGet(() -> {
            AppUser created = new AppUser();
            created.setId(userId);
            created.setCreatedAt(LocalDateTime.now(clock));
            log.info("Creating profile for user {}", userId);
            return created;
        });
        user.setDisplayName(request.displayName());
        user.setEmail(request.email());
        user.setPhotoUrl(request.photoUrl());
        user = appUserRepository.save(user);

        return UserMapper.INSTANCE.toResponse(user);
    }

    public UserResponse getUser(String userId) throws UserNotFoundException {
        return appUserRepository.findById(userId)
                .map(UserMapper.INSTANCE::toResponse)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
