package com.nosota.tripfund.api.response;

import java.time.LocalDateTime;

public record UserResponse(
        String userId,
        String displayName,
        String email,
        String photoURL,
        LocalDateTime createdAt
) {
}
