package com.nosota.tripfund.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Profile sync from the identity provider.
 */
public record UpsertUserRequest(
        @Size(max = 200, message = "Display name must be at most 200 characters")
        String displayName,

        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        String email,

        String photoUrl
) {
}
