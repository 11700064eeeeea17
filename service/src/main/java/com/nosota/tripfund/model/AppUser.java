package com.nosota.tripfund.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * User profile synced from the identity provider.
 *
 * <p>The primary key is the provider's uid, so no ID is generated here.
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AppUser {

    @Id
    @Column(name = "id", nullable = false, length = 128)
    private String id;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "photo_url", length = 1000)
    private String photoUrl;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * Name shown in balances and settlements: display name, or email when none is set.
     */
    public String getName() {
        return displayName != null && !displayName.isBlank() ? displayName : email;
    }
}
