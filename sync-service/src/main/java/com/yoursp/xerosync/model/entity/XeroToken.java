package com.yoursp.xerosync.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Durable OAuth2 credential for a user. One row per user, updated in place on refresh.
 */
@Entity
@Table(name = "xero_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class XeroToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /** Full token JSON, see XeroTokenData. */
    @Column(name = "token_data", columnDefinition = "TEXT", nullable = false)
    private String tokenData;

    /** Tenant currently selected for the user's session; null until one is chosen. */
    @Column(name = "tenant_id", length = 200)
    private String tenantId;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    /** Mirrors expires_at inside token_data. */
    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
