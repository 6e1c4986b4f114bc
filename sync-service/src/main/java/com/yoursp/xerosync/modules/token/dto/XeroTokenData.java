package com.yoursp.xerosync.modules.token.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Canonical token shape stored in {@code xero_tokens.token_data}.
 *
 * @param expiresAt absolute expiry, epoch seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record XeroTokenData(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") Long expiresIn,
        @JsonProperty("expires_at") Long expiresAt,
        @JsonProperty("scope") String scope) {

    @JsonIgnore
    public Instant expiresAtInstant() {
        return expiresAt != null ? Instant.ofEpochSecond(expiresAt) : Instant.EPOCH;
    }

    /** True when the token is past, or within {@code margin} of, its expiry. */
    public boolean isExpired(Instant now, Duration margin) {
        if (expiresAt == null) {
            return true;
        }
        return !now.isBefore(expiresAtInstant().minus(margin));
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /** Value for an Authorization header. */
    @JsonIgnore
    public String authorizationHeader() {
        return (tokenType != null ? tokenType : "Bearer") + " " + accessToken;
    }
}
