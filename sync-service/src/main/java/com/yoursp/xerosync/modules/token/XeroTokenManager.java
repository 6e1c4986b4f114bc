package com.yoursp.xerosync.modules.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.xerosync.config.XeroProperties;
import com.yoursp.xerosync.model.entity.XeroToken;
import com.yoursp.xerosync.modules.token.dto.XeroTokenData;
import com.yoursp.xerosync.repository.XeroTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serves a valid Xero access token per user.
 * <ul>
 * <li>In-memory cache keyed by user id; the xero_tokens table is the source of truth</li>
 * <li>A token is treated as expired 60 seconds before its real expiry</li>
 * <li>Expired tokens are refreshed with the refresh_token grant and written back in place</li>
 * <li>One lock per user: concurrent callers wait for a single in-flight refresh</li>
 * </ul>
 * Lookup and refresh failures never propagate: callers get an empty result and
 * should skip their run.
 */
@Slf4j
@Service
public class XeroTokenManager {

    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final XeroTokenRepository tokenRepository;
    private final RestTemplate restTemplate;
    private final XeroProperties xeroProperties;
    private final ObjectMapper objectMapper;

    private final ConcurrentMap<UUID, XeroTokenData> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<UUID, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public XeroTokenManager(XeroTokenRepository tokenRepository,
            RestTemplate restTemplate,
            XeroProperties xeroProperties,
            ObjectMapper objectMapper) {
        this.tokenRepository = tokenRepository;
        this.restTemplate = restTemplate;
        this.xeroProperties = xeroProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a token valid for at least the next 60 seconds.
     *
     * @param userId owner of the credential, required
     * @return the token, or empty when none is stored or it could not be refreshed
     */
    public Optional<XeroTokenData> getCurrentToken(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required to look up a Xero token");
        }

        XeroTokenData cached = cache.get(userId);
        if (cached != null && !isExpired(cached)) {
            log.debug("Using cached token for user {}", userId);
            return Optional.of(cached);
        }

        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            // Another caller may have refreshed while we waited
            cached = cache.get(userId);
            if (cached != null && !isExpired(cached)) {
                log.debug("Using token refreshed by a concurrent caller for user {}", userId);
                return Optional.of(cached);
            }
            return loadOrRefresh(userId);
        } catch (RuntimeException e) {
            log.error("Error getting token for user {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Normalize a raw token endpoint response and upsert it for the user.
     * The cache is only updated once the row is saved.
     *
     * @param tokenPayload raw provider response (access_token, refresh_token, expires_in, ...)
     * @return true when the token was persisted
     */
    public boolean storeToken(Map<String, Object> tokenPayload, UUID userId) {
        XeroTokenData token = normalize(tokenPayload);
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return persist(token, userId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the user's credential from cache and store. Invalidating an absent
     * credential succeeds.
     *
     * @return false only when the store could not be updated
     */
    public boolean invalidateToken(UUID userId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            cache.remove(userId);
            int deleted = tokenRepository.deleteAllByUserId(userId);
            if (deleted > 0) {
                log.info("Token invalidated for user {}", userId);
            } else {
                log.debug("No stored token to invalidate for user {}", userId);
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Error invalidating token for user {}: {}", userId, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tenant currently selected in the user's credential row.
     */
    public Optional<String> getActiveTenantId(UUID userId) {
        try {
            return tokenRepository.findFirstByUserIdOrderByExpiresAtDesc(userId)
                    .map(XeroToken::getTenantId)
                    .filter(tenantId -> !tenantId.isBlank());
        } catch (RuntimeException e) {
            log.error("Error getting active tenant for user {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Record the tenant selection on the user's credential row.
     *
     * @return false when the user has no stored credential
     */
    public boolean setActiveTenant(UUID userId, String tenantId) {
        int updated = tokenRepository.updateTenantId(userId, tenantId);
        if (updated == 0) {
            log.warn("No Xero token stored for user {}, cannot select tenant {}", userId, tenantId);
            return false;
        }
        log.info("Active tenant for user {} set to {}", userId, tenantId);
        return true;
    }

    // ================================================================
    // Internals
    // ================================================================

    private Optional<XeroTokenData> loadOrRefresh(UUID userId) {
        XeroToken record;
        try {
            record = tokenRepository.findFirstByUserIdOrderByExpiresAtDesc(userId).orElse(null);
        } catch (RuntimeException e) {
            log.error("Token store unavailable while loading token for user {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        }

        if (record == null || record.getTokenData() == null || record.getTokenData().isBlank()) {
            log.warn("No token found for user {}", userId);
            cache.remove(userId);
            return Optional.empty();
        }

        XeroTokenData token;
        try {
            token = objectMapper.readValue(record.getTokenData(), XeroTokenData.class);
        } catch (JsonProcessingException e) {
            log.error("Stored token for user {} is not valid JSON: {}", userId, e.getOriginalMessage());
            cache.remove(userId);
            return Optional.empty();
        }

        if (!isExpired(token)) {
            cache.put(userId, token);
            return Optional.of(token);
        }

        // Never hand out expired material
        cache.remove(userId);
        log.info("Token for user {} expired at {}, refreshing", userId, token.expiresAtInstant());

        Optional<XeroTokenData> refreshed = refreshToken(token);
        if (refreshed.isEmpty()) {
            return Optional.empty();
        }
        if (!persist(refreshed.get(), userId)) {
            // Xero rotates refresh tokens, so this run can still use the new access token
            log.warn("Refreshed token for user {} could not be stored; using it for this call only", userId);
        }
        return refreshed;
    }

    /**
     * Exchange the stored refresh token for a new token. Exactly one attempt.
     */
    Optional<XeroTokenData> refreshToken(XeroTokenData oldToken) {
        if (!oldToken.hasRefreshToken()) {
            log.warn("Token has no refresh_token, it cannot be revived");
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", oldToken.refreshToken());
        form.add("client_id", xeroProperties.getClientId());
        form.add("client_secret", xeroProperties.getClientSecret());

        try {
            @SuppressWarnings("rawtypes")
            ResponseEntity<Map> response = restTemplate.exchange(
                    xeroProperties.getTokenEndpoint(),
                    HttpMethod.POST,
                    new HttpEntity<>(form, headers),
                    Map.class);

            if (response.getStatusCode().value() != 200 || response.getBody() == null) {
                log.error("Token refresh failed with status {}", response.getStatusCode().value());
                return Optional.empty();
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> body = response.getBody();
            XeroTokenData newToken = normalize(body);
            log.info("Token refreshed successfully, new expiry {}", newToken.expiresAtInstant());
            return Optional.of(newToken);

        } catch (Exception e) {
            log.error("Error refreshing token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private boolean persist(XeroTokenData token, UUID userId) {
        try {
            String json = objectMapper.writeValueAsString(token);
            OffsetDateTime expiresAt = OffsetDateTime.ofInstant(token.expiresAtInstant(), ZoneOffset.UTC);

            XeroToken record = tokenRepository.findFirstByUserIdOrderByExpiresAtDesc(userId)
                    .orElseGet(() -> XeroToken.builder().userId(userId).build());
            record.setTokenData(json);
            record.setExpiresAt(expiresAt);
            tokenRepository.save(record);

            cache.put(userId, token);
            log.info("Token stored successfully for user {}", userId);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize token for user {}: {}", userId, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Error storing token for user {}: {}", userId, e.getMessage(), e);
            return false;
        }
    }

    XeroTokenData normalize(Map<String, Object> raw) {
        long expiresIn = raw.get("expires_in") instanceof Number n ? n.longValue() : 0L;
        Object tokenType = raw.get("token_type");
        Object scope = raw.get("scope");
        return new XeroTokenData(
                stringOrNull(raw.get("access_token")),
                tokenType != null ? tokenType.toString() : "Bearer",
                stringOrNull(raw.get("refresh_token")),
                expiresIn,
                Instant.now().plusSeconds(expiresIn).getEpochSecond(),
                scope != null ? scope.toString() : xeroProperties.getScope());
    }

    private boolean isExpired(XeroTokenData token) {
        return token.isExpired(Instant.now(), EXPIRY_MARGIN);
    }

    private ReentrantLock lockFor(UUID userId) {
        return userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }
}
