package com.example.magiogateway.application.service;

import com.example.magiogateway.api.response.AuthStatusResponse;
import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppMagioProperties;
import com.example.magiogateway.domain.model.AuthError;
import com.example.magiogateway.domain.model.AuthHeaders;
import com.example.magiogateway.domain.model.AuthResult;
import com.example.magiogateway.domain.model.AuthState;
import com.example.magiogateway.domain.model.DeviceRegistration;
import com.example.magiogateway.domain.model.IssuedTokens;
import com.example.magiogateway.domain.model.TokenSet;
import com.example.magiogateway.infrastructure.magio.MagioApiClient;
import com.example.magiogateway.infrastructure.magio.MagioApiException;
import com.example.magiogateway.infrastructure.metrics.AuthMetrics;
import com.example.magiogateway.infrastructure.persistence.TokenPersistence;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Keeps one access/refresh token pair alive for the configured account.
 * <p>
 * Lookup order is memory, then cache, then the persisted record, then the network. Login and
 * refresh run under one lock; a thread that waited for the lock re-checks the token first, so
 * concurrent callers trigger a single network refresh. Failures never escape as exceptions:
 * they come back as {@link AuthResult} or as missing headers.
 */
@Service
public class MagioAuthService {

    private static final Logger log = LoggerFactory.getLogger(MagioAuthService.class);

    static final String TOKEN_CACHE_PREFIX = "auth_tokens_";
    static final String DEVICE_CACHE_PREFIX = "device_id_";

    private static final String OS_VERSION = "0.0.0";
    private static final String DEVICE_PLATFORM = "GO";

    private final AppMagioProperties properties;
    private final AppCacheProperties cacheProperties;
    private final MagioApiClient apiClient;
    private final TokenPersistence tokenPersistence;
    private final TtlCache cache;
    private final AuthMetrics metrics;
    private final Clock clock;
    private final String language;

    private final AtomicReference<TokenSet> tokens;
    private final ReentrantLock authLock = new ReentrantLock();
    private volatile FailureRecord lastFailure;

    @Autowired
    public MagioAuthService(AppMagioProperties properties,
                            AppCacheProperties cacheProperties,
                            MagioApiClient apiClient,
                            TokenPersistence tokenPersistence,
                            TtlCache cache,
                            AuthMetrics metrics) {
        this(properties, cacheProperties, apiClient, tokenPersistence, cache, metrics, Clock.systemUTC());
    }

    MagioAuthService(AppMagioProperties properties,
                     AppCacheProperties cacheProperties,
                     MagioApiClient apiClient,
                     TokenPersistence tokenPersistence,
                     TtlCache cache,
                     AuthMetrics metrics,
                     Clock clock) {
        this.properties = properties;
        this.cacheProperties = cacheProperties;
        this.apiClient = apiClient;
        this.tokenPersistence = tokenPersistence;
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.language = properties.normalizedLanguage();
        this.tokens = new AtomicReference<>(restoreTokens());
        log.info("Magio auth initialised (language: {}, base url: {})", language, properties.resolveBaseUrl());
    }

    /**
     * Full two-step login with the configured credentials. On failure the current token set is
     * left as it was.
     */
    public AuthResult login() {
        authLock.lock();
        try {
            return doLogin();
        } finally {
            authLock.unlock();
        }
    }

    /**
     * Makes sure the access token stays valid for at least the refresh margin. Falls back to a
     * full login once when the refresh token is missing or rejected.
     */
    public AuthResult refreshAccessToken() {
        TokenSet current = tokens.get();
        if (current.hasRefreshToken() && beyondMargin(current)) {
            return AuthResult.success("Token is valid");
        }
        authLock.lock();
        try {
            return doRefresh();
        } finally {
            authLock.unlock();
        }
    }

    /**
     * @return headers for an authenticated upstream call, or {@code null} when no valid token
     * could be obtained
     */
    public AuthHeaders getAuthHeaders() {
        AuthResult result = refreshAccessToken();
        if (!result.isSuccess()) {
            log.warn("No auth headers available: {}", result.getMessage());
            return null;
        }
        TokenSet current = tokens.get();
        if (!current.hasAccessToken()) {
            return null;
        }
        return new AuthHeaders(current.getAccessToken(), properties.resolveHost(), properties.getUserAgent());
    }

    /**
     * Drops the token set from memory, cache and disk. Safe to call repeatedly.
     *
     * @return false when the persisted record exists but could not be removed
     */
    public boolean logout() {
        authLock.lock();
        try {
            TokenSet current = tokens.get();
            tokens.set(TokenSet.loggedOut(current.getDeviceId()));
            lastFailure = null;
            cache.clear(tokenCacheKey());
            boolean deleted = tokenPersistence.delete(language);
            log.info("Logged out (language: {})", language);
            return deleted;
        } finally {
            authLock.unlock();
        }
    }

    public AuthStatusResponse getAuthStatus() {
        TokenSet current = tokens.get();
        double now = nowSeconds();
        boolean tokenValid = current.validAt(now);
        long remaining = tokenValid ? current.secondsRemaining(now) : 0L;

        AuthStatusResponse status = new AuthStatusResponse();
        status.setAuthenticated(tokenValid);
        status.setUsername(tokenValid ? properties.getUsername() : null);
        status.setLanguage(language);
        status.setDeviceId(current.getDeviceId());
        status.setTokenValid(tokenValid);
        status.setRefreshValid(current.hasRefreshToken());
        status.setTokenExpiresIn(remaining);
        status.setTokenExpiresFormatted(remaining > 0 ? formatRemaining(remaining) : "expired");
        status.setState(currentState(current));
        FailureRecord failure = lastFailure;
        if (failure != null) {
            status.setLastError(failure.error);
            status.setLastErrorMessage(failure.message);
            status.setLastErrorAt(failure.at.toString());
        }
        return status;
    }

    public AuthState currentState() {
        return currentState(tokens.get());
    }

    public String getLanguage() {
        return language;
    }

    public String getDeviceId() {
        return tokens.get().getDeviceId();
    }

    TokenSet currentTokens() {
        return tokens.get();
    }

    static String formatRemaining(long seconds) {
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + secs + "s";
        }
        return secs + "s";
    }

    // --- Private methods ---

    private AuthResult doLogin() {
        if (!StringUtils.hasText(properties.getUsername()) || !StringUtils.hasText(properties.getPassword())) {
            log.error("Login skipped: username or password is not configured");
            metrics.recordLogin(AuthMetrics.OUTCOME_FAILURE);
            return fail(AuthError.CONFIG_ERROR, "Username or password is not configured");
        }

        TokenSet current = tokens.get();
        DeviceRegistration registration = new DeviceRegistration(
                current.getDeviceId(),
                properties.getDeviceName(),
                properties.getDeviceType(),
                OS_VERSION,
                properties.getAppVersion(),
                language.toUpperCase(Locale.ROOT),
                DEVICE_PLATFORM);
        try {
            String temporaryToken = apiClient.initSession(registration);
            IssuedTokens issued = apiClient.login(temporaryToken, properties.getUsername(), properties.getPassword());
            TokenSet updated = adopt(issued, current.getDeviceId());
            metrics.recordLogin(AuthMetrics.OUTCOME_SUCCESS);
            lastFailure = null;
            log.info("Login succeeded, token valid for {}", formatRemaining(updated.secondsRemaining(nowSeconds())));
            return AuthResult.success("Logged in");
        } catch (MagioApiException e) {
            log.error("Login failed: {}", e.getMessage());
            metrics.recordLogin(AuthMetrics.OUTCOME_FAILURE);
            return fail(e.toAuthError(), "Login failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Login failed unexpectedly", e);
            metrics.recordLogin(AuthMetrics.OUTCOME_FAILURE);
            return fail(AuthError.TRANSPORT_ERROR, "Login failed: " + e.getMessage());
        }
    }

    private AuthResult doRefresh() {
        TokenSet current = tokens.get();
        if (!current.hasRefreshToken()) {
            log.warn("No refresh token available, logging in");
            return doLogin();
        }
        if (beyondMargin(current)) {
            return AuthResult.success("Token is valid");
        }

        TokenSet cached = cache.get(tokenCacheKey(), TokenSet.class);
        if (cached != null && beyondMargin(cached)) {
            tokens.set(cached.withDeviceId(current.getDeviceId()));
            metrics.recordRefresh(AuthMetrics.OUTCOME_CACHED);
            lastFailure = null;
            log.info("Token set adopted from cache during refresh");
            return AuthResult.success("Token loaded from cache");
        }

        MagioApiException refreshError;
        try {
            IssuedTokens issued = apiClient.refreshTokens(current.getRefreshToken());
            adopt(issued, current.getDeviceId());
            metrics.recordRefresh(AuthMetrics.OUTCOME_SUCCESS);
            lastFailure = null;
            log.info("Access token refreshed");
            return AuthResult.success("Token refreshed");
        } catch (MagioApiException e) {
            refreshError = e;
        } catch (RuntimeException e) {
            log.error("Token refresh failed unexpectedly", e);
            refreshError = new MagioApiException(MagioApiException.Kind.TRANSPORT, e.getMessage(), e);
        }

        log.warn("Token refresh failed ({}), falling back to login", refreshError.getMessage());
        metrics.recordRefresh(AuthMetrics.OUTCOME_FAILURE);
        recordFailure(refreshError.toAuthError(), "Token refresh failed: " + refreshError.getMessage());
        cache.clear(tokenCacheKey());

        AuthResult loginResult = doLogin();
        if (!loginResult.isSuccess()) {
            TokenSet latest = tokens.get();
            String keptRefreshToken = refreshError.getKind() == MagioApiException.Kind.PROTOCOL
                    ? null
                    : latest.getRefreshToken();
            tokens.set(new TokenSet(null, keptRefreshToken, 0D, latest.getDeviceId()));
        }
        return loginResult;
    }

    private TokenSet adopt(IssuedTokens issued, String deviceId) throws MagioApiException {
        long lifetimeSeconds = issued.getExpiresInMillis() / 1000L;
        if (issued.getExpiresInMillis() / 1000.0 <= properties.getRefreshMarginSeconds()) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL,
                    "token lifetime of " + issued.getExpiresInMillis() + " ms does not exceed the refresh margin");
        }
        double expiresAt = nowSeconds() + issued.getExpiresInMillis() / 1000.0;
        TokenSet updated = new TokenSet(issued.getAccessToken(), issued.getRefreshToken(), expiresAt, deviceId);
        tokens.set(updated);
        tokenPersistence.save(updated, language);
        cacheTokens(updated, lifetimeSeconds);
        cacheDeviceId(deviceId);
        return updated;
    }

    private TokenSet restoreTokens() {
        TokenSet restored = cache.get(tokenCacheKey(), TokenSet.class);
        boolean fromFile = false;
        if (restored != null) {
            log.info("Token set restored from cache");
        } else {
            restored = tokenPersistence.load(language);
            fromFile = restored != null;
        }

        String deviceId = resolveDeviceId(restored);
        if (restored == null) {
            return TokenSet.loggedOut(deviceId);
        }
        TokenSet result = restored.withDeviceId(deviceId);
        if (fromFile) {
            cacheTokens(result, result.secondsRemaining(nowSeconds()));
        }
        return result;
    }

    private String resolveDeviceId(TokenSet restored) {
        if (StringUtils.hasText(properties.getDeviceId())) {
            return properties.getDeviceId().trim();
        }
        if (restored != null && StringUtils.hasText(restored.getDeviceId())) {
            return restored.getDeviceId();
        }
        String cached = cache.get(DEVICE_CACHE_PREFIX + language, String.class);
        if (StringUtils.hasText(cached)) {
            return cached;
        }
        String generated = UUID.randomUUID().toString();
        log.info("Generated new device id {}", generated);
        return generated;
    }

    private void cacheTokens(TokenSet tokenSet, long remainingSeconds) {
        long ttl = Math.min(remainingSeconds, cacheProperties.getTokenTtlCeilingSeconds());
        if (ttl > 0 && tokenSet.hasAccessToken()) {
            cache.store(tokenCacheKey(), tokenSet, ttl);
        }
    }

    private void cacheDeviceId(String deviceId) {
        if (StringUtils.hasText(deviceId)) {
            cache.store(DEVICE_CACHE_PREFIX + language, deviceId, cacheProperties.getTokenTtlCeilingSeconds());
        }
    }

    private AuthState currentState(TokenSet current) {
        if (lastFailure != null) {
            return AuthState.FAILED;
        }
        if (!current.hasAccessToken() && !current.hasRefreshToken()) {
            return AuthState.LOGGED_OUT;
        }
        return beyondMargin(current) ? AuthState.VALID : AuthState.NEEDS_REFRESH;
    }

    private boolean beyondMargin(TokenSet tokenSet) {
        return tokenSet.validAt(nowSeconds() + properties.getRefreshMarginSeconds());
    }

    private AuthResult fail(AuthError error, String message) {
        recordFailure(error, message);
        return AuthResult.failure(error, message);
    }

    private void recordFailure(AuthError error, String message) {
        lastFailure = new FailureRecord(error, message, clock.instant());
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private String tokenCacheKey() {
        return TOKEN_CACHE_PREFIX + language;
    }

    private static final class FailureRecord {

        private final AuthError error;
        private final String message;
        private final Instant at;

        private FailureRecord(AuthError error, String message, Instant at) {
            this.error = error;
            this.message = message;
            this.at = at;
        }
    }
}
