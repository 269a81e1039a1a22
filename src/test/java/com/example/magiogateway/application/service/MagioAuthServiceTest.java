package com.example.magiogateway.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.example.magiogateway.infrastructure.metrics.MicrometerAuthMetrics;
import com.example.magiogateway.infrastructure.persistence.FileTokenPersistence;
import com.example.magiogateway.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class MagioAuthServiceTest {

    private static final long ONE_HOUR_MS = 3_600_000L;

    @TempDir
    Path dataDir;

    private MutableClock clock;
    private AppMagioProperties properties;
    private AppCacheProperties cacheProperties;
    private MagioApiClient apiClient;
    private FileTokenPersistence persistence;
    private TtlCache cache;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

        properties = new AppMagioProperties();
        properties.setUsername("viewer@example.com");
        properties.setPassword("secret");
        properties.setLanguage("cz");
        properties.setDeviceId("device-1");
        properties.setRefreshMarginSeconds(60);

        cacheProperties = new AppCacheProperties();
        apiClient = mock(MagioApiClient.class);
        persistence = new FileTokenPersistence(dataDir, new ObjectMapper());
        cache = new TtlCache(cacheProperties, clock);
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void shouldLoginAndStoreTokensEverywhere() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();

        AuthResult result = service.login();

        Assertions.assertTrue(result.isSuccess());
        TokenSet tokens = service.currentTokens();
        Assertions.assertEquals("access-1", tokens.getAccessToken());
        Assertions.assertEquals("refresh-1", tokens.getRefreshToken());
        Assertions.assertEquals(clock.epochSeconds() + 3600, tokens.getExpiresAt(), 0.001);
        Assertions.assertEquals("access-1", persistence.load("cz").getAccessToken());
        Assertions.assertEquals("access-1", cache.get("auth_tokens_cz", TokenSet.class).getAccessToken());
        Assertions.assertEquals("device-1", cache.get("device_id_cz", String.class));
        Assertions.assertEquals(AuthState.VALID, service.currentState());
        Assertions.assertEquals(1.0D,
                meterRegistry.find("magio.auth.login").tag("outcome", "success").counter().count());
    }

    @Test
    void shouldRegisterDeviceBeforeLogin() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();

        service.login();

        ArgumentCaptor<DeviceRegistration> captor = ArgumentCaptor.forClass(DeviceRegistration.class);
        verify(apiClient).initSession(captor.capture());
        DeviceRegistration registration = captor.getValue();
        Assertions.assertEquals("device-1", registration.getDeviceId());
        Assertions.assertEquals("CZ", registration.getLanguage());
        Assertions.assertEquals("0.0.0", registration.getOsVersion());
        Assertions.assertEquals("GO", registration.getDevicePlatform());
        verify(apiClient).login("temp-token", "viewer@example.com", "secret");
    }

    @Test
    void shouldFailWithConfigErrorWhenCredentialsMissing() {
        properties.setPassword("  ");
        MagioAuthService service = newService();

        AuthResult result = service.login();

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(AuthError.CONFIG_ERROR, result.getError());
        Assertions.assertEquals(AuthState.FAILED, service.currentState());
        verifyNoInteractions(apiClient);
    }

    @Test
    void shouldKeepPriorTokensWhenLoginFails() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();
        service.login();

        when(apiClient.initSession(any(DeviceRegistration.class)))
                .thenThrow(new MagioApiException(MagioApiException.Kind.TRANSPORT, "connect timed out"));
        AuthResult result = service.login();

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(AuthError.TRANSPORT_ERROR, result.getError());
        Assertions.assertEquals("access-1", service.currentTokens().getAccessToken());
        Assertions.assertEquals("refresh-1", service.currentTokens().getRefreshToken());
    }

    @Test
    void shouldRejectTokenLifetimeWithinRefreshMargin() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", 60_000L));
        MagioAuthService service = newService();

        AuthResult result = service.login();

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(AuthError.PROTOCOL_ERROR, result.getError());
        Assertions.assertFalse(service.currentTokens().hasAccessToken());
        Assertions.assertNull(persistence.load("cz"));
    }

    @Test
    void shouldCacheTokensForRemainingLifetime() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();

        service.login();

        Assertions.assertEquals(Long.valueOf(3600L), cache.info().getExpiresIn().get("auth_tokens_cz"));
    }

    @Test
    void shouldCapTokenCacheTtlAtSevenDays() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", 30L * 24 * ONE_HOUR_MS));
        MagioAuthService service = newService();

        service.login();

        Assertions.assertEquals(Long.valueOf(604800L), cache.info().getExpiresIn().get("auth_tokens_cz"));
    }

    @Test
    void shouldReturnHeadersWithoutNetworkWhileTokenIsFresh() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();
        service.login();
        clearInvocations(apiClient);

        AuthHeaders headers = service.getAuthHeaders();

        Assertions.assertNotNull(headers);
        Assertions.assertEquals("Bearer access-1", headers.authorizationValue());
        Assertions.assertEquals("czgo.magio.tv", headers.getHost());
        Assertions.assertEquals(AppMagioProperties.DEFAULT_USER_AGENT, headers.getUserAgent());
        verifyNoInteractions(apiClient);
    }

    @Test
    void shouldRefreshOnceWhenTokenIsWithinMargin() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();
        service.login();
        clock.plusSeconds(3570);
        double previousExpiry = service.currentTokens().getExpiresAt();
        when(apiClient.refreshTokens("refresh-1")).thenReturn(new IssuedTokens("access-2", "refresh-2", ONE_HOUR_MS));

        AuthResult result = service.refreshAccessToken();

        Assertions.assertTrue(result.isSuccess());
        verify(apiClient, times(1)).refreshTokens("refresh-1");
        verify(apiClient, times(1)).initSession(any(DeviceRegistration.class));
        Assertions.assertEquals("access-2", service.currentTokens().getAccessToken());
        Assertions.assertTrue(service.currentTokens().getExpiresAt() > previousExpiry);
        Assertions.assertEquals("refresh-2", persistence.load("cz").getRefreshToken());
    }

    @Test
    void shouldFallBackToLoginOnceWhenRefreshIsRejected() throws Exception {
        persistence.save(new TokenSet("old-access", "old-refresh", clock.epochSeconds() + 30, "device-1"), "cz");
        when(apiClient.refreshTokens("old-refresh"))
                .thenThrow(new MagioApiException(MagioApiException.Kind.PROTOCOL, "refresh token revoked"));
        stubLogin(new IssuedTokens("access-new", "refresh-new", ONE_HOUR_MS));
        MagioAuthService service = newService();

        AuthResult result = service.refreshAccessToken();

        Assertions.assertTrue(result.isSuccess());
        verify(apiClient, times(1)).refreshTokens("old-refresh");
        verify(apiClient, times(1)).login(anyString(), anyString(), anyString());
        Assertions.assertEquals("access-new", service.currentTokens().getAccessToken());
        Assertions.assertEquals(AuthState.VALID, service.currentState());
    }

    @Test
    void shouldDropRejectedRefreshTokenWhenFallbackLoginFails() throws Exception {
        persistence.save(new TokenSet("old-access", "old-refresh", clock.epochSeconds() + 30, "device-1"), "cz");
        when(apiClient.refreshTokens("old-refresh"))
                .thenThrow(new MagioApiException(MagioApiException.Kind.PROTOCOL, "refresh token revoked"));
        when(apiClient.initSession(any(DeviceRegistration.class)))
                .thenThrow(new MagioApiException(MagioApiException.Kind.TRANSPORT, "HTTP 503", 503, null));
        MagioAuthService service = newService();

        AuthResult result = service.refreshAccessToken();

        Assertions.assertFalse(result.isSuccess());
        verify(apiClient, times(1)).initSession(any(DeviceRegistration.class));
        Assertions.assertNull(service.currentTokens().getAccessToken());
        Assertions.assertNull(service.currentTokens().getRefreshToken());
        Assertions.assertEquals("device-1", service.currentTokens().getDeviceId());
        Assertions.assertNull(cache.get("auth_tokens_cz", TokenSet.class));
        Assertions.assertNull(service.getAuthHeaders());
        Assertions.assertEquals(AuthState.FAILED, service.currentState());
    }

    @Test
    void shouldKeepRefreshTokenWhenRefreshFailedOnTransport() throws Exception {
        persistence.save(new TokenSet("old-access", "old-refresh", clock.epochSeconds() + 30, "device-1"), "cz");
        when(apiClient.refreshTokens("old-refresh"))
                .thenThrow(new MagioApiException(MagioApiException.Kind.TRANSPORT, "read timed out"));
        when(apiClient.initSession(any(DeviceRegistration.class)))
                .thenThrow(new MagioApiException(MagioApiException.Kind.TRANSPORT, "read timed out"));
        MagioAuthService service = newService();

        AuthResult result = service.refreshAccessToken();

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(AuthError.TRANSPORT_ERROR, result.getError());
        Assertions.assertNull(service.currentTokens().getAccessToken());
        Assertions.assertEquals("old-refresh", service.currentTokens().getRefreshToken());
        Assertions.assertEquals(1.0D,
                meterRegistry.find("magio.auth.refresh").tag("outcome", "failure").counter().count());
    }

    @Test
    void shouldLoginWhenNoRefreshTokenIsKnown() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();

        AuthHeaders headers = service.getAuthHeaders();

        Assertions.assertNotNull(headers);
        Assertions.assertEquals("access-1", headers.getAccessToken());
        verify(apiClient, never()).refreshTokens(anyString());
    }

    @Test
    void shouldAdoptFresherTokenSetFromCacheDuringRefresh() throws Exception {
        persistence.save(new TokenSet("old-access", "old-refresh", clock.epochSeconds() + 30, "device-1"), "cz");
        MagioAuthService service = newService();
        cache.store("auth_tokens_cz",
                new TokenSet("cached-access", "cached-refresh", clock.epochSeconds() + 3600, "other-device"), 3600);

        AuthResult result = service.refreshAccessToken();

        Assertions.assertTrue(result.isSuccess());
        Assertions.assertEquals("cached-access", service.currentTokens().getAccessToken());
        Assertions.assertEquals("device-1", service.currentTokens().getDeviceId());
        verifyNoInteractions(apiClient);
    }

    @Test
    void shouldRestoreTokensFromFileAndMirrorThemIntoCache() {
        persistence.save(new TokenSet("stored-access", "stored-refresh", clock.epochSeconds() + 1800, "stored-device"),
                "cz");
        properties.setDeviceId(null);

        MagioAuthService service = newService();

        Assertions.assertEquals("stored-access", service.currentTokens().getAccessToken());
        Assertions.assertEquals("stored-device", service.getDeviceId());
        Assertions.assertEquals("stored-access", cache.get("auth_tokens_cz", TokenSet.class).getAccessToken());
        Assertions.assertEquals(Long.valueOf(1800L), cache.info().getExpiresIn().get("auth_tokens_cz"));
        Assertions.assertEquals(AuthState.VALID, service.currentState());
    }

    @Test
    void shouldPreferCachedTokensOverFile() {
        persistence.save(new TokenSet("file-access", "file-refresh", clock.epochSeconds() + 1800, "device-1"), "cz");
        cache.store("auth_tokens_cz",
                new TokenSet("cached-access", "cached-refresh", clock.epochSeconds() + 1800, "device-1"), 1800);

        MagioAuthService service = newService();

        Assertions.assertEquals("cached-access", service.currentTokens().getAccessToken());
    }

    @Test
    void shouldKeepGeneratedDeviceIdAcrossRestarts() throws Exception {
        properties.setDeviceId(null);
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService first = newService();
        first.login();
        String deviceId = first.getDeviceId();

        cache = new TtlCache(cacheProperties, clock);
        MagioAuthService second = newService();

        Assertions.assertNotNull(deviceId);
        Assertions.assertEquals(deviceId, second.getDeviceId());
    }

    @Test
    void shouldLogoutIdempotently() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();
        service.login();

        Assertions.assertTrue(service.logout());
        TokenSet afterFirst = service.currentTokens();
        Assertions.assertTrue(service.logout());

        Assertions.assertEquals(afterFirst, service.currentTokens());
        Assertions.assertEquals("device-1", service.getDeviceId());
        Assertions.assertEquals(AuthState.LOGGED_OUT, service.currentState());
        Assertions.assertNull(cache.get("auth_tokens_cz", TokenSet.class));
        Assertions.assertFalse(Files.exists(dataDir.resolve("token_cz.json")));
    }

    @Test
    void shouldReportStatus() throws Exception {
        stubLogin(new IssuedTokens("access-1", "refresh-1", ONE_HOUR_MS));
        MagioAuthService service = newService();
        service.login();
        clock.plusSeconds(1200);

        AuthStatusResponse status = service.getAuthStatus();

        Assertions.assertTrue(status.isAuthenticated());
        Assertions.assertEquals("viewer@example.com", status.getUsername());
        Assertions.assertEquals("cz", status.getLanguage());
        Assertions.assertEquals("device-1", status.getDeviceId());
        Assertions.assertTrue(status.isTokenValid());
        Assertions.assertTrue(status.isRefreshValid());
        Assertions.assertEquals(2400L, status.getTokenExpiresIn());
        Assertions.assertEquals("40m 0s", status.getTokenExpiresFormatted());
        Assertions.assertEquals(AuthState.VALID, status.getState());
        Assertions.assertNull(status.getLastError());
    }

    @Test
    void shouldReportExpiredStatusWhenLoggedOut() {
        MagioAuthService service = newService();

        AuthStatusResponse status = service.getAuthStatus();

        Assertions.assertFalse(status.isAuthenticated());
        Assertions.assertNull(status.getUsername());
        Assertions.assertEquals(0L, status.getTokenExpiresIn());
        Assertions.assertEquals("expired", status.getTokenExpiresFormatted());
        Assertions.assertEquals(AuthState.LOGGED_OUT, status.getState());
    }

    @Test
    void shouldFormatRemainingTime() {
        Assertions.assertEquals("2h 1m", MagioAuthService.formatRemaining(7260));
        Assertions.assertEquals("2m 5s", MagioAuthService.formatRemaining(125));
        Assertions.assertEquals("42s", MagioAuthService.formatRemaining(42));
    }

    @Test
    void shouldRefreshOnlyOnceForConcurrentCallers() throws Exception {
        persistence.save(new TokenSet("old-access", "old-refresh", clock.epochSeconds() + 30, "device-1"), "cz");
        when(apiClient.refreshTokens("old-refresh")).thenAnswer(invocation -> {
            Thread.sleep(100);
            return new IssuedTokens("access-2", "refresh-2", ONE_HOUR_MS);
        });
        MagioAuthService service = newService();
        cache.clear();

        int threads = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<AuthResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return service.refreshAccessToken();
                }));
            }
            start.countDown();
            for (Future<AuthResult> future : futures) {
                Assertions.assertTrue(future.get(5, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            executor.shutdownNow();
        }

        verify(apiClient, times(1)).refreshTokens("old-refresh");
        Assertions.assertEquals("access-2", service.currentTokens().getAccessToken());
    }

    private MagioAuthService newService() {
        return new MagioAuthService(properties, cacheProperties, apiClient, persistence, cache,
                new MicrometerAuthMetrics(meterRegistry), clock);
    }

    private void stubLogin(IssuedTokens issued) throws MagioApiException {
        when(apiClient.initSession(any(DeviceRegistration.class))).thenReturn("temp-token");
        when(apiClient.login(eq("temp-token"), anyString(), anyString())).thenReturn(issued);
    }
}
