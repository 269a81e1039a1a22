package com.example.magiogateway.application.service;

import com.example.magiogateway.application.cache.TtlCache;
import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.config.AppMagioProperties;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.AuthHeaders;
import com.example.magiogateway.domain.model.RedirectTarget;
import com.example.magiogateway.domain.model.StreamInfo;
import com.example.magiogateway.infrastructure.magio.MagioApiClient;
import com.example.magiogateway.infrastructure.magio.MagioApiException;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves playable URLs for live channels and archived programmes. The upstream answer points
 * to a redirector; one extra hop yields the CDN URL handed to players.
 */
@Service
public class StreamService {

    private static final Logger log = LoggerFactory.getLogger(StreamService.class);

    private static final String SERVICE_LIVE = "LIVE";
    private static final String SERVICE_ARCHIVE = "ARCHIVE";
    private static final String LIVE_DEVICE_PROFILE = "OTT_PC_HD_1080p_v2";

    private final MagioAuthService authService;
    private final MagioApiClient apiClient;
    private final TtlCache cache;
    private final AppMagioProperties magioProperties;
    private final AppCacheProperties cacheProperties;
    private final AppHttpProperties httpProperties;

    public StreamService(MagioAuthService authService,
                         MagioApiClient apiClient,
                         TtlCache cache,
                         AppMagioProperties magioProperties,
                         AppCacheProperties cacheProperties,
                         AppHttpProperties httpProperties) {
        this.authService = authService;
        this.apiClient = apiClient;
        this.cache = cache;
        this.magioProperties = magioProperties;
        this.cacheProperties = cacheProperties;
        this.httpProperties = httpProperties;
    }

    public StreamInfo getLiveStream(long channelId) {
        String key = "stream_" + authService.getLanguage() + "_" + channelId + "_" + magioProperties.getQuality();
        return cache.getOrFetch(key, StreamInfo.class, () -> fetchStream(SERVICE_LIVE, channelId),
                cacheProperties.getStreamTtlSeconds());
    }

    public StreamInfo getCatchupStream(long scheduleId) {
        String key = "catchup_stream_" + authService.getLanguage() + "_" + scheduleId + "_"
                + magioProperties.getQuality();
        return cache.getOrFetch(key, StreamInfo.class, () -> fetchStream(SERVICE_ARCHIVE, scheduleId),
                cacheProperties.getStreamTtlSeconds());
    }

    // --- Private methods ---

    private StreamInfo fetchStream(String service, long id) {
        boolean live = SERVICE_LIVE.equals(service);
        AuthHeaders authHeaders = authService.getAuthHeaders();
        if (authHeaders == null) {
            throw BusinessException.unauthorized("Cannot resolve stream: not authenticated with Magio");
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("service", service);
        params.put("name", magioProperties.getDeviceName());
        params.put("devtype", magioProperties.getDeviceType());
        params.put("id", String.valueOf(id));
        params.put("prof", magioProperties.getQuality());
        params.put("ecid", "");
        params.put("drm", "widevine");
        if (live) {
            params.put("start", "LIVE");
            params.put("end", "END");
            params.put("device", LIVE_DEVICE_PROFILE);
        }

        Map<String, String> requestHeaders = authHeaders.toMap();
        requestHeaders.put("Accept", "*/*");
        requestHeaders.put("Referer", magioProperties.resolveReferer());

        try {
            JsonNode body = apiClient.getJson(MagioApiClient.PATH_STREAM_URL, params, requestHeaders,
                    httpProperties.getStreamTimeoutMs());
            if (!body.path("success").asBoolean(false)) {
                throw new MagioApiException(MagioApiException.Kind.PROTOCOL,
                        "stream-url rejected: " + body.path("errorMessage").asText("Unknown error"));
            }
            String url = body.path("url").asText("");
            if (url.isEmpty()) {
                throw new MagioApiException(MagioApiException.Kind.PROTOCOL, "stream-url response lacks url");
            }

            Map<String, String> playerHeaders = new LinkedHashMap<>();
            playerHeaders.put(AuthHeaders.HOST, hostOf(url));
            playerHeaders.put(AuthHeaders.USER_AGENT, authHeaders.getUserAgent());
            playerHeaders.put(AuthHeaders.AUTHORIZATION, authHeaders.authorizationValue());
            playerHeaders.put("Accept", "*/*");
            playerHeaders.put("Referer", magioProperties.resolveReferer());

            RedirectTarget target = apiClient.resolveRedirect(url, playerHeaders);
            log.debug("Resolved {} stream {} -> {}", service, id, target.getLocation());
            return new StreamInfo(target.getLocation(), playerHeaders, target.getContentType(), live);
        } catch (MagioApiException e) {
            log.error("Failed to resolve {} stream {}: {}", service, id, e.getMessage());
            throw BusinessException.upstream("Failed to resolve stream: " + e.getMessage());
        }
    }

    private String hostOf(String url) throws MagioApiException {
        try {
            String authority = URI.create(url).getRawAuthority();
            if (authority == null) {
                throw new MagioApiException(MagioApiException.Kind.PROTOCOL, "stream url has no host: " + url);
            }
            return authority;
        } catch (IllegalArgumentException e) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, "invalid stream url: " + url, e);
        }
    }
}
