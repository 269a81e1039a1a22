package com.example.magiogateway.infrastructure.magio;

import com.example.magiogateway.domain.model.DeviceRegistration;
import com.example.magiogateway.domain.model.IssuedTokens;
import com.example.magiogateway.domain.model.RedirectTarget;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Blocking client for the MagioTV REST API. Every call carries an explicit timeout.
 */
public interface MagioApiClient {

    String PATH_AUTH_INIT = "/v2/auth/init";
    String PATH_AUTH_LOGIN = "/v2/auth/login";
    String PATH_AUTH_TOKENS = "/v2/auth/tokens";
    String PATH_CATEGORIES = "/home/categories";
    String PATH_CHANNELS = "/v2/television/channels";
    String PATH_STREAM_URL = "/v2/television/stream-url";
    String PATH_EPG = "/v2/television/epg";
    String PATH_DEVICES = "/v2/home/my-devices";
    String PATH_DEVICE_DELETE = "/home/deleteDevice";

    /**
     * Registers the device and returns a short-lived token that only authorises {@link #login}.
     */
    String initSession(DeviceRegistration registration) throws MagioApiException;

    IssuedTokens login(String temporaryToken, String username, String password) throws MagioApiException;

    IssuedTokens refreshTokens(String refreshToken) throws MagioApiException;

    /**
     * GET {@code path} relative to the base URL. A body with {@code success: false} is reported
     * as a protocol failure.
     */
    JsonNode getJson(String path, Map<String, String> params, Map<String, String> headers, int timeoutMs)
            throws MagioApiException;

    /**
     * Issues one GET without following redirects and returns the {@code Location} target, or
     * {@code url} itself when the answer is not a redirect.
     */
    RedirectTarget resolveRedirect(String url, Map<String, String> headers) throws MagioApiException;
}
