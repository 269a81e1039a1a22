package com.example.magiogateway.infrastructure.magio;

import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.config.AppMagioProperties;
import com.example.magiogateway.domain.model.DeviceRegistration;
import com.example.magiogateway.domain.model.IssuedTokens;
import com.example.magiogateway.domain.model.RedirectTarget;
import com.example.magiogateway.domain.model.StreamInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HttpMagioApiClient implements MagioApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpMagioApiClient.class);

    private static final String UNKNOWN_ERROR = "Unknown error";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppMagioProperties magioProperties;
    private final AppHttpProperties httpProperties;

    public HttpMagioApiClient(CloseableHttpClient httpClient,
                              ObjectMapper objectMapper,
                              AppMagioProperties magioProperties,
                              AppHttpProperties httpProperties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.magioProperties = magioProperties;
        this.httpProperties = httpProperties;
    }

    @Override
    public String initSession(DeviceRegistration registration) throws MagioApiException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("dsid", registration.getDeviceId());
        params.put("deviceName", registration.getDeviceName());
        params.put("deviceType", registration.getDeviceType());
        params.put("osVersion", registration.getOsVersion());
        params.put("appVersion", registration.getAppVersion());
        params.put("language", registration.getLanguage());
        params.put("devicePlatform", registration.getDevicePlatform());

        HttpPost request = new HttpPost(buildUri(PATH_AUTH_INIT, params));
        applyHeaders(request, baseHeaders());
        JsonNode body = execute(request, httpProperties.getApiTimeoutMs(), "auth init");
        requireSuccess(body, "auth init");
        return requireText(body.path("token"), "accessToken", "auth init");
    }

    @Override
    public IssuedTokens login(String temporaryToken, String username, String password) throws MagioApiException {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("loginOrNickname", username);
        payload.put("password", password);

        HttpPost request = new HttpPost(buildUri(PATH_AUTH_LOGIN, null));
        Map<String, String> headers = baseHeaders();
        headers.put("Authorization", "Bearer " + temporaryToken);
        applyHeaders(request, headers);
        request.setEntity(jsonEntity(payload));
        JsonNode body = execute(request, httpProperties.getApiTimeoutMs(), "auth login");
        requireSuccess(body, "auth login");
        return parseTokens(body, "auth login");
    }

    @Override
    public IssuedTokens refreshTokens(String refreshToken) throws MagioApiException {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("refreshToken", refreshToken);

        HttpPost request = new HttpPost(buildUri(PATH_AUTH_TOKENS, null));
        applyHeaders(request, baseHeaders());
        request.setEntity(jsonEntity(payload));
        JsonNode body = execute(request, httpProperties.getApiTimeoutMs(), "token refresh");
        requireSuccess(body, "token refresh");
        return parseTokens(body, "token refresh");
    }

    @Override
    public JsonNode getJson(String path, Map<String, String> params, Map<String, String> headers, int timeoutMs)
            throws MagioApiException {
        HttpGet request = new HttpGet(buildUri(path, params));
        Map<String, String> merged = baseHeaders();
        if (headers != null) {
            merged.putAll(headers);
        }
        applyHeaders(request, merged);
        JsonNode body = execute(request, timeoutMs, "GET " + path);
        if (body.has("success") && !body.get("success").asBoolean()) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL,
                    "GET " + path + " failed: " + errorMessage(body));
        }
        return body;
    }

    @Override
    public RedirectTarget resolveRedirect(String url, Map<String, String> headers) throws MagioApiException {
        HttpGet request;
        try {
            request = new HttpGet(new URI(url));
        } catch (URISyntaxException e) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, "Invalid stream url: " + url, e);
        }
        if (headers != null) {
            applyHeaders(request, headers);
        }
        request.setConfig(requestConfig(httpProperties.getStreamTimeoutMs(), false));
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            String location = url;
            if (isRedirect(status)) {
                Header locationHeader = response.getFirstHeader("Location");
                if (locationHeader != null && locationHeader.getValue() != null) {
                    location = locationHeader.getValue();
                }
            } else if (status >= 400) {
                throw new MagioApiException(MagioApiException.Kind.TRANSPORT,
                        "Stream redirect failed with HTTP " + status, status, null);
            }
            Header contentTypeHeader = response.getFirstHeader("Content-Type");
            String contentType = contentTypeHeader == null ? StreamInfo.DEFAULT_CONTENT_TYPE : contentTypeHeader.getValue();
            return new RedirectTarget(location, contentType);
        } catch (IOException e) {
            log.debug("Stream redirect hop failed, url={}", url, e);
            throw new MagioApiException(MagioApiException.Kind.TRANSPORT,
                    "Stream redirect failed: " + e.getMessage(), e);
        }
    }

    // --- Private methods ---

    private JsonNode execute(HttpRequestBase request, int timeoutMs, String operation) throws MagioApiException {
        request.setConfig(requestConfig(timeoutMs, true));
        String body;
        int status;
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("{} transport failure, uri={}", operation, request.getURI(), e);
            throw new MagioApiException(MagioApiException.Kind.TRANSPORT,
                    operation + " request failed: " + e.getMessage(), e);
        }

        if (status < 200 || status >= 300) {
            throw new MagioApiException(MagioApiException.Kind.TRANSPORT,
                    operation + " failed with HTTP " + status, status, null);
        }
        if (body.trim().isEmpty()) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, operation + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL,
                    operation + " returned malformed JSON", e);
        }
    }

    private IssuedTokens parseTokens(JsonNode body, String operation) throws MagioApiException {
        JsonNode token = body.path("token");
        String accessToken = requireText(token, "accessToken", operation);
        String refreshToken = requireText(token, "refreshToken", operation);
        JsonNode expiresIn = token.get("expiresIn");
        if (expiresIn == null || !expiresIn.isNumber()) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, operation + " response lacks token.expiresIn");
        }
        return new IssuedTokens(accessToken, refreshToken, expiresIn.asLong());
    }

    private void requireSuccess(JsonNode body, String operation) throws MagioApiException {
        if (!body.path("success").asBoolean(false)) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, operation + " rejected: " + errorMessage(body));
        }
    }

    private String requireText(JsonNode node, String field, String operation) throws MagioApiException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, operation + " response lacks token." + field);
        }
        return value.asText();
    }

    private String errorMessage(JsonNode body) {
        JsonNode message = body.get("errorMessage");
        return message == null || message.isNull() ? UNKNOWN_ERROR : message.asText();
    }

    private URI buildUri(String path, Map<String, String> params) throws MagioApiException {
        try {
            URIBuilder builder = new URIBuilder(magioProperties.resolveBaseUrl() + path);
            if (params != null) {
                for (Map.Entry<String, String> param : params.entrySet()) {
                    builder.addParameter(param.getKey(), param.getValue() == null ? "" : param.getValue());
                }
            }
            return builder.build();
        } catch (URISyntaxException e) {
            throw new MagioApiException(MagioApiException.Kind.TRANSPORT, "Invalid upstream url for " + path, e);
        }
    }

    private Map<String, String> baseHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Host", magioProperties.resolveHost());
        headers.put("User-Agent", magioProperties.getUserAgent());
        return headers;
    }

    private void applyHeaders(HttpRequestBase request, Map<String, String> headers) {
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getValue() != null) {
                request.setHeader(header.getKey(), header.getValue());
            }
        }
    }

    private StringEntity jsonEntity(Object payload) throws MagioApiException {
        try {
            return new StringEntity(objectMapper.writeValueAsString(payload), ContentType.APPLICATION_JSON);
        } catch (JsonProcessingException e) {
            throw new MagioApiException(MagioApiException.Kind.PROTOCOL, "Failed to encode request body", e);
        }
    }

    private RequestConfig requestConfig(int socketTimeoutMs, boolean followRedirects) {
        return RequestConfig.custom()
                .setConnectTimeout(httpProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(httpProperties.getConnectTimeoutMs())
                .setSocketTimeout(socketTimeoutMs)
                .setRedirectsEnabled(followRedirects)
                .build();
    }

    private boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }
}
