package com.example.magiogateway.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upstream session credentials of the configured account.
 * <p>
 * Instances published by the auth service are never modified afterwards; a login or refresh
 * always produces a new instance. Field names follow the on-disk token record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenSet {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    /**
     * Epoch seconds; only meaningful while {@link #accessToken} is present.
     */
    @JsonProperty("expires")
    private double expiresAt;

    @JsonProperty("device_id")
    private String deviceId;

    public static TokenSet loggedOut(String deviceId) {
        return new TokenSet(null, null, 0D, deviceId);
    }

    @JsonIgnore
    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isEmpty();
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * True when the access token is present and still valid at {@code epochSeconds}.
     */
    public boolean validAt(double epochSeconds) {
        return hasAccessToken() && expiresAt > epochSeconds;
    }

    public long secondsRemaining(double nowEpochSeconds) {
        if (!hasAccessToken()) {
            return 0L;
        }
        return Math.max(0L, (long) (expiresAt - nowEpochSeconds));
    }

    public TokenSet withDeviceId(String newDeviceId) {
        return new TokenSet(accessToken, refreshToken, expiresAt, newDeviceId);
    }
}
