package com.example.magiogateway.api.response;

import com.example.magiogateway.domain.model.AuthError;
import com.example.magiogateway.domain.model.AuthState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthStatusResponse {

    private boolean authenticated;

    private String username;

    private String language;

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("token_valid")
    private boolean tokenValid;

    @JsonProperty("refresh_valid")
    private boolean refreshValid;

    @JsonProperty("token_expires_in")
    private long tokenExpiresIn;

    @JsonProperty("token_expires_formatted")
    private String tokenExpiresFormatted;

    private AuthState state;

    @JsonProperty("last_error")
    private AuthError lastError;

    @JsonProperty("last_error_message")
    private String lastErrorMessage;

    @JsonProperty("last_error_at")
    private String lastErrorAt;
}
