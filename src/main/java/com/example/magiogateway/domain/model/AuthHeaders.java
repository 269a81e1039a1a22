package com.example.magiogateway.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthHeaders {

    public static final String AUTHORIZATION = "Authorization";
    public static final String HOST = "Host";
    public static final String USER_AGENT = "User-Agent";

    private String accessToken;
    private String host;
    private String userAgent;

    public String authorizationValue() {
        return "Bearer " + accessToken;
    }

    public Map<String, String> toMap() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUTHORIZATION, authorizationValue());
        headers.put(HOST, host);
        headers.put(USER_AGENT, userAgent);
        return headers;
    }
}
