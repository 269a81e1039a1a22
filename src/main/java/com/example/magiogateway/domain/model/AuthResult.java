package com.example.magiogateway.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class AuthResult {

    private boolean success;

    private AuthError error;

    private String message;

    public AuthResult(boolean success, AuthError error, String message) {
        this.success = success;
        this.error = error;
        this.message = message;
    }

    public static AuthResult success(String message) {
        return new AuthResult(true, null, message);
    }

    public static AuthResult failure(AuthError error, String message) {
        return new AuthResult(false, error, message);
    }
}
