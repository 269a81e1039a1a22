package com.example.magiogateway.infrastructure.magio;

import com.example.magiogateway.domain.model.AuthError;

public class MagioApiException extends Exception {

    public enum Kind {
        TRANSPORT,
        PROTOCOL
    }

    private final Kind kind;
    private final int httpStatus;

    public MagioApiException(Kind kind, String message) {
        this(kind, message, 0, null);
    }

    public MagioApiException(Kind kind, String message, Throwable cause) {
        this(kind, message, 0, cause);
    }

    public MagioApiException(Kind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public Kind getKind() {
        return kind;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public AuthError toAuthError() {
        return kind == Kind.PROTOCOL ? AuthError.PROTOCOL_ERROR : AuthError.TRANSPORT_ERROR;
    }
}
