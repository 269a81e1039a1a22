package com.example.magiogateway.common.exception;

import org.springframework.http.HttpStatus;

public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;
    private final HttpStatus httpStatus;

    public BusinessException(String code, String message, HttpStatus httpStatus) {
        this(code, message, null, httpStatus);
    }

    public BusinessException(String code, String message, String userAction, HttpStatus httpStatus) {
        super(message);
        this.code = code;
        this.userAction = userAction;
        this.httpStatus = httpStatus == null ? HttpStatus.BAD_REQUEST : httpStatus;
    }

    public static BusinessException unauthorized(String message) {
        return new BusinessException("MAGIO_AUTH_UNAVAILABLE", message,
                "Check the configured account or retry later", HttpStatus.UNAUTHORIZED);
    }

    public static BusinessException upstream(String message) {
        return new BusinessException("MAGIO_UPSTREAM_ERROR", message, "Retry later", HttpStatus.BAD_GATEWAY);
    }

    public static BusinessException notFound(String message) {
        return new BusinessException("NOT_FOUND", message, HttpStatus.NOT_FOUND);
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
