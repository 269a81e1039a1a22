package com.example.magiogateway.api.response;

import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Envelope for every gateway response. {@code code} is {@value #CODE_OK} on success, the
 * {@link BusinessException} code for gateway failures, or the HTTP status number otherwise.
 * {@code traceId} repeats the {@code X-Request-Id} of the request.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String CODE_OK = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    private ApiResponse(String code, String message, T data, String userAction) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.userAction = userAction;
        this.traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(CODE_OK, "OK", data, null);
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return new ApiResponse<>(e.getCode(), e.getMessage(), null, e.getUserAction());
    }

    public static <T> ApiResponse<T> fail(HttpStatus status, String message) {
        return new ApiResponse<>(String.valueOf(status.value()), message, null, null);
    }

    @JsonIgnore
    public boolean isOk() {
        return CODE_OK.equals(code);
    }
}
