package com.example.magiogateway.api.controller;

import com.example.magiogateway.api.response.ApiResponse;
import com.example.magiogateway.api.response.AuthStatusResponse;
import com.example.magiogateway.application.service.MagioAuthService;
import com.example.magiogateway.common.exception.BusinessException;
import com.example.magiogateway.domain.model.AuthResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final MagioAuthService authService;

    public AuthController(MagioAuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/status")
    public ApiResponse<AuthStatusResponse> status() {
        return ApiResponse.success(authService.getAuthStatus());
    }

    @PostMapping("/login")
    public ApiResponse<AuthStatusResponse> login() {
        requireSuccess(authService.login());
        return ApiResponse.success(authService.getAuthStatus());
    }

    @PostMapping("/refresh")
    public ApiResponse<AuthStatusResponse> refresh() {
        requireSuccess(authService.refreshAccessToken());
        return ApiResponse.success(authService.getAuthStatus());
    }

    @PostMapping("/logout")
    public ApiResponse<String> logout() {
        if (!authService.logout()) {
            throw new BusinessException("TOKEN_DELETE_FAILED", "Logged out, but the stored token could not be removed",
                    "Check permissions of the data directory", HttpStatus.INTERNAL_SERVER_ERROR);
        }
        return ApiResponse.success("OK");
    }

    private void requireSuccess(AuthResult result) {
        if (!result.isSuccess()) {
            throw new BusinessException("MAGIO_" + result.getError().name(), result.getMessage(),
                    HttpStatus.UNAUTHORIZED);
        }
    }
}
