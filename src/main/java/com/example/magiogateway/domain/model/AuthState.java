package com.example.magiogateway.domain.model;

public enum AuthState {
    LOGGED_OUT,
    VALID,
    NEEDS_REFRESH,
    FAILED
}
