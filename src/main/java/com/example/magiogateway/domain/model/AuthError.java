package com.example.magiogateway.domain.model;

public enum AuthError {

    /** Username or password missing. Never retried. */
    CONFIG_ERROR,

    /** Network failure, timeout or non-2xx response. */
    TRANSPORT_ERROR,

    /** Well-formed response reporting failure or missing expected fields. */
    PROTOCOL_ERROR
}
