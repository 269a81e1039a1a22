package com.example.magiogateway.infrastructure.metrics;

public interface AuthMetrics {

    String OUTCOME_SUCCESS = "success";
    String OUTCOME_FAILURE = "failure";
    String OUTCOME_CACHED = "cached";

    void recordLogin(String outcome);

    void recordRefresh(String outcome);
}
