package com.example.magiogateway.infrastructure.metrics;

public class NoopAuthMetrics implements AuthMetrics {

    @Override
    public void recordLogin(String outcome) {
    }

    @Override
    public void recordRefresh(String outcome) {
    }
}
