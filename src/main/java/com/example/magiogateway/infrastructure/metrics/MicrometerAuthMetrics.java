package com.example.magiogateway.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MicrometerAuthMetrics implements AuthMetrics {

    private static final Logger log = LoggerFactory.getLogger(MicrometerAuthMetrics.class);

    static final String LOGIN_COUNTER = "magio.auth.login";
    static final String REFRESH_COUNTER = "magio.auth.refresh";

    private final MeterRegistry meterRegistry;

    public MicrometerAuthMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordLogin(String outcome) {
        increment(LOGIN_COUNTER, outcome);
    }

    @Override
    public void recordRefresh(String outcome) {
        increment(REFRESH_COUNTER, outcome);
    }

    private void increment(String name, String outcome) {
        try {
            meterRegistry.counter(name, "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("Failed to record metric {}", name, e);
        }
    }
}
