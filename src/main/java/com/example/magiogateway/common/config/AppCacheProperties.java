package com.example.magiogateway.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.cache")
public class AppCacheProperties {

    private long defaultTtlSeconds = 3600;

    private long channelTtlSeconds = 3600;

    private long streamTtlSeconds = 600;

    private long epgTtlSeconds = 3600;

    private long deviceTtlSeconds = 300;

    private long tokenTtlCeilingSeconds = 7 * 24 * 3600L;

    private boolean sweepEnabled = true;

    private long sweepIntervalMs = 300000;
}
