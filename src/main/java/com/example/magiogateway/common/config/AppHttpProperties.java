package com.example.magiogateway.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.http")
public class AppHttpProperties {

    private int connectTimeoutMs = 5000;

    private int apiTimeoutMs = 30000;

    private int streamTimeoutMs = 10000;

    private int maxConnections = 20;
}
