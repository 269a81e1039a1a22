package com.example.magiogateway.common.config;

import com.example.magiogateway.infrastructure.metrics.AuthMetrics;
import com.example.magiogateway.infrastructure.metrics.MicrometerAuthMetrics;
import com.example.magiogateway.infrastructure.metrics.NoopAuthMetrics;
import com.example.magiogateway.infrastructure.persistence.FileTokenPersistence;
import com.example.magiogateway.infrastructure.persistence.NoopTokenPersistence;
import com.example.magiogateway.infrastructure.persistence.TokenPersistence;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AuthSupportConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthSupportConfig.class);

    @Bean
    public TokenPersistence tokenPersistence(AppMagioProperties properties, ObjectMapper objectMapper) {
        if (!properties.isPersistTokens()) {
            log.info("Token persistence disabled");
            return new NoopTokenPersistence();
        }
        return new FileTokenPersistence(properties.getDataDir(), objectMapper);
    }

    @Bean
    public AuthMetrics authMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
        if (meterRegistry == null) {
            return new NoopAuthMetrics();
        }
        return new MicrometerAuthMetrics(meterRegistry);
    }
}
