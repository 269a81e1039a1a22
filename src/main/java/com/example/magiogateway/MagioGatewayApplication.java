package com.example.magiogateway;

import com.example.magiogateway.common.config.AppCacheProperties;
import com.example.magiogateway.common.config.AppHttpProperties;
import com.example.magiogateway.common.config.AppMagioProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        AppMagioProperties.class,
        AppCacheProperties.class,
        AppHttpProperties.class
})
public class MagioGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MagioGatewayApplication.class, args);
    }
}
