package com.example.magiogateway.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI magioGatewayOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Magio Gateway API")
                        .description("MagentaTV/MagioTV account session, channels, programme guide, streams and devices")
                        .version("v1")
                        .contact(new Contact().name("magio-gateway")));
    }
}
