package com.rebalance.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rebalanceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rebalance Execution API")
                        .description("Trade runs, orders and reconciliation")
                        .version("1.0"));
    }
}
