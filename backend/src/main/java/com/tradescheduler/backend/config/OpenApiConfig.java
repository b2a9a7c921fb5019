package com.tradescheduler.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tradeSchedulerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trade Scheduler API")
                        .description("Manage recurring trade jobs and inspect their executions")
                        .version("1.0"));
    }
}
