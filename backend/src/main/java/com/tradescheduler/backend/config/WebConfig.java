package com.tradescheduler.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CorsRegistration cors = registry.addMapping("/api/**")
                .allowedMethods(corsProperties.getAllowedMethods().toArray(new String[0]))
                .allowedHeaders("*")
                .maxAge(3600);

        if (corsProperties.getAllowedOrigins().isEmpty()) {
            cors.allowedOriginPatterns("*");
        } else {
            cors.allowedOrigins(corsProperties.getAllowedOrigins().toArray(new String[0]));
        }
    }
}
