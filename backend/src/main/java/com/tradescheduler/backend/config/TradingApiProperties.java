package com.tradescheduler.backend.config;

import com.tradescheduler.backend.model.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "trading.api")
@Data
@Validated
public class TradingApiProperties {

    @NotNull
    private TradingMode mode = TradingMode.PAPER;

    @NotBlank
    private String paperUrl = "https://paper-api.alpaca.markets";

    @NotBlank
    private String liveUrl = "https://api.alpaca.markets";

    private String keyId;

    private String secretKey;

    @NotBlank
    private String timeInForce = "day";

    private boolean probeOnStartup = true;

    @Valid
    private Http http = new Http();

    public String baseUrl() {
        String url = mode == TradingMode.LIVE ? liveUrl : paperUrl;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public boolean hasCredentials() {
        return keyId != null && !keyId.isBlank() && secretKey != null && !secretKey.isBlank();
    }

    @Data
    public static class Http {

        @Positive
        private int connectTimeoutMs = 5000;

        // Orders that outlive this are recorded as timeouts and never resent.
        @Positive
        private int readTimeoutMs = 10000;
    }
}
