package com.tradescheduler.backend.service.trading;

import com.tradescheduler.backend.config.TradingApiProperties;
import com.tradescheduler.backend.exception.TradingApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports missing broker credentials at startup and, when enabled, probes the
 * account endpoint once. Never blocks startup: scheduled fires record their
 * own failures.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TradingApiConfigGuard implements ApplicationRunner {

    private final TradingApiProperties tradingApiProperties;
    private final TradingApiClient tradingApiClient;

    @Override
    public void run(ApplicationArguments args) {
        List<String> missing = missingKeys();
        if (!missing.isEmpty()) {
            log.error("Trading API config missing: {}", String.join(", ", missing));
            return;
        }
        if (!tradingApiProperties.isProbeOnStartup()) {
            return;
        }
        try {
            TradingApiClient.AccountSummary account = tradingApiClient.getAccount();
            if (account == null) {
                log.warn("Trading API probe returned no account");
                return;
            }
            log.info("Trading API reachable mode={} account={} status={}",
                    tradingApiClient.mode(), account.accountId(), account.status());
        } catch (TradingApiException e) {
            log.warn("Trading API probe failed mode={}: {}", tradingApiClient.mode(), e.getMessage());
        }
    }

    List<String> missingKeys() {
        List<String> missing = new ArrayList<>();
        if (isBlank(tradingApiProperties.getKeyId())) {
            missing.add("TRADING_API_KEY_ID");
        }
        if (isBlank(tradingApiProperties.getSecretKey())) {
            missing.add("TRADING_API_SECRET_KEY");
        }
        return missing;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
