package com.adsgateway.config;

import com.adsgateway.auth.CredentialRefresher;
import com.adsgateway.core.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Runs the token refresh in the background, hourly by default.
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "gateway.auth.refresh-enabled", havingValue = "true", matchIfMissing = true)
public class CredentialRefreshSchedule {

    private final CredentialRefresher refresher;

    public CredentialRefreshSchedule(CredentialRefresher refresher) {
        this.refresher = refresher;
    }

    @Scheduled(fixedDelayString = "${gateway.auth.refresh-interval:PT1H}",
            initialDelayString = "${gateway.auth.refresh-initial-delay:PT1M}")
    public void refreshExpiringCredentials() {
        try {
            refresher.refreshDue();
        } catch (StorageUnavailableException e) {
            log.error("Token refresh skipped, credential store unavailable: {}", e.getMessage());
        }
    }
}
