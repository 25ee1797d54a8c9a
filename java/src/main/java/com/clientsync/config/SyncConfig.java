package com.clientsync.config;

import com.clientsync.source.SourceRateLimiter;
import com.clientsync.source.SpacingRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wiring for the sync engine's time sources.
 */
@Slf4j
@Configuration
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceRateLimiter sourceRateLimiter(ClientSyncProperties properties) {
        log.info("Spacing Notion API calls by at least {}", properties.getSource().getMinRequestInterval());
        return new SpacingRateLimiter(properties.getSource().getMinRequestInterval(), Schedulers.parallel());
    }
}
