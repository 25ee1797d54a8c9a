package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.exception.SyncAlreadyInProgressException;
import com.clientsync.model.sync.SyncKind;
import com.clientsync.model.sync.SyncRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Timer-driven sync passes: incremental every half hour during business hours,
 * a full pass every night, and one incremental pass shortly after startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler {

    private final ClientSyncService clientSyncService;
    private final ClientSyncProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Scheduled client sync is disabled");
            return;
        }
        log.info("Initial incremental sync in {}", properties.getScheduler().getInitialDelay());
        Mono.delay(properties.getScheduler().getInitialDelay())
                .then(Mono.defer(() -> trigger(SyncKind.INCREMENTAL, null)))
                .subscribe(
                        run -> log.info("Initial sync done: {} created, {} updated", run.getCreated(), run.getUpdated()),
                        this::logFailure);
    }

    @Scheduled(cron = "${clientsync.scheduler.incremental-cron:0 */30 9-18 * * MON-FRI}",
            zone = "${clientsync.scheduler.zone:America/New_York}")
    public void runScheduledIncremental() {
        runScheduled(SyncKind.INCREMENTAL);
    }

    @Scheduled(cron = "${clientsync.scheduler.full-cron:0 0 2 * * *}",
            zone = "${clientsync.scheduler.zone:America/New_York}")
    public void runScheduledFull() {
        runScheduled(SyncKind.FULL);
    }

    /**
     * Start a pass now. An incremental pass without {@code since} looks back
     * {@code clientsync.scheduler.incremental-lookback}.
     */
    public Mono<SyncRun> trigger(SyncKind kind, Instant since) {
        if (kind == SyncKind.FULL) {
            return clientSyncService.runFull();
        }
        Instant from = since != null
                ? since
                : clock.instant().minus(properties.getScheduler().getIncrementalLookback());
        return clientSyncService.runIncremental(from);
    }

    private void runScheduled(SyncKind kind) {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Skipping scheduled {} sync, scheduler disabled", kind);
            return;
        }
        log.info("Scheduled {} sync started", kind);
        try {
            SyncRun run = trigger(kind, null).block();
            if (run != null) {
                log.info("Scheduled {} sync completed: total={}, created={}, updated={}, skipped={}, deleted={}",
                        kind, run.getTotal(), run.getCreated(), run.getUpdated(), run.getSkipped(), run.getDeleted());
            }
        } catch (RuntimeException e) {
            logFailure(e);
        }
    }

    private void logFailure(Throwable error) {
        if (error instanceof SyncAlreadyInProgressException) {
            log.info("Skipping sync, another sync is still running");
        } else {
            log.error("Scheduled sync failed", error);
        }
    }
}
