package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.model.dto.SyncStatsResponse;
import com.clientsync.model.sync.SyncKind;
import com.clientsync.model.sync.SyncRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * In-memory history of bulk sync passes, used for the admin status and health checks.
 * Reset on restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncStatsService {

    private final Clock clock;
    private final ClientSyncProperties properties;

    private final Deque<String> recentErrors = new ArrayDeque<>();
    private Instant lastFullSync;
    private Instant lastIncrementalSync;
    private long totalSyncs;
    private long failedSyncs;
    private SyncRun lastRun;

    /**
     * Record a finished pass. Refused passes never reach here.
     */
    public synchronized void recordRun(SyncRun run) {
        totalSyncs++;
        lastRun = run;

        if (run.isSuccess()) {
            Instant finishedAt = run.getFinishedAt() != null ? run.getFinishedAt() : clock.instant();
            if (run.getKind() == SyncKind.FULL) {
                lastFullSync = finishedAt;
            } else {
                lastIncrementalSync = finishedAt;
            }
        } else {
            failedSyncs++;
        }

        int capacity = properties.getHealth().getRecentErrorCapacity();
        for (String error : run.getErrors()) {
            recentErrors.addLast(error);
            while (recentErrors.size() > capacity) {
                recentErrors.removeFirst();
            }
        }

        log.debug("Recorded {} sync: total={}, failed={}", run.getKind(), totalSyncs, failedSyncs);
    }

    public synchronized double getFailureRate() {
        return totalSyncs == 0 ? 0.0 : (double) failedSyncs / totalSyncs;
    }

    /**
     * Unhealthy when no pass has ever completed, when the last completed pass is older than
     * the allowed staleness during active hours, or when the failure rate exceeds its limit.
     */
    public synchronized boolean isHealthy() {
        Instant lastSync = latest(lastFullSync, lastIncrementalSync);
        if (lastSync == null) {
            return false;
        }

        ClientSyncProperties.Health health = properties.getHealth();
        Instant now = clock.instant();
        int hour = ZonedDateTime.ofInstant(now, properties.getScheduler().getZone()).getHour();
        boolean activeHours = hour >= health.getActiveHoursStart() && hour <= health.getActiveHoursEnd();
        if (activeHours && Duration.between(lastSync, now).compareTo(health.getMaxStaleness()) > 0) {
            return false;
        }

        return getFailureRate() <= health.getMaxFailureRate();
    }

    public synchronized SyncStatsResponse getStats() {
        return SyncStatsResponse.builder()
                .lastFullSync(lastFullSync)
                .lastIncrementalSync(lastIncrementalSync)
                .totalSyncs(totalSyncs)
                .failedSyncs(failedSyncs)
                .failureRate(getFailureRate())
                .recentErrors(new ArrayList<>(recentErrors))
                .lastRun(lastRun)
                .healthy(isHealthy())
                .build();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
