package com.clientsync.model.dto;

import com.clientsync.model.sync.SyncRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of sync history for the admin status endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatsResponse {
    private Instant lastFullSync;
    private Instant lastIncrementalSync;
    private long totalSyncs;
    private long failedSyncs;
    private double failureRate;
    private List<String> recentErrors;
    private SyncRun lastRun;
    private boolean syncInProgress;
    private boolean healthy;
}
