package com.clientsync.model.sync;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters and errors of one bulk sync pass. Not persisted; handed to the caller
 * and to {@link com.clientsync.service.SyncStatsService} when the pass ends.
 *
 * A run is mutated only by the pass that owns it, one record at a time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRun {

    private SyncKind kind;
    private Instant since;
    private Instant startedAt;
    private Instant finishedAt;

    private int total;
    private int created;
    private int updated;
    private int skipped;
    private int deleted;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private boolean success = true;

    private boolean cancelled;

    public static SyncRun start(SyncKind kind, Instant since, Instant startedAt) {
        return SyncRun.builder()
                .kind(kind)
                .since(since)
                .startedAt(startedAt)
                .build();
    }

    /**
     * The empty run handed back when another pass already holds the guard.
     */
    public static SyncRun refused(SyncKind kind, Instant since, Instant now) {
        SyncRun run = start(kind, since, now);
        run.setFinishedAt(now);
        run.setSuccess(false);
        run.addError("Sync already in progress");
        return run;
    }

    public void recordOutcome(UpsertAction action) {
        switch (action) {
            case CREATED:
                created++;
                break;
            case UPDATED:
                updated++;
                break;
            default:
                skipped++;
        }
    }

    public void recordSkipped(String error) {
        skipped++;
        if (error != null) {
            errors.add(error);
        }
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void incrementTotal() {
        total++;
    }

    public void incrementDeleted() {
        deleted++;
    }

    public void abort(String error) {
        success = false;
        errors.add(error);
    }
}
