package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.exception.SyncAlreadyInProgressException;
import com.clientsync.model.sync.SyncKind;
import com.clientsync.model.sync.SyncRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SyncScheduler.
 */
@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-04T15:00:00Z");

    @Mock
    private ClientSyncService clientSyncService;

    private ClientSyncProperties properties;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new ClientSyncProperties();
        scheduler = new SyncScheduler(clientSyncService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void trigger_IncrementalLooksBackTwoHoursByDefault() {
        SyncRun run = SyncRun.start(SyncKind.INCREMENTAL, null, NOW);
        when(clientSyncService.runIncremental(Instant.parse("2024-03-04T13:00:00Z"))).thenReturn(Mono.just(run));

        scheduler.trigger(SyncKind.INCREMENTAL, null).block();

        verify(clientSyncService).runIncremental(Instant.parse("2024-03-04T13:00:00Z"));
    }

    @Test
    void trigger_ExplicitSinceWins() {
        Instant since = Instant.parse("2024-01-01T00:00:00Z");
        when(clientSyncService.runIncremental(since)).thenReturn(Mono.just(SyncRun.start(SyncKind.INCREMENTAL, since, NOW)));

        scheduler.trigger(SyncKind.INCREMENTAL, since).block();

        verify(clientSyncService).runIncremental(since);
    }

    @Test
    void trigger_FullIgnoresSince() {
        when(clientSyncService.runFull()).thenReturn(Mono.just(SyncRun.start(SyncKind.FULL, null, NOW)));

        scheduler.trigger(SyncKind.FULL, NOW).block();

        verify(clientSyncService, never()).runIncremental(any());
    }

    @Test
    void scheduledRunSwallowsRefusal() {
        when(clientSyncService.runFull()).thenReturn(Mono.error(
                new SyncAlreadyInProgressException(SyncRun.refused(SyncKind.FULL, null, NOW))));

        scheduler.runScheduledFull();

        verify(clientSyncService).runFull();
    }

    @Test
    void disabledSchedulerDoesNothing() {
        properties.getScheduler().setEnabled(false);

        scheduler.runScheduledIncremental();
        scheduler.onApplicationReady();

        verify(clientSyncService, never()).runIncremental(any());
        verify(clientSyncService, never()).runFull();
    }
}
