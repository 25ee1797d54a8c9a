package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.exception.InvalidSourceRecordException;
import com.clientsync.exception.SourceRecordNotFoundException;
import com.clientsync.exception.SyncAlreadyInProgressException;
import com.clientsync.exception.SyncErrorKind;
import com.clientsync.model.entity.Client;
import com.clientsync.model.source.SourceRecord;
import com.clientsync.model.sync.ClientMatch;
import com.clientsync.model.sync.DeleteResult;
import com.clientsync.model.sync.MatchCandidate;
import com.clientsync.model.sync.SyncKind;
import com.clientsync.model.sync.SyncRun;
import com.clientsync.model.sync.UpsertAction;
import com.clientsync.model.sync.UpsertResult;
import com.clientsync.repository.ClientRepository;
import com.clientsync.source.SourceClient;
import com.clientsync.util.KeyedSequencer;
import com.clientsync.util.SlugUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Keeps the client registry in line with the Notion client database.
 *
 * Bulk passes (full and incremental) are single-flight: a pass requested while another
 * one runs fails at once with {@link SyncAlreadyInProgressException}. Single-record
 * upserts and deletes are not gated by that flag, but every write for a given Notion
 * page goes through one {@link KeyedSequencer} lane so concurrent deliveries converge
 * on the same row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientSyncService {

    private final SourceClient sourceClient;
    private final ClientRepository clientRepository;
    private final ClientMatcher clientMatcher;
    private final ClientFieldExtractor fieldExtractor;
    private final SyncStatsService syncStatsService;
    private final ClientSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private static final String DELETION_CHECK = "deletion check";

    private final KeyedSequencer sequencer = new KeyedSequencer();
    private final AtomicBoolean syncInProgress = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    /**
     * Upsert every page of the collection.
     */
    public Mono<SyncRun> runFull() {
        return runPass(SyncKind.FULL, null);
    }

    /**
     * Upsert pages edited after {@code since}, then delete clients whose page no longer exists.
     */
    public Mono<SyncRun> runIncremental(Instant since) {
        return runPass(SyncKind.INCREMENTAL, since);
    }

    /**
     * Fetch one page and upsert it.
     */
    public Mono<UpsertResult> upsertOne(String recordId) {
        return sourceClient.getRecord(recordId)
                .flatMap(this::upsertRecord);
    }

    /**
     * Upsert a page that has already been fetched. Archived pages are skipped on every path.
     */
    public Mono<UpsertResult> upsertRecord(SourceRecord record) {
        return Mono.defer(() -> {
            if (record.isArchived()) {
                log.info("Skipping archived Notion page {}", record.getId());
                return Mono.just(UpsertResult.skipped(record.getId()));
            }
            String name = fieldExtractor.extractName(record);
            if (name == null || name.isBlank()) {
                return Mono.error(new InvalidSourceRecordException(record.getId(), "no usable client name"));
            }
            String contactEmail = fieldExtractor.extractContactEmail(record);
            String productsServices = fieldExtractor.extractProductsServices(record);

            return fetchPageInfo(record.getId())
                    .flatMap(pageInfo -> sequencer.run(record.getId(), Mono.defer(() -> {
                        MatchCandidate candidate = MatchCandidate.builder()
                                .sourceRecordId(record.getId())
                                .name(name)
                                .contactEmail(contactEmail)
                                .build();
                        ClientFields fields = new ClientFields(name, contactEmail, productsServices, pageInfo);

                        return clientMatcher.findMatch(candidate)
                                .flatMap(match -> update(match, record, fields))
                                .switchIfEmpty(Mono.defer(() -> create(record, fields)));
                    })));
        });
    }

    /**
     * Delete the clients linked to a page. When no client carries the page id, the page
     * is fetched once and the client is looked up by name, then by slug.
     */
    public Mono<DeleteResult> deleteBySourceRecord(String recordId) {
        return sequencer.run(recordId, Mono.defer(() ->
                store(clientRepository.findBySourceRecordIdOrderByCreatedAtAsc(recordId)
                        .collectSortedList(ClientMatcher.OLDEST_FIRST))
                        .flatMap(rows -> rows.isEmpty() ? findUnlinked(recordId) : Mono.just(rows))
                        .flatMap(rows -> Flux.fromIterable(rows)
                                .concatMap(client -> {
                                    log.info("Deleting client {} ('{}') for removed Notion page {}",
                                            client.getId(), client.getName(), recordId);
                                    return store(clientRepository.delete(client));
                                })
                                .then(Mono.fromCallable(() -> DeleteResult.builder()
                                        .sourceRecordId(recordId)
                                        .deleted(rows.size())
                                        .clientName(rows.isEmpty() ? null : rows.get(0).getName())
                                        .build())))));
    }

    /**
     * Ask the running pass to stop after the record it is working on.
     *
     * @return true if a pass was running
     */
    public boolean cancelCurrentRun() {
        if (!syncInProgress.get()) {
            return false;
        }
        log.info("Cancellation requested for the running sync");
        cancelRequested.set(true);
        return true;
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    @PreDestroy
    public void shutdown() {
        if (cancelCurrentRun()) {
            log.info("Shutting down; the running sync stops after its current record");
        }
    }

    private Mono<SyncRun> runPass(SyncKind kind, Instant since) {
        return Mono.defer(() -> {
            if (!syncInProgress.compareAndSet(false, true)) {
                log.warn("{} sync requested while another sync is running", kind);
                return Mono.error(new SyncAlreadyInProgressException(SyncRun.refused(kind, since, clock.instant())));
            }
            cancelRequested.set(false);

            SyncRun run = SyncRun.start(kind, since, clock.instant());
            String collectionId = properties.getSource().getCollectionId();
            log.info("Starting {} sync of collection {}{}", kind, collectionId,
                    since != null ? " (modified after " + since + ")" : "");

            Mono<Void> pass;
            if (collectionId == null || collectionId.isBlank()) {
                pass = Mono.error(new IllegalStateException("clientsync.source.collection-id is not configured"));
            } else {
                pass = processCollection(run, collectionId)
                        .then(Mono.defer(() -> kind == SyncKind.INCREMENTAL && !run.isCancelled()
                                ? reconcileDeletions(run)
                                : Mono.<Void>empty()));
            }

            return pass
                    .onErrorResume(error -> {
                        log.error("{} sync aborted", kind, error);
                        run.abort(SyncErrorKind.describe(collectionId, error));
                        return Mono.empty();
                    })
                    .then(Mono.fromCallable(() -> finish(run)))
                    .doFinally(signal -> {
                        cancelRequested.set(false);
                        syncInProgress.set(false);
                    });
        });
    }

    private Mono<Void> processCollection(SyncRun run, String collectionId) {
        return sourceClient.queryCollection(collectionId, run.getSince())
                .concatMap(record -> Mono.defer(() -> {
                    if (stopRequested(run)) {
                        return Mono.just(false);
                    }
                    return processRecord(run, record).thenReturn(true);
                }))
                .takeWhile(Boolean::booleanValue)
                .then();
    }

    private Mono<Void> processRecord(SyncRun run, SourceRecord record) {
        run.incrementTotal();
        return upsertRecord(record)
                .doOnNext(result -> run.recordOutcome(result.getAction()))
                .then()
                .onErrorResume(error -> {
                    log.warn("Skipping Notion page {}: {}", record.getId(), error.getMessage());
                    run.recordSkipped(SyncErrorKind.describe(record.getId(), error));
                    return Mono.empty();
                });
    }

    /**
     * Look up every linked client's page. Only a not-found answer deletes the client.
     */
    private Mono<Void> reconcileDeletions(SyncRun run) {
        return store(clientRepository.findBySourceRecordIdIsNotNull().collectList())
                .onErrorResume(error -> {
                    log.error("Deletion check skipped, linked clients could not be listed", error);
                    run.addError(SyncErrorKind.describe(DELETION_CHECK, error));
                    return Mono.empty();
                })
                .flatMapMany(Flux::fromIterable)
                .concatMap(client -> Mono.defer(() -> {
                    if (stopRequested(run)) {
                        return Mono.just(false);
                    }
                    return checkPageExists(run, client).thenReturn(true);
                }))
                .takeWhile(Boolean::booleanValue)
                .then();
    }

    private Mono<Void> checkPageExists(SyncRun run, Client client) {
        String recordId = client.getSourceRecordId();
        return sourceClient.getRecord(recordId)
                .then()
                .onErrorResume(SourceRecordNotFoundException.class, notFound -> sequencer.run(recordId,
                        Mono.defer(() -> {
                            log.info("Notion page {} no longer exists; deleting client {} ('{}')",
                                    recordId, client.getId(), client.getName());
                            return store(clientRepository.delete(client))
                                    .doOnSuccess(done -> run.incrementDeleted())
                                    .onErrorResume(error -> {
                                        log.error("Failed to delete client {}", client.getId(), error);
                                        run.addError(SyncErrorKind.describe(recordId, error));
                                        return Mono.empty();
                                    });
                        })))
                .onErrorResume(error -> {
                    log.warn("Could not verify Notion page {} for client {}; keeping it: {}",
                            recordId, client.getId(), error.getMessage());
                    return Mono.empty();
                });
    }

    private boolean stopRequested(SyncRun run) {
        if (cancelRequested.get()) {
            run.setCancelled(true);
            return true;
        }
        return false;
    }

    private SyncRun finish(SyncRun run) {
        run.setFinishedAt(clock.instant());
        syncStatsService.recordRun(run);
        log.info("{} sync finished{}: total={}, created={}, updated={}, skipped={}, deleted={}, errors={}",
                run.getKind(), run.isCancelled() ? " (cancelled)" : "", run.getTotal(), run.getCreated(),
                run.getUpdated(), run.getSkipped(), run.getDeleted(), run.getErrors().size());
        return run;
    }

    private Mono<UpsertResult> update(ClientMatch match, SourceRecord record, ClientFields fields) {
        Client existing = match.getClient();

        String wouldBeSlug = SlugUtil.slugify(fields.name);
        if (!wouldBeSlug.equals(existing.getSlug())) {
            log.info("Keeping slug '{}' for client {} (new name '{}' would give '{}')",
                    existing.getSlug(), existing.getId(), fields.name, wouldBeSlug);
        }

        String sourceRecordId = existing.getSourceRecordId();
        if (sourceRecordId == null || sourceRecordId.isBlank()) {
            sourceRecordId = record.getId();
        } else if (!sourceRecordId.equals(record.getId())) {
            log.warn("Client {} is linked to Notion page {} but matched page {} by {}; keeping the existing link",
                    existing.getId(), sourceRecordId, record.getId(), match.getStrategy());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Client updated = existing.toBuilder()
                .name(fields.name)
                .contactEmail(fields.contactEmail)
                .productsServices(fields.productsServices)
                .pageInfo(fields.pageInfo.orElse(existing.getPageInfo()))
                .sourceRecordId(sourceRecordId)
                .metadata(mergeMetadata(existing.getMetadata(), sourceRecordId, record.getLastModifiedAt()))
                .updatedAt(now)
                .build();

        return store(clientRepository.save(updated))
                .doOnNext(saved -> log.info("Updated client {} ('{}') from Notion page {}",
                        saved.getId(), saved.getName(), record.getId()))
                .map(saved -> UpsertResult.builder()
                        .sourceRecordId(record.getId())
                        .client(saved)
                        .action(UpsertAction.UPDATED)
                        .matchedBy(match.getStrategy())
                        .build());
    }

    private Mono<UpsertResult> create(SourceRecord record, ClientFields fields) {
        String slug = SlugUtil.slugify(fields.name);
        if (slug.isEmpty()) {
            return Mono.error(new InvalidSourceRecordException(record.getId(),
                    "name '" + fields.name + "' does not produce a slug"));
        }

        return store(clientRepository.findBySlugStartingWith(slug)
                .map(Client::getSlug)
                .collect(Collectors.toSet()))
                .flatMap(taken -> {
                    String allocated = SlugUtil.firstAvailable(slug, taken);
                    if (!allocated.equals(slug)) {
                        log.warn("Slug '{}' belongs to another client; creating '{}' as '{}', review for duplicates",
                                slug, fields.name, allocated);
                    }

                    LocalDateTime now = LocalDateTime.now(clock);
                    Client client = Client.builder()
                            .name(fields.name)
                            .slug(allocated)
                            .contactEmail(fields.contactEmail)
                            .productsServices(fields.productsServices)
                            .pageInfo(fields.pageInfo.orElse(null))
                            .sourceRecordId(record.getId())
                            .metadata(mergeMetadata(null, record.getId(), record.getLastModifiedAt()))
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return store(clientRepository.save(client));
                })
                .doOnNext(saved -> log.info("Created client {} ('{}', slug '{}') from Notion page {}",
                        saved.getId(), saved.getName(), saved.getSlug(), record.getId()))
                .map(saved -> UpsertResult.builder()
                        .sourceRecordId(record.getId())
                        .client(saved)
                        .action(UpsertAction.CREATED)
                        .build());
    }

    /**
     * Page body text; empty when it could not be read, so an update keeps the stored text.
     */
    private Mono<Optional<String>> fetchPageInfo(String recordId) {
        return sourceClient.getChildContent(recordId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(error -> {
                    log.warn("Could not read content of Notion page {}: {}", recordId, error.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private Mono<List<Client>> findUnlinked(String recordId) {
        return sourceClient.getRecord(recordId)
                .flatMap(record -> {
                    String name = fieldExtractor.extractName(record);
                    if (name == null || name.isBlank()) {
                        return Mono.<Client>empty();
                    }
                    return store(clientRepository.findByNameOrderByCreatedAtAsc(name)
                            .filter(client -> isUnlinkedOrLinkedTo(client, recordId))
                            .next())
                            .switchIfEmpty(Mono.defer(() -> store(clientRepository.findBySlug(SlugUtil.slugify(name)))
                                    .filter(client -> isUnlinkedOrLinkedTo(client, recordId))));
                })
                .map(List::of)
                .defaultIfEmpty(List.of())
                .onErrorResume(error -> {
                    log.warn("No client linked to Notion page {} and the page could not be read: {}",
                            recordId, error.getMessage());
                    return Mono.just(List.of());
                });
    }

    private static boolean isUnlinkedOrLinkedTo(Client client, String recordId) {
        return client.getSourceRecordId() == null || client.getSourceRecordId().equals(recordId);
    }

    /**
     * Bound a single registry call, read or write, by {@code clientsync.sync.store-timeout}.
     */
    private <T> Mono<T> store(Mono<T> operation) {
        return operation.timeout(properties.getSync().getStoreTimeout());
    }

    /**
     * Write the sync keys into the metadata JSON, keeping every other key.
     */
    String mergeMetadata(String existing, String sourceRecordId, Instant sourceLastModifiedAt) {
        ObjectNode metadata = objectMapper.createObjectNode();
        if (existing != null && !existing.isBlank()) {
            try {
                JsonNode parsed = objectMapper.readTree(existing);
                if (parsed.isObject()) {
                    metadata = (ObjectNode) parsed;
                }
            } catch (JsonProcessingException e) {
                log.warn("Replacing unparseable client metadata: {}", e.getOriginalMessage());
            }
        }

        metadata.put("sourceRecordId", sourceRecordId);
        if (sourceLastModifiedAt != null) {
            metadata.put("sourceLastModifiedAt", sourceLastModifiedAt.toString());
        }
        metadata.put("lastSyncedAt", clock.instant().toString());

        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize client metadata", e);
        }
    }

    private static final class ClientFields {
        private final String name;
        private final String contactEmail;
        private final String productsServices;
        private final Optional<String> pageInfo;

        private ClientFields(String name, String contactEmail, String productsServices, Optional<String> pageInfo) {
            this.name = name;
            this.contactEmail = contactEmail;
            this.productsServices = productsServices;
            this.pageInfo = pageInfo;
        }
    }
}
