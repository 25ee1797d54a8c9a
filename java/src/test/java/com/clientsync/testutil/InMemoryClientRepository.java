package com.clientsync.testutil;

import com.clientsync.model.entity.Client;
import com.clientsync.repository.ClientRepository;
import org.reactivestreams.Publisher;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Map-backed {@link ClientRepository} with the unique slug constraint of the real table.
 */
public class InMemoryClientRepository implements ClientRepository {

    private static final Comparator<Client> BY_CREATED_AT = Comparator
            .comparing(Client::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Client::getId);

    private final Map<UUID, Client> rows = new ConcurrentHashMap<>();
    private volatile Predicate<Client> saveFailure = client -> false;
    private volatile Flux<Client> linkedListing;

    /**
     * Insert a row as-is, skipping the slug constraint. For legacy data.
     */
    public Client seed(Client client) {
        Client copy = client.toBuilder()
                .id(client.getId() != null ? client.getId() : UUID.randomUUID())
                .build();
        rows.put(copy.getId(), copy);
        return copy.toBuilder().build();
    }

    public List<Client> all() {
        return rows.values().stream()
                .sorted(BY_CREATED_AT)
                .map(client -> client.toBuilder().build())
                .collect(Collectors.toList());
    }

    public void failSavesWhen(Predicate<Client> failure) {
        this.saveFailure = failure;
    }

    /**
     * Answer {@link #findBySourceRecordIdIsNotNull()} with {@code listing} instead of the rows.
     */
    public void overrideLinkedListing(Flux<Client> listing) {
        this.linkedListing = listing;
    }

    @Override
    public <S extends Client> Mono<S> save(S entity) {
        return Mono.defer(() -> {
            if (saveFailure.test(entity)) {
                return Mono.error(new IllegalStateException("write failed for " + entity.getName()));
            }
            synchronized (rows) {
                if (entity.getId() == null) {
                    entity.setId(UUID.randomUUID());
                }
                boolean slugTaken = rows.values().stream()
                        .anyMatch(row -> !row.getId().equals(entity.getId()) && row.getSlug().equals(entity.getSlug()));
                if (slugTaken) {
                    return Mono.error(new DuplicateKeyException("duplicate slug " + entity.getSlug()));
                }
                rows.put(entity.getId(), entity.toBuilder().build());
            }
            return Mono.just(entity);
        });
    }

    @Override
    public <S extends Client> Flux<S> saveAll(Iterable<S> entities) {
        return Flux.fromIterable(entities).concatMap(this::save);
    }

    @Override
    public <S extends Client> Flux<S> saveAll(Publisher<S> entityStream) {
        return Flux.from(entityStream).concatMap(this::save);
    }

    @Override
    public Mono<Client> findById(UUID id) {
        return Mono.fromCallable(() -> rows.get(id)).map(client -> client.toBuilder().build());
    }

    @Override
    public Mono<Client> findById(Publisher<UUID> id) {
        return Mono.from(id).flatMap(this::findById);
    }

    @Override
    public Mono<Boolean> existsById(UUID id) {
        return Mono.fromCallable(() -> rows.containsKey(id));
    }

    @Override
    public Mono<Boolean> existsById(Publisher<UUID> id) {
        return Mono.from(id).flatMap(this::existsById);
    }

    @Override
    public Flux<Client> findAll() {
        return Flux.defer(() -> Flux.fromIterable(all()));
    }

    @Override
    public Flux<Client> findAllById(Iterable<UUID> ids) {
        return Flux.fromIterable(ids).concatMap(this::findById);
    }

    @Override
    public Flux<Client> findAllById(Publisher<UUID> idStream) {
        return Flux.from(idStream).concatMap(this::findById);
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> (long) rows.size());
    }

    @Override
    public Mono<Void> deleteById(UUID id) {
        return Mono.fromRunnable(() -> rows.remove(id));
    }

    @Override
    public Mono<Void> deleteById(Publisher<UUID> id) {
        return Mono.from(id).flatMap(this::deleteById);
    }

    @Override
    public Mono<Void> delete(Client entity) {
        return deleteById(entity.getId());
    }

    @Override
    public Mono<Void> deleteAllById(Iterable<? extends UUID> ids) {
        return Mono.fromRunnable(() -> ids.forEach(rows::remove));
    }

    @Override
    public Mono<Void> deleteAll(Iterable<? extends Client> entities) {
        return Mono.fromRunnable(() -> entities.forEach(client -> rows.remove(client.getId())));
    }

    @Override
    public Mono<Void> deleteAll(Publisher<? extends Client> entityStream) {
        return Flux.from(entityStream).concatMap(this::delete).then();
    }

    @Override
    public Mono<Void> deleteAll() {
        return Mono.fromRunnable(rows::clear);
    }

    @Override
    public Flux<Client> findBySourceRecordIdOrderByCreatedAtAsc(String sourceRecordId) {
        return query(client -> sourceRecordId.equals(client.getSourceRecordId()));
    }

    @Override
    public Flux<Client> findBySourceRecordIdIsNotNull() {
        if (linkedListing != null) {
            return linkedListing;
        }
        return query(client -> client.getSourceRecordId() != null);
    }

    @Override
    public Flux<Client> findByNameOrderByCreatedAtAsc(String name) {
        return query(client -> name.equals(client.getName()));
    }

    @Override
    public Flux<Client> findByContactEmailOrderByCreatedAtAsc(String contactEmail) {
        return query(client -> contactEmail.equals(client.getContactEmail()));
    }

    @Override
    public Flux<Client> findByNameContainingIgnoreCase(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return query(client -> client.getName() != null
                && client.getName().toLowerCase(Locale.ROOT).contains(needle));
    }

    @Override
    public Mono<Client> findBySlug(String slug) {
        return query(client -> slug.equals(client.getSlug())).next();
    }

    @Override
    public Flux<Client> findBySlugStartingWith(String prefix) {
        return query(client -> client.getSlug() != null && client.getSlug().startsWith(prefix));
    }

    private Flux<Client> query(Predicate<Client> filter) {
        return Flux.defer(() -> {
            List<Client> matches = new ArrayList<>();
            for (Client client : all()) {
                if (filter.test(client)) {
                    matches.add(client);
                }
            }
            return Flux.fromIterable(matches);
        });
    }
}
