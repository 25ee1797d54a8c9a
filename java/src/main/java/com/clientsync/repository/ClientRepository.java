package com.clientsync.repository;

import com.clientsync.model.entity.Client;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Client entities.
 */
@Repository
public interface ClientRepository extends ReactiveCrudRepository<Client, UUID> {

    /**
     * Find clients linked to a Notion page, oldest first.
     * More than one row means a historical duplicate.
     */
    Flux<Client> findBySourceRecordIdOrderByCreatedAtAsc(String sourceRecordId);

    /**
     * Find every client that carries a Notion page reference.
     */
    Flux<Client> findBySourceRecordIdIsNotNull();

    Flux<Client> findByNameOrderByCreatedAtAsc(String name);

    Flux<Client> findByContactEmailOrderByCreatedAtAsc(String contactEmail);

    /**
     * Case-insensitive substring search, used to pre-select fuzzy match candidates.
     */
    Flux<Client> findByNameContainingIgnoreCase(String fragment);

    Mono<Client> findBySlug(String slug);

    Flux<Client> findBySlugStartingWith(String prefix);
}
