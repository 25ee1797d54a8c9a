package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.model.entity.Client;
import com.clientsync.model.sync.ClientMatch;
import com.clientsync.model.sync.MatchCandidate;
import com.clientsync.model.sync.MatchStrategy;
import com.clientsync.repository.ClientRepository;
import com.clientsync.util.NameSimilarity;
import com.clientsync.util.SlugUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Record linkage: finds the registry row an incoming source record belongs to.
 *
 * Strategies run in {@link MatchStrategy} order and the first one that yields a row wins.
 * Later strategies are not consulted even if they would score higher.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientMatcher {

    /** Oldest row first; rows without a creation time sort last, ties broken by id. */
    static final Comparator<Client> OLDEST_FIRST = Comparator
            .comparing(Client::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Client::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final int MIN_FUZZY_NAME_LENGTH = 3;

    private final ClientRepository clientRepository;
    private final ClientSyncProperties properties;

    /**
     * Run the cascade for one candidate.
     *
     * @param candidate identifying fields of the incoming record
     * @return the selected row and the strategy that found it, or empty when the record is new
     */
    public Mono<ClientMatch> findMatch(MatchCandidate candidate) {
        return bySourceRecordId(candidate)
                .switchIfEmpty(Mono.defer(() -> byExactName(candidate)))
                .switchIfEmpty(Mono.defer(() -> byContactEmail(candidate)))
                .switchIfEmpty(Mono.defer(() -> byFuzzyName(candidate)))
                .switchIfEmpty(Mono.defer(() -> bySlug(candidate)))
                .switchIfEmpty(Mono.defer(() -> byBaseName(candidate)))
                .doOnNext(match -> log.info("Matched '{}' to client {} ('{}') by {} (score {})",
                        candidate.getName(), match.getClient().getId(), match.getClient().getName(),
                        match.getStrategy(), String.format("%.2f", match.getScore())))
                .doOnSuccess(match -> {
                    if (match == null) {
                        log.info("No existing client matches '{}'", candidate.getName());
                    }
                });
    }

    private Mono<ClientMatch> bySourceRecordId(MatchCandidate candidate) {
        if (isBlank(candidate.getSourceRecordId())) {
            return Mono.empty();
        }
        return read(clientRepository.findBySourceRecordIdOrderByCreatedAtAsc(candidate.getSourceRecordId())
                .collectSortedList(OLDEST_FIRST))
                .flatMap(rows -> {
                    if (rows.isEmpty()) {
                        return Mono.empty();
                    }
                    if (rows.size() > 1) {
                        log.warn("{} clients share Notion page {}; using oldest {}",
                                rows.size(), candidate.getSourceRecordId(), rows.get(0).getId());
                    }
                    return Mono.just(ClientMatch.exact(rows.get(0), MatchStrategy.SOURCE_RECORD_ID));
                });
    }

    private Mono<ClientMatch> byExactName(MatchCandidate candidate) {
        if (isBlank(candidate.getName())) {
            return Mono.empty();
        }
        return read(clientRepository.findByNameOrderByCreatedAtAsc(candidate.getName()).next())
                .map(client -> ClientMatch.exact(client, MatchStrategy.EXACT_NAME));
    }

    private Mono<ClientMatch> byContactEmail(MatchCandidate candidate) {
        if (isBlank(candidate.getContactEmail())) {
            return Mono.empty();
        }
        return read(clientRepository.findByContactEmailOrderByCreatedAtAsc(candidate.getContactEmail()).next())
                .map(client -> ClientMatch.exact(client, MatchStrategy.CONTACT_EMAIL));
    }

    private Mono<ClientMatch> byFuzzyName(MatchCandidate candidate) {
        String name = candidate.getName();
        if (name == null || name.trim().length() <= MIN_FUZZY_NAME_LENGTH) {
            return Mono.empty();
        }
        return bestAboveThreshold(name, Function.identity(), MatchStrategy.FUZZY_NAME);
    }

    private Mono<ClientMatch> bySlug(MatchCandidate candidate) {
        String slug = SlugUtil.slugify(candidate.getName());
        if (slug.isEmpty()) {
            return Mono.empty();
        }
        return read(clientRepository.findBySlugStartingWith(SlugUtil.stripNumericSuffix(slug))
                .filter(client -> SlugUtil.sameBaseSlug(slug, client.getSlug()))
                .collectSortedList(OLDEST_FIRST))
                .flatMap(rows -> rows.stream()
                        .filter(client -> slug.equals(client.getSlug()))
                        .findFirst()
                        .or(() -> rows.stream().findFirst())
                        .map(client -> Mono.just(ClientMatch.exact(client, MatchStrategy.SLUG)))
                        .orElseGet(Mono::empty));
    }

    private Mono<ClientMatch> byBaseName(MatchCandidate candidate) {
        String name = candidate.getName();
        if (isBlank(name)) {
            return Mono.empty();
        }
        String base = NameSimilarity.baseName(name);
        if (base.isEmpty() || base.equals(name.trim())) {
            return Mono.empty();
        }
        return bestAboveThreshold(base, NameSimilarity::baseName, MatchStrategy.BASE_NAME);
    }

    /**
     * Pre-select rows sharing a significant word with {@code name}, score each against the
     * (optionally transformed) existing name and keep the best one strictly above the threshold.
     */
    private Mono<ClientMatch> bestAboveThreshold(String name, Function<String, String> existingName,
                                                 MatchStrategy strategy) {
        List<String> words = NameSimilarity.significantWords(name);
        if (words.isEmpty()) {
            return Mono.empty();
        }
        double threshold = properties.getMatching().getFuzzyThreshold();

        return read(Flux.fromIterable(words)
                .concatMap(clientRepository::findByNameContainingIgnoreCase)
                .distinct(Client::getId)
                .map(client -> new ClientMatch(client, strategy,
                        NameSimilarity.similarity(name, existingName.apply(client.getName()))))
                .filter(match -> match.getScore() > threshold)
                .collectList())
                .flatMap(matches -> matches.stream()
                        .min(Comparator.comparingDouble(ClientMatch::getScore).reversed()
                                .thenComparing(ClientMatch::getClient, OLDEST_FIRST))
                        .map(Mono::just)
                        .orElseGet(Mono::empty));
    }

    private <T> Mono<T> read(Mono<T> lookup) {
        return lookup.timeout(properties.getSync().getStoreTimeout());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
