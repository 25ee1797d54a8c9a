package com.clientsync.source;

import com.clientsync.exception.SourceRecordNotFoundException;
import com.clientsync.exception.SourceUnavailableException;
import com.clientsync.model.source.SourceRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Source client backed by the Notion REST API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotionSourceClient implements SourceClient {

    private static final int PAGE_SIZE = 100;

    private final WebClient.Builder webClientBuilder;
    private final SourceRateLimiter rateLimiter;
    private final NotionPageParser parser;

    @Value("${clientsync.notion.api-url:https://api.notion.com/v1}")
    private String apiUrl;

    @Value("${clientsync.notion.api-key}")
    private String apiKey;

    @Value("${clientsync.notion.version:2022-06-28}")
    private String notionVersion;

    @Value("${clientsync.notion.request-timeout:15s}")
    private Duration requestTimeout;

    @Override
    public Mono<SourceRecord> getRecord(String recordId) {
        return call(recordId, client()
                .get()
                .uri("/pages/{id}", recordId)
                .retrieve()
                .bodyToMono(JsonNode.class))
                .flatMap(page -> {
                    SourceRecord record = parser.parsePage(page);
                    if (record == null) {
                        return Mono.error(new SourceUnavailableException(
                                "Object " + recordId + " is not a page"));
                    }
                    return Mono.just(record);
                });
    }

    @Override
    public Flux<SourceRecord> queryCollection(String collectionId, Instant modifiedAfter) {
        return queryPage(collectionId, modifiedAfter, null)
                .expand(response -> response.path("has_more").asBoolean(false)
                        ? queryPage(collectionId, modifiedAfter, response.path("next_cursor").asText(null))
                        : Mono.empty())
                .flatMapIterable(response -> StreamSupport.stream(response.path("results").spliterator(), false)
                        .map(parser::parsePage)
                        .filter(record -> record != null)
                        .collect(Collectors.toList()));
    }

    @Override
    public Mono<String> getChildContent(String recordId) {
        return childrenPage(recordId, null)
                .expand(response -> response.path("has_more").asBoolean(false)
                        ? childrenPage(recordId, response.path("next_cursor").asText(null))
                        : Mono.empty())
                .flatMapIterable(response -> response.path("results"))
                .map(parser::blockToText)
                .collect(Collectors.joining("\n"))
                .map(String::trim);
    }

    private Mono<JsonNode> queryPage(String collectionId, Instant modifiedAfter, String cursor) {
        Map<String, Object> body = new HashMap<>();
        body.put("page_size", PAGE_SIZE);
        if (cursor != null) {
            body.put("start_cursor", cursor);
        }
        if (modifiedAfter != null) {
            body.put("filter", Map.of(
                    "timestamp", "last_edited_time",
                    "last_edited_time", Map.of("after", modifiedAfter.toString())));
        }

        return call(collectionId, client()
                .post()
                .uri("/databases/{id}/query", collectionId)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    private Mono<JsonNode> childrenPage(String recordId, String cursor) {
        return call(recordId, client()
                .get()
                .uri(builder -> {
                    builder.path("/blocks/{id}/children").queryParam("page_size", PAGE_SIZE);
                    if (cursor != null) {
                        builder.queryParam("start_cursor", cursor);
                    }
                    return builder.build(recordId);
                })
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    /**
     * Rate-limit, time-box and translate errors for one API request.
     */
    private <T> Mono<T> call(String id, Mono<T> request) {
        return rateLimiter.acquire()
                .then(request)
                .timeout(requestTimeout)
                .onErrorMap(error -> translate(id, error));
    }

    private Throwable translate(String id, Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            if (response.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return new SourceRecordNotFoundException(id);
            }
            log.warn("Notion API returned {} for {}", response.getStatusCode().value(), id);
            return new SourceUnavailableException(
                    "Notion API returned " + response.getStatusCode().value() + " for " + id, error);
        }
        if (error instanceof TimeoutException) {
            return new SourceUnavailableException("Notion API timed out for " + id, error);
        }
        if (error instanceof WebClientRequestException) {
            return new SourceUnavailableException("Notion API unreachable: " + error.getMessage(), error);
        }
        return error;
    }

    private WebClient client() {
        return webClientBuilder
                .baseUrl(apiUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Notion-Version", notionVersion)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }
}
