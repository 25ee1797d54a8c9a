package com.clientsync.exception;

import com.clientsync.model.dto.ErrorResponse;
import com.clientsync.model.sync.SyncRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SyncAlreadyInProgressException.class)
    public Mono<ResponseEntity<SyncRun>> handleSyncAlreadyInProgress(SyncAlreadyInProgressException ex) {
        log.info("Sync request refused: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getSyncRun()));
    }

    @ExceptionHandler({ResourceNotFoundException.class, SourceRecordNotFoundException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(ex.getMessage())));
    }

    @ExceptionHandler({InvalidSourceRecordException.class, IllegalArgumentException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleInvalid(RuntimeException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(ex.getMessage())));
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSourceUnavailable(SourceUnavailableException ex) {
        log.warn("Source unavailable: {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error("Source unavailable: " + ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("Internal server error: " + ex.getMessage())));
    }

    private ErrorResponse error(String detail) {
        return ErrorResponse.builder()
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
    }
}
