package com.clientsync.source;

import reactor.core.publisher.Mono;

/**
 * Gate in front of every source API call.
 */
public interface SourceRateLimiter {

    /**
     * Completes when the caller may issue its next request.
     */
    Mono<Void> acquire();

    static SourceRateLimiter unlimited() {
        return Mono::empty;
    }
}
