package com.clientsync.util;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs reactive operations one at a time per key, in subscription order.
 * Operations on different keys are not coordinated.
 *
 * Once subscribed, an operation runs to completion even if its caller cancels, and the
 * key is released only when the operation itself terminates.
 */
public class KeyedSequencer {

    private final ConcurrentMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> run(String key, Mono<T> operation) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> tail = done.asMono();
            Mono<Void> previous = tails.put(key, tail);

            Mono<Void> waitFor = previous == null ? Mono.empty() : previous;
            Sinks.One<T> result = Sinks.one();
            waitFor
                    .then(operation)
                    .doFinally(signal -> {
                        tails.remove(key, tail);
                        done.tryEmitEmpty();
                    })
                    .subscribe(result::tryEmitValue, result::tryEmitError, result::tryEmitEmpty);
            return result.asMono();
        });
    }

    int pendingKeys() {
        return tails.size();
    }
}
