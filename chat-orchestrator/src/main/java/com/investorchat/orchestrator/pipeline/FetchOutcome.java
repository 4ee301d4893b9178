package com.investorchat.orchestrator.pipeline;

import reactor.core.publisher.Mono;

/**
 * Result-or-error of one fan-out branch.
 *
 * <p>Branches are materialised into outcomes before the join so the abort policy is
 * applied explicitly after every branch has finished, not by error propagation.
 */
record FetchOutcome<T>(String branch, T value, Throwable error) {

    static <T> Mono<FetchOutcome<T>> capture(String branch, Mono<T> fetch) {
        return fetch
            .map(v -> new FetchOutcome<T>(branch, v, null))
            .switchIfEmpty(Mono.fromSupplier(() -> new FetchOutcome<T>(branch, null,
                new IllegalStateException("no response body"))))
            .onErrorResume(e -> Mono.just(new FetchOutcome<T>(branch, null, e)));
    }

    boolean failed() {
        return error != null;
    }
}
