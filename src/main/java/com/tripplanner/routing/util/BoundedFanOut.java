package com.tripplanner.routing.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.Function;

/**
 * Runs a blocking lookup over many inputs with a fixed number in flight, keeping input order.
 */
public final class BoundedFanOut {

    private BoundedFanOut() {
    }

    public static <T, R> List<R> map(List<T> inputs, int concurrency, Function<T, R> lookup) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        List<R> results = Flux.fromIterable(inputs)
                .flatMapSequential(input -> Mono.fromCallable(() -> lookup.apply(input))
                        .subscribeOn(Schedulers.boundedElastic()), Math.max(1, concurrency))
                .collectList()
                .block();
        return results == null ? List.of() : results;
    }
}
