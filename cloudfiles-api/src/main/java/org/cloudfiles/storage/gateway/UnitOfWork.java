package org.cloudfiles.storage.gateway;

import reactor.core.publisher.Mono;

/**
 * Explicit commit boundary for relational writes.
 */
public interface UnitOfWork {

    /**
     * Runs the given work and commits everything it wrote as a single unit.
     */
    <T> Mono<T> commit(Mono<T> work);
}
