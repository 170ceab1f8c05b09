package org.cloudfiles.storage.infrastructure.user;

import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.gateway.UnitOfWork;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * Runs the work inside an R2DBC transaction, committed when the publisher completes and rolled back on error.
 */
@Component
@RequiredArgsConstructor
public class TransactionalUnitOfWork implements UnitOfWork {

    private final TransactionalOperator transactionalOperator;

    @Override
    public <T> Mono<T> commit(Mono<T> work) {
        return transactionalOperator.transactional(work);
    }
}
