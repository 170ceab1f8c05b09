package org.cloudfiles.storage.interactor;

import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class LogoutUserInteractor {

    private final SessionGateway sessionGateway;

    public Mono<Void> execute(String sessionId) {
        return sessionGateway.delete(sessionId);
    }
}
