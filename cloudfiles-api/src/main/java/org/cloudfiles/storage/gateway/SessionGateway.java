package org.cloudfiles.storage.gateway;

import org.cloudfiles.storage.dto.SessionDto;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface SessionGateway {

    Mono<SessionDto> create(UUID userId);

    /**
     * @return the owner of the session, empty if the session is unknown or expired
     */
    Mono<UUID> getUserId(String sessionId);

    /**
     * Deleting an unknown session completes normally.
     */
    Mono<Void> delete(String sessionId);
}
