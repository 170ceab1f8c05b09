package org.cloudfiles.storage.gateway;

import org.cloudfiles.storage.domain.User;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface UserRecordGateway {

    Mono<User> getById(UUID id); // empty when unknown

    Mono<User> getByLogin(String login);

    Mono<Void> save(User user);
}
