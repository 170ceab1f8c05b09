package org.cloudfiles.storage.interactor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.dto.SessionDto;
import org.cloudfiles.storage.dto.UserCredentials;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.exception.WrongPasswordException;
import org.cloudfiles.storage.gateway.CredentialHasher;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class LoginUserInteractor {

    private final UserRecordGateway userGateway;
    private final CredentialHasher hasher;
    private final SessionGateway sessionGateway;

    public Mono<SessionDto> execute(UserCredentials credentials) {
        return userGateway.getByLogin(credentials.login())
                .switchIfEmpty(Mono.error(() -> ResourceNotFoundException.userLogin(credentials.login())))
                .flatMap(user -> {
                    if (!hasher.verify(credentials.password(), user.getHashedPassword())) {
                        return Mono.error(new WrongPasswordException());
                    }
                    return sessionGateway.create(user.getId());
                })
                .doOnNext(session -> log.debug("Session opened for user {}", session.userId()));
    }
}
