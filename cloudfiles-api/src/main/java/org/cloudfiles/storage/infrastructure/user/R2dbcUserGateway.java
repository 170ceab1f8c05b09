package org.cloudfiles.storage.infrastructure.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.User;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class R2dbcUserGateway implements UserRecordGateway {

    private final UserRepository userRepository;

    @Override
    public Mono<User> getById(UUID id) {
        return userRepository.findById(id).map(UserEntity::toUser);
    }

    @Override
    public Mono<User> getByLogin(String login) {
        return userRepository.findByLogin(login).map(UserEntity::toUser);
    }

    @Override
    public Mono<Void> save(User user) {
        return userRepository.save(UserEntity.newUser(user))
                .doOnNext(saved -> log.debug("User {} stored", saved.getId()))
                .then();
    }
}
