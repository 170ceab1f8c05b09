package org.cloudfiles.storage.interactor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.User;
import org.cloudfiles.storage.dto.UserCredentials;
import org.cloudfiles.storage.exception.AlreadyExistsException;
import org.cloudfiles.storage.exception.WeakPasswordException;
import org.cloudfiles.storage.gateway.CredentialHasher;
import org.cloudfiles.storage.gateway.UnitOfWork;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterUserInteractor {

    private static final Pattern PASSWORD_PATTERN = Pattern.compile("^[A-Za-z\\d!@#$%^&*_]{8,}$");
    private static final Pattern PASSWORD_REQUIRED_CHAR = Pattern.compile("[\\d!@#$%^&*_]");

    private final UserRecordGateway userGateway;
    private final CredentialHasher hasher;
    private final UnitOfWork unitOfWork;

    public Mono<Void> execute(UserCredentials credentials) {
        return Mono.defer(() -> {
            if (!isStrongPassword(credentials.password())) {
                return Mono.error(new WeakPasswordException());
            }
            User user = User.create(credentials.login(), hasher.hash(credentials.password()));
            return userGateway.getByLogin(user.getLogin())
                    .flatMap(existing -> Mono.<Void>error(AlreadyExistsException.login(user.getLogin())))
                    .switchIfEmpty(Mono.defer(() -> unitOfWork.commit(userGateway.save(user))
                            .onErrorMap(DuplicateKeyException.class, e -> AlreadyExistsException.login(user.getLogin()))))
                    .doOnSuccess(ignored -> log.info("Registered user {}", user));
        });
    }

    static boolean isStrongPassword(String password) {
        return password != null
                && PASSWORD_PATTERN.matcher(password).matches()
                && PASSWORD_REQUIRED_CHAR.matcher(password).find();
    }
}
