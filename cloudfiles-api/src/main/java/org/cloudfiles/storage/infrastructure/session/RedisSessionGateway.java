package org.cloudfiles.storage.infrastructure.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.config.SessionProperties;
import org.cloudfiles.storage.dto.SessionDto;
import org.cloudfiles.storage.exception.StorageException;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Sessions stored as expiring Redis keys mapping the session id to the user id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSessionGateway implements SessionGateway {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    @Override
    public Mono<SessionDto> create(UUID userId) {
        String sessionId = UUID.randomUUID().toString();
        return redisTemplate.opsForValue()
                .set(key(sessionId), userId.toString(), sessionProperties.getLifetime())
                .onErrorMap(e -> new StorageException("Unable to store session", e))
                .flatMap(stored -> {
                    if (!Boolean.TRUE.equals(stored)) {
                        return Mono.error(new StorageException("Session " + sessionId + " was not stored"));
                    }
                    return Mono.just(new SessionDto(sessionId, userId, clock.instant().plus(sessionProperties.getLifetime())));
                });
    }

    @Override
    public Mono<UUID> getUserId(String sessionId) {
        return redisTemplate.opsForValue()
                .get(key(sessionId))
                .onErrorMap(e -> new StorageException("Unable to read session", e))
                .map(UUID::fromString);
    }

    @Override
    public Mono<Void> delete(String sessionId) {
        return redisTemplate.delete(key(sessionId))
                .onErrorMap(e -> new StorageException("Unable to delete session", e))
                .doOnNext(deleted -> log.debug("Session deleted: {}", deleted > 0))
                .then();
    }

    private String key(String sessionId) {
        return sessionProperties.getKeyPrefix() + sessionId;
    }
}
