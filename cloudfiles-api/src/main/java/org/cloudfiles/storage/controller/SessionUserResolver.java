package org.cloudfiles.storage.controller;

import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.config.SessionProperties;
import org.cloudfiles.storage.exception.UnauthorizedException;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.springframework.http.HttpCookie;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.UUID;

/**
 * Maps the session cookie of a request to the id of the signed-in user.
 */
@Component
@RequiredArgsConstructor
public class SessionUserResolver {

    private final SessionGateway sessionGateway;
    private final SessionProperties sessionProperties;

    public Mono<String> sessionId(ServerWebExchange exchange) {
        HttpCookie cookie = exchange.getRequest().getCookies().getFirst(sessionProperties.getCookieName());
        if (cookie == null || cookie.getValue().isBlank()) {
            return Mono.error(new UnauthorizedException("Missing session cookie"));
        }
        return Mono.just(cookie.getValue());
    }

    public Mono<UUID> userId(ServerWebExchange exchange) {
        return sessionId(exchange)
                .flatMap(sessionId -> sessionGateway.getUserId(sessionId)
                        .switchIfEmpty(Mono.error(() -> new UnauthorizedException("Unknown or expired session"))));
    }

    public ResponseCookie sessionCookie(String sessionId) {
        return ResponseCookie.from(sessionProperties.getCookieName(), sessionId)
                .httpOnly(true)
                .path("/")
                .maxAge(sessionProperties.getLifetime())
                .build();
    }

    public ResponseCookie expiredCookie() {
        return ResponseCookie.from(sessionProperties.getCookieName(), "")
                .httpOnly(true)
                .path("/")
                .maxAge(Duration.ZERO)
                .build();
    }
}
