package org.cloudfiles.storage.controller;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.config.RestApiVersion;
import org.cloudfiles.storage.dto.request.AuthRequest;
import org.cloudfiles.storage.dto.response.SignInResponse;
import org.cloudfiles.storage.interactor.LoginUserInteractor;
import org.cloudfiles.storage.interactor.LogoutUserInteractor;
import org.cloudfiles.storage.interactor.RegisterUserInteractor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_AUTH)
@RequiredArgsConstructor
public class AuthController {

    private final RegisterUserInteractor registerUserInteractor;
    private final LoginUserInteractor loginUserInteractor;
    private final LogoutUserInteractor logoutUserInteractor;
    private final SessionUserResolver sessionUserResolver;

    @PostMapping("/sign-up")
    @Operation(summary = "Register a user", description = "Creates a new account with the given login and password.")
    public Mono<ResponseEntity<Void>> signUp(@Valid @RequestBody AuthRequest request) {
        return registerUserInteractor.execute(request.toCredentials())
                .thenReturn(ResponseEntity.status(HttpStatus.CREATED).build());
    }

    @PostMapping("/sign-in")
    @Operation(summary = "Sign in", description = "Checks the credentials and opens a session carried by a cookie.")
    public Mono<ResponseEntity<SignInResponse>> signIn(@Valid @RequestBody AuthRequest request) {
        return loginUserInteractor.execute(request.toCredentials())
                .map(session -> ResponseEntity.ok()
                        .header(HttpHeaders.SET_COOKIE, sessionUserResolver.sessionCookie(session.id()).toString())
                        .body(new SignInResponse(request.login())));
    }

    @PostMapping("/sign-out")
    @Operation(summary = "Sign out", description = "Closes the current session.")
    public Mono<ResponseEntity<Void>> signOut(ServerWebExchange exchange) {
        return sessionUserResolver.sessionId(exchange)
                .flatMap(logoutUserInteractor::execute)
                .thenReturn(ResponseEntity.noContent()
                        .header(HttpHeaders.SET_COOKIE, sessionUserResolver.expiredCookie().toString())
                        .build());
    }
}
