package org.cloudfiles.storage.controller;

import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.config.RestApiVersion;
import org.cloudfiles.storage.dto.response.ResourceResponse;
import org.cloudfiles.storage.interactor.CreateDirectoryInteractor;
import org.cloudfiles.storage.interactor.ListDirectoryInteractor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_DIRECTORY)
@RequiredArgsConstructor
public class DirectoryController {

    private final ListDirectoryInteractor listDirectoryInteractor;
    private final CreateDirectoryInteractor createDirectoryInteractor;
    private final SessionUserResolver sessionUserResolver;

    @GetMapping
    @Operation(summary = "List a directory", description = "Lists the immediate children of a directory. An empty path lists the root.")
    public Flux<ResourceResponse> listDirectory(@RequestParam(defaultValue = "") String path, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMapMany(userId -> listDirectoryInteractor.execute(userId, path))
                .map(ResourceResponse::from);
    }

    @PostMapping
    @Operation(summary = "Create a directory", description = "Creates a directory and any missing parent directory. The path must end with '/'.")
    public Mono<ResponseEntity<ResourceResponse>> createDirectory(@RequestParam String path, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> createDirectoryInteractor.execute(userId, path))
                .map(resource -> ResponseEntity.status(HttpStatus.CREATED).body(ResourceResponse.from(resource)));
    }
}
