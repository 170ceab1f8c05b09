package org.cloudfiles.storage.controller;

import org.cloudfiles.storage.config.SessionProperties;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.ResourceType;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.cloudfiles.storage.interactor.CreateDirectoryInteractor;
import org.cloudfiles.storage.interactor.ListDirectoryInteractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DirectoryControllerTest {

    @Mock
    private ListDirectoryInteractor listDirectoryInteractor;

    @Mock
    private CreateDirectoryInteractor createDirectoryInteractor;

    @Mock
    private SessionGateway sessionGateway;

    private DirectoryController directoryController;

    private final UUID userId = UUID.randomUUID();

    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        directoryController = new DirectoryController(listDirectoryInteractor, createDirectoryInteractor,
                new SessionUserResolver(sessionGateway, new SessionProperties()));
        exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/directory")
                .cookie(new HttpCookie("session_id", "sid")));
        when(sessionGateway.getUserId("sid")).thenReturn(Mono.just(userId));
    }

    @Test
    void listDirectory_mapsChildren() {
        when(listDirectoryInteractor.execute(userId, "docs/")).thenReturn(Flux.just(
                Resource.directory(VirtualPath.of("docs/sub/")),
                Resource.file(VirtualPath.of("docs/a.txt"), 7)));

        StepVerifier.create(directoryController.listDirectory("docs/", exchange))
                .assertNext(response -> {
                    assertEquals("docs/", response.path());
                    assertEquals("sub", response.name());
                    assertEquals(ResourceType.DIRECTORY, response.type());
                    assertNull(response.size());
                })
                .assertNext(response -> assertEquals(7L, response.size()))
                .verifyComplete();
    }

    @Test
    void createDirectory_returnsCreated() {
        when(createDirectoryInteractor.execute(userId, "docs/new/"))
                .thenReturn(Mono.just(Resource.directory(VirtualPath.of("docs/new/"))));

        StepVerifier.create(directoryController.createDirectory("docs/new/", exchange))
                .expectNextMatches(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("new", response.getBody().name());
                    return true;
                })
                .verifyComplete();
    }
}
