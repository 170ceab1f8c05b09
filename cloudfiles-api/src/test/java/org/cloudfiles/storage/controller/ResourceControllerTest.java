package org.cloudfiles.storage.controller;

import org.cloudfiles.storage.config.SessionProperties;
import org.cloudfiles.storage.config.TransferProperties;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.ResourceType;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.dto.DownloadedResource;
import org.cloudfiles.storage.dto.MoveResourceCommand;
import org.cloudfiles.storage.dto.UploadFileCommand;
import org.cloudfiles.storage.exception.UnauthorizedException;
import org.cloudfiles.storage.gateway.SessionGateway;
import org.cloudfiles.storage.interactor.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.util.unit.DataSize;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResourceControllerTest {

    @Mock
    private GetResourceInteractor getResourceInteractor;

    @Mock
    private DeleteResourceInteractor deleteResourceInteractor;

    @Mock
    private UploadFileInteractor uploadFileInteractor;

    @Mock
    private DownloadResourceInteractor downloadResourceInteractor;

    @Mock
    private MoveResourceInteractor moveResourceInteractor;

    @Mock
    private SearchResourceInteractor searchResourceInteractor;

    @Mock
    private SessionGateway sessionGateway;

    @Mock
    private FilePart filePart;

    private ResourceController resourceController;

    private TransferProperties transferProperties;

    private final UUID userId = UUID.randomUUID();

    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        transferProperties = new TransferProperties();
        SessionUserResolver resolver = new SessionUserResolver(sessionGateway, new SessionProperties());
        resourceController = new ResourceController(getResourceInteractor, deleteResourceInteractor, uploadFileInteractor,
                downloadResourceInteractor, moveResourceInteractor, searchResourceInteractor, resolver, transferProperties);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resource")
                .cookie(new HttpCookie("session_id", "sid")));
        lenient().when(sessionGateway.getUserId("sid")).thenReturn(Mono.just(userId));
    }

    private static Flux<DataBuffer> buffers(String... chunks) {
        return Flux.fromArray(chunks)
                .map(chunk -> DefaultDataBufferFactory.sharedInstance.wrap(chunk.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void getResource_returnsParentPathAndName() {
        when(getResourceInteractor.execute(userId, "docs/a.txt"))
                .thenReturn(Mono.just(Resource.file(VirtualPath.of("docs/a.txt"), 3)));

        StepVerifier.create(resourceController.getResource("docs/a.txt", exchange))
                .assertNext(response -> {
                    assertEquals("docs/", response.path());
                    assertEquals("a.txt", response.name());
                    assertEquals(ResourceType.FILE, response.type());
                    assertEquals(3L, response.size());
                })
                .verifyComplete();
    }

    @Test
    void getResource_withoutSession_failsWithUnauthorized() {
        MockServerWebExchange anonymous = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/resource"));

        StepVerifier.create(resourceController.getResource("a.txt", anonymous))
                .expectError(UnauthorizedException.class)
                .verify();

        verifyNoInteractions(getResourceInteractor);
    }

    @Test
    void deleteResource_returnsNoContent() {
        when(deleteResourceInteractor.execute(userId, "docs/")).thenReturn(Mono.empty());

        StepVerifier.create(resourceController.deleteResource("docs/", exchange))
                .expectNextMatches(response -> response.getStatusCode() == HttpStatus.NO_CONTENT)
                .verifyComplete();
    }

    @Test
    void uploadFile_targetsDirectoryPlusFilename() {
        when(filePart.filename()).thenReturn("a.txt");
        when(filePart.content()).thenReturn(buffers("hel", "lo"));
        when(uploadFileInteractor.execute(any())).thenReturn(Mono.just(Resource.file(VirtualPath.of("docs/a.txt"), 5)));

        StepVerifier.create(resourceController.uploadFile("docs/", filePart, exchange))
                .expectNextMatches(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("a.txt", response.getBody().name());
                    return true;
                })
                .verifyComplete();

        ArgumentCaptor<UploadFileCommand> captor = ArgumentCaptor.forClass(UploadFileCommand.class);
        verify(uploadFileInteractor).execute(captor.capture());
        assertEquals(userId, captor.getValue().userId());
        assertEquals("docs/a.txt", captor.getValue().targetPath());
        assertEquals("hello", new String(captor.getValue().content(), StandardCharsets.UTF_8));
    }

    @Test
    void uploadFile_tooLarge_failsBeforeStoring() {
        transferProperties.setMaxFileSize(DataSize.ofBytes(4));
        when(filePart.content()).thenReturn(buffers("0123456789"));

        StepVerifier.create(resourceController.uploadFile("", filePart, exchange))
                .expectError(DataBufferLimitException.class)
                .verify();

        verifyNoInteractions(uploadFileInteractor);
    }

    @Test
    void downloadResource_directory_isSentAsZipAttachment() {
        DownloadedResource download = new DownloadedResource("docs.zip", true, new ByteArrayResource(new byte[]{1}));
        when(downloadResourceInteractor.execute(userId, "docs/")).thenReturn(Mono.just(download));

        StepVerifier.create(resourceController.downloadResource("docs/", exchange))
                .expectNextMatches(response -> {
                    assertEquals(MediaType.parseMediaType("application/zip"), response.getHeaders().getContentType());
                    assertTrue(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION).contains("docs.zip"));
                    return true;
                })
                .verifyComplete();
    }

    @Test
    void downloadResource_file_usesMediaTypeFromName() {
        DownloadedResource download = new DownloadedResource("notes.txt", false, new ByteArrayResource(new byte[]{1}));
        when(downloadResourceInteractor.execute(userId, "notes.txt")).thenReturn(Mono.just(download));

        StepVerifier.create(resourceController.downloadResource("notes.txt", exchange))
                .expectNextMatches(response -> {
                    assertEquals(MediaType.TEXT_PLAIN, response.getHeaders().getContentType());
                    assertTrue(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION).startsWith("attachment"));
                    return true;
                })
                .verifyComplete();
    }

    @Test
    void moveResource_passesBothPaths() {
        MoveResourceCommand command = new MoveResourceCommand(userId, "a.txt", "b/a.txt");
        when(moveResourceInteractor.execute(command)).thenReturn(Mono.just(Resource.file(VirtualPath.of("b/a.txt"), 1)));

        StepVerifier.create(resourceController.moveResource("a.txt", "b/a.txt", exchange))
                .assertNext(response -> assertEquals("b/", response.path()))
                .verifyComplete();
    }

    @Test
    void searchResources_mapsEveryMatch() {
        when(searchResourceInteractor.execute(userId, "a.txt")).thenReturn(Flux.just(
                Resource.file(VirtualPath.of("a.txt"), 1),
                Resource.file(VirtualPath.of("x/a.txt"), 2)));

        StepVerifier.create(resourceController.searchResources("a.txt", exchange))
                .expectNextMatches(response -> response.path().isEmpty())
                .expectNextMatches(response -> response.path().equals("x/"))
                .verifyComplete();
    }
}
