package org.cloudfiles.storage.interactor;

import org.cloudfiles.storage.domain.User;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ArchiveBuilder;
import org.cloudfiles.storage.gateway.ArchiveEntry;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DownloadResourceInteractorTest {

    @Mock
    private UserRecordGateway userGateway;

    @Mock
    private ArchiveBuilder archiveBuilder;

    private InMemoryObjectStorageGateway storage;

    private DownloadResourceInteractor interactor;

    private User user;

    private String root;

    @BeforeEach
    void setUp() {
        user = User.create("alice", "hash");
        root = user.getRootPath().getValue();
        storage = new InMemoryObjectStorageGateway();
        interactor = new DownloadResourceInteractor(userGateway, storage, archiveBuilder);
        when(userGateway.getById(user.getId())).thenReturn(Mono.just(user));
    }

    private void archiveEntryNames() {
        when(archiveBuilder.build(any())).thenAnswer(invocation -> {
            Flux<ArchiveEntry> entries = invocation.getArgument(0);
            return entries
                    .map(entry -> entry.isDirectory() ? entry.name() : entry.name() + "=" + read(entry))
                    .collectList()
                    .map(names -> new ByteArrayResource(String.join(",", names).getBytes(StandardCharsets.UTF_8)));
        });
    }

    private static String read(ArchiveEntry entry) {
        return entry.content()
                .map(resource -> {
                    try {
                        return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                })
                .block();
    }

    private static String body(org.springframework.core.io.Resource resource) throws IOException {
        return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    @Test
    void execute_file_streamsContentUnderItsName() {
        storage.put(root + "docs/a.txt", "hello");

        StepVerifier.create(interactor.execute(user.getId(), "docs/a.txt"))
                .assertNext(download -> {
                    assertEquals("a.txt", download.fileName());
                    assertFalse(download.archive());
                    assertDoesNotThrow(() -> assertEquals("hello", body(download.content())));
                })
                .verifyComplete();

        verifyNoInteractions(archiveBuilder);
    }

    @Test
    void execute_directory_archivesEntriesRelativeToIt() {
        archiveEntryNames();
        storage.putDirectory(root + "docs/");
        storage.put(root + "docs/a.txt", "A");
        storage.putDirectory(root + "docs/sub/");
        storage.put(root + "docs/sub/b.txt", "B");
        storage.put(root + "other.txt", "O");

        StepVerifier.create(interactor.execute(user.getId(), "docs/"))
                .assertNext(download -> {
                    assertEquals("docs.zip", download.fileName());
                    assertTrue(download.archive());
                    assertDoesNotThrow(() -> assertEquals("a.txt=A,sub/,sub/b.txt=B", body(download.content())));
                })
                .verifyComplete();
    }

    @Test
    void execute_root_usesDefaultArchiveName() {
        archiveEntryNames();
        storage.put(root + "a.txt", "A");

        StepVerifier.create(interactor.execute(user.getId(), ""))
                .assertNext(download -> {
                    assertEquals(DownloadResourceInteractor.ROOT_ARCHIVE_NAME, download.fileName());
                    assertDoesNotThrow(() -> assertEquals("a.txt=A", body(download.content())));
                })
                .verifyComplete();
    }

    @Test
    void execute_missing_failsWithNotFound() {
        StepVerifier.create(interactor.execute(user.getId(), "missing/"))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verifyNoInteractions(archiveBuilder);
    }
}
