package org.cloudfiles.storage.interactor;

import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.User;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.dto.DownloadedResource;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ArchiveBuilder;
import org.cloudfiles.storage.gateway.ArchiveEntry;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Streams a file as is, or a directory as a zip archive of everything below it.
 */
@Slf4j
@Service
public class DownloadResourceInteractor extends AbstractResourceInteractor {

    static final String ARCHIVE_EXTENSION = ".zip";
    static final String ROOT_ARCHIVE_NAME = "files" + ARCHIVE_EXTENSION;

    private final ArchiveBuilder archiveBuilder;

    public DownloadResourceInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway,
                                      ArchiveBuilder archiveBuilder) {
        super(userGateway, storageGateway);
        this.archiveBuilder = archiveBuilder;
    }

    public Mono<DownloadedResource> execute(UUID userId, String path) {
        return findUser(userId).flatMap(user -> {
            VirtualPath resourcePath = VirtualPath.of(path);
            return exists(user, resourcePath).flatMap(exists -> {
                if (!exists) {
                    return Mono.error(ResourceNotFoundException.resource(resourcePath));
                }
                if (!resourcePath.isDirectory()) {
                    return storageGateway.getFileStream(storageKey(user, resourcePath))
                            .map(content -> new DownloadedResource(resourcePath.getName(), false, content));
                }
                log.debug("Archiving directory {} for user {}", resourcePath, userId);
                String archiveName = resourcePath.isRoot() ? ROOT_ARCHIVE_NAME : resourcePath.getName() + ARCHIVE_EXTENSION;
                return archiveBuilder.build(archiveEntries(user, resourcePath))
                        .map(content -> new DownloadedResource(archiveName, true, content));
            });
        });
    }

    private Flux<ArchiveEntry> archiveEntries(User user, VirtualPath directory) {
        VirtualPath storageDirectory = user.getRootPath().join(directory);
        return storageGateway.listRecursive(storageDirectory.getValue())
                .map(key -> {
                    String entryName = VirtualPath.of(key).relativeTo(storageDirectory).getValue();
                    if (ObjectStorageGateway.isDirectoryKey(key)) {
                        return ArchiveEntry.directory(entryName);
                    }
                    return ArchiveEntry.file(entryName, storageGateway.getFileStream(key));
                });
    }
}
