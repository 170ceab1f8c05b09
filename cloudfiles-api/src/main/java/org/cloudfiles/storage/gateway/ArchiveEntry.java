package org.cloudfiles.storage.gateway;

import org.springframework.core.io.Resource;
import reactor.core.publisher.Mono;

/**
 * One entry of an archive. Directory entries have no content.
 *
 * @param name    path of the entry inside the archive, directories end with '/'
 * @param content lazily loaded content, {@code null} for directories
 */
public record ArchiveEntry(String name, Mono<? extends Resource> content) {

    public static ArchiveEntry file(String name, Mono<? extends Resource> content) {
        return new ArchiveEntry(name, content);
    }

    public static ArchiveEntry directory(String name) {
        return new ArchiveEntry(name, null);
    }

    public boolean isDirectory() {
        return content == null;
    }
}
