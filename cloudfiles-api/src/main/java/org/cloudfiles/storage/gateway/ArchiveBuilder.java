package org.cloudfiles.storage.gateway;

import org.springframework.core.io.Resource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ArchiveBuilder {

    /**
     * Streams the given entries into an archive. The returned resource is readable while entries are still being written.
     */
    Mono<Resource> build(Flux<ArchiveEntry> entries);
}
