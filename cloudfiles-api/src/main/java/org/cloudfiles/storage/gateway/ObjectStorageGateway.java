package org.cloudfiles.storage.gateway;

import org.springframework.core.io.Resource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Flat key-value object store. Keys are full storage paths, directory keys end with {@link #FOLDER_SEPARATOR}.
 */
public interface ObjectStorageGateway {

    String FOLDER_SEPARATOR = "/";

    /**
     * True for an exact key, or for a directory key having at least one object under it.
     */
    Mono<Boolean> exists(String path);

    Mono<Void> saveFile(String path, byte[] content);

    Mono<byte[]> getFile(String path);

    Mono<? extends Resource> getFileStream(String path);

    /**
     * Deletes the key; a directory key also deletes every object under its prefix.
     */
    Mono<Void> delete(String path);

    /**
     * Relocates a file, or every object under a directory prefix, copying all objects before deleting any source.
     */
    Mono<Void> move(String fromPath, String toPath);

    /**
     * Immediate children of a directory: file keys and sub-directory prefixes.
     */
    Flux<String> listDirectChildren(String path);

    /**
     * Every key under the prefix, excluding the directory's own marker.
     */
    Flux<String> listRecursive(String path);

    Mono<Long> getSize(String path);

    Mono<Void> createDirectoryMarker(String path);

    static boolean isDirectoryKey(String path) {
        return path.endsWith(FOLDER_SEPARATOR);
    }
}
