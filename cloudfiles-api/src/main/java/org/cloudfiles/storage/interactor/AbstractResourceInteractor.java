package org.cloudfiles.storage.interactor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.User;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Resolution steps shared by every use case working on a user's files:
 * user lookup, path parsing, mapping to a storage key under the user's root and existence checks.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractResourceInteractor {

    protected final UserRecordGateway userGateway;
    protected final ObjectStorageGateway storageGateway;

    protected Mono<User> findUser(UUID userId) {
        return userGateway.getById(userId)
                .switchIfEmpty(Mono.error(() -> ResourceNotFoundException.user(userId)));
    }

    protected static String storageKey(User user, VirtualPath path) {
        return user.getRootPath().join(path).getValue();
    }

    protected static VirtualPath toUserPath(User user, String storageKey) {
        return VirtualPath.of(storageKey).relativeTo(user.getRootPath());
    }

    /**
     * The namespace root has no marker of its own and always exists.
     */
    protected Mono<Boolean> exists(User user, VirtualPath path) {
        if (path.isRoot()) {
            return Mono.just(true);
        }
        return storageGateway.exists(storageKey(user, path));
    }

    protected Mono<Resource> toResource(User user, VirtualPath path) {
        if (path.isDirectory()) {
            return Mono.just(Resource.directory(path));
        }
        return storageGateway.getSize(storageKey(user, path))
                .map(size -> Resource.file(path, size));
    }

    /**
     * Creates the markers of the enclosing directories that do not exist yet.
     * Walks up from the parent and stops at the first existing ancestor; markers are then written top-down.
     */
    protected Mono<Void> createMissingAncestors(User user, VirtualPath path) {
        return Flux.fromIterable(path.getAncestors())
                .concatMap(ancestor -> exists(user, ancestor).map(exists -> Tuples.of(ancestor, exists)))
                .takeWhile(ancestorExists -> !ancestorExists.getT2())
                .map(Tuple2::getT1)
                .collectList()
                .flatMapMany(missing -> {
                    List<VirtualPath> topDown = new ArrayList<>(missing);
                    Collections.reverse(topDown);
                    return Flux.fromIterable(topDown);
                })
                .concatMap(directory -> {
                    log.debug("Creating missing directory {} for user {}", directory, user.getId());
                    return storageGateway.createDirectoryMarker(storageKey(user, directory));
                })
                .then();
    }
}
