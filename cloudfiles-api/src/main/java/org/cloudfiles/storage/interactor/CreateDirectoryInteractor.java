package org.cloudfiles.storage.interactor;

import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.exception.AlreadyExistsException;
import org.cloudfiles.storage.exception.NotDirectoryException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Service
public class CreateDirectoryInteractor extends AbstractResourceInteractor {

    public CreateDirectoryInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Mono<Resource> execute(UUID userId, String path) {
        return findUser(userId).flatMap(user -> {
            VirtualPath directory = VirtualPath.of(path);
            if (!directory.isDirectory()) {
                return Mono.error(new NotDirectoryException(directory));
            }
            return exists(user, directory).flatMap(exists -> {
                if (exists) {
                    return Mono.error(AlreadyExistsException.resource(directory));
                }
                log.debug("Creating directory {} for user {}", directory, userId);
                return createMissingAncestors(user, directory)
                        .then(Mono.defer(() -> storageGateway.createDirectoryMarker(storageKey(user, directory))))
                        .thenReturn(Resource.directory(directory));
            });
        });
    }
}
