package org.cloudfiles.storage.interactor;

import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.exception.NotDirectoryException;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Lists the immediate children of a directory. Children are typed by the shape of their key.
 */
@Service
public class ListDirectoryInteractor extends AbstractResourceInteractor {

    public ListDirectoryInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Flux<Resource> execute(UUID userId, String path) {
        return findUser(userId).flatMapMany(user -> {
            VirtualPath directory = VirtualPath.of(path);
            if (!directory.isDirectory()) {
                return Flux.error(new NotDirectoryException(directory));
            }
            return exists(user, directory).flatMapMany(exists -> {
                if (!exists) {
                    return Flux.error(ResourceNotFoundException.resource(directory));
                }
                return storageGateway.listDirectChildren(storageKey(user, directory))
                        .concatMap(childKey -> toResource(user, toUserPath(user, childKey)));
            });
        });
    }
}
