package org.cloudfiles.storage.interactor;

import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.exception.DomainValidationException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Finds every file or directory of the user whose name is exactly the query.
 */
@Service
public class SearchResourceInteractor extends AbstractResourceInteractor {

    public SearchResourceInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Flux<Resource> execute(UUID userId, String name) {
        if (name == null || name.isBlank()) {
            return Flux.error(new DomainValidationException("Search query cannot be empty"));
        }
        return findUser(userId).flatMapMany(user ->
                storageGateway.listRecursive(user.getRootPath().getValue())
                        .map(key -> toUserPath(user, key))
                        .filter(path -> path.getName().equals(name))
                        .concatMap(path -> toResource(user, path)));
    }
}
