package org.cloudfiles.storage.interactor;

import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Service
public class GetResourceInteractor extends AbstractResourceInteractor {

    public GetResourceInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Mono<Resource> execute(UUID userId, String path) {
        return findUser(userId).flatMap(user -> {
            VirtualPath resourcePath = VirtualPath.of(path);
            return exists(user, resourcePath).flatMap(exists -> {
                if (!exists) {
                    return Mono.error(ResourceNotFoundException.resource(resourcePath));
                }
                return toResource(user, resourcePath);
            });
        });
    }
}
