package org.cloudfiles.storage.interactor;

import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.exception.DomainValidationException;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Service
public class DeleteResourceInteractor extends AbstractResourceInteractor {

    public DeleteResourceInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Mono<Void> execute(UUID userId, String path) {
        return findUser(userId).flatMap(user -> {
            VirtualPath resourcePath = VirtualPath.of(path);
            if (resourcePath.isRoot()) {
                return Mono.error(new DomainValidationException("Cannot delete the root directory"));
            }
            return exists(user, resourcePath).flatMap(exists -> {
                if (!exists) {
                    return Mono.error(ResourceNotFoundException.resource(resourcePath));
                }
                log.debug("Deleting {} for user {}", resourcePath, userId);
                // directory keys are removed with everything under their prefix
                return storageGateway.delete(storageKey(user, resourcePath));
            });
        });
    }
}
