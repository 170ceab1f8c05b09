package org.cloudfiles.storage.interactor;

import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.dto.UploadFileCommand;
import org.cloudfiles.storage.exception.AlreadyExistsException;
import org.cloudfiles.storage.exception.DomainValidationException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class UploadFileInteractor extends AbstractResourceInteractor {

    public UploadFileInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Mono<Resource> execute(UploadFileCommand command) {
        return findUser(command.userId()).flatMap(user -> {
            VirtualPath filePath = VirtualPath.of(command.targetPath());
            if (filePath.isDirectory()) {
                return Mono.error(new DomainValidationException("Upload target must be a file path: '" + filePath + "'"));
            }
            return exists(user, filePath).flatMap(exists -> {
                if (exists) {
                    return Mono.error(AlreadyExistsException.resource(filePath));
                }
                byte[] content = command.content();
                log.debug("Uploading {} bytes to {} for user {}", content.length, filePath, user.getId());
                return createMissingAncestors(user, filePath)
                        .then(Mono.defer(() -> storageGateway.saveFile(storageKey(user, filePath), content)))
                        .thenReturn(Resource.file(filePath, content.length));
            });
        });
    }
}
