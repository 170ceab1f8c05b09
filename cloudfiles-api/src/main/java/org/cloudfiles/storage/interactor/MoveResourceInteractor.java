package org.cloudfiles.storage.interactor;

import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.VirtualPath;
import org.cloudfiles.storage.dto.MoveResourceCommand;
import org.cloudfiles.storage.exception.AlreadyExistsException;
import org.cloudfiles.storage.exception.DomainValidationException;
import org.cloudfiles.storage.exception.ResourceNotFoundException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.cloudfiles.storage.gateway.UserRecordGateway;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Moves or renames a file or a whole directory tree.
 * Directory moves copy every object before deleting the sources, so a failure never loses data
 * but may leave both copies behind.
 */
@Slf4j
@Service
public class MoveResourceInteractor extends AbstractResourceInteractor {

    public MoveResourceInteractor(UserRecordGateway userGateway, ObjectStorageGateway storageGateway) {
        super(userGateway, storageGateway);
    }

    public Mono<Resource> execute(MoveResourceCommand command) {
        return findUser(command.userId()).flatMap(user -> {
            VirtualPath source = VirtualPath.of(command.currentPath());
            VirtualPath target = VirtualPath.of(command.targetPath());
            validateMove(source, target);
            return exists(user, source)
                    .flatMap(sourceExists -> {
                        if (!sourceExists) {
                            return Mono.error(ResourceNotFoundException.resource(source));
                        }
                        return exists(user, target);
                    })
                    .flatMap(targetExists -> {
                        if (targetExists) {
                            return Mono.error(AlreadyExistsException.resource(target));
                        }
                        log.debug("Moving {} to {} for user {}", source, target, user.getId());
                        return createMissingAncestors(user, target)
                                .then(Mono.defer(() -> storageGateway.move(storageKey(user, source), storageKey(user, target))))
                                .then(Mono.defer(() -> toResource(user, target)));
                    });
        });
    }

    static void validateMove(VirtualPath source, VirtualPath target) {
        if (source.isRoot()) {
            throw new DomainValidationException("Cannot move root directory");
        }
        if (target.isRoot()) {
            throw new DomainValidationException("Cannot replace root directory");
        }
        if (source.equals(target)) {
            throw new DomainValidationException("Source and destination paths are the same: '" + source + "'");
        }
        if (source.isDirectory() != target.isDirectory()) {
            throw new DomainValidationException("Cannot move '" + source + "' to '" + target + "': file and directory paths cannot be mixed");
        }
        if (source.isAncestorOf(target)) {
            throw new DomainValidationException("Cannot move '" + source + "' into its own descendant '" + target + "'");
        }
    }
}
