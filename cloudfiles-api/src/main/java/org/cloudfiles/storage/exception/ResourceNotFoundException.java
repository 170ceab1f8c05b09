package org.cloudfiles.storage.exception;

import java.util.UUID;

public class ResourceNotFoundException extends AbstractCloudFilesException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException user(UUID userId) {
        return new ResourceNotFoundException("User with id=" + userId + " not found");
    }

    public static ResourceNotFoundException userLogin(String login) {
        return new ResourceNotFoundException("User with login " + login + " not found");
    }

    public static ResourceNotFoundException resource(Object path) {
        return new ResourceNotFoundException("Resource with path '" + path + "' not found");
    }

    @Override
    public String getError() {
        return CloudFilesException.NOT_FOUND;
    }
}
