package org.cloudfiles.storage.exception;

public class AlreadyExistsException extends AbstractCloudFilesException {

    public AlreadyExistsException(String message) {
        super(message);
    }

    public static AlreadyExistsException resource(Object path) {
        return new AlreadyExistsException("Resource '" + path + "' already exists");
    }

    public static AlreadyExistsException login(String login) {
        return new AlreadyExistsException("User with login " + login + " already exists");
    }

    @Override
    public String getError() {
        return CloudFilesException.ALREADY_EXISTS;
    }
}
