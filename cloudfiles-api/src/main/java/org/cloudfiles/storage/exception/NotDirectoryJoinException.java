package org.cloudfiles.storage.exception;

public class NotDirectoryJoinException extends PathValidationException {

    public NotDirectoryJoinException(String path, String other) {
        super("Cannot join '" + other + "' to '" + path + "': not a directory path");
    }
}
