package org.cloudfiles.storage.exception;

public class PathValidationException extends DomainValidationException {

    public PathValidationException(String message) {
        super(message);
    }

    public static PathValidationException invalidFormat(String value, String reason) {
        return new PathValidationException("Invalid path '" + value + "': " + reason);
    }

    @Override
    public String getError() {
        return CloudFilesException.PATH_VALIDATION;
    }
}
