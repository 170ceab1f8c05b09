package org.cloudfiles.storage.exception;

/**
 * Raised when a path, resource or user cannot be built from the given values.
 */
public class DomainValidationException extends AbstractCloudFilesException {

    public DomainValidationException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return CloudFilesException.DOMAIN_VALIDATION;
    }
}
