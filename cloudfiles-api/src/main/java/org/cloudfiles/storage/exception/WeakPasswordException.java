package org.cloudfiles.storage.exception;

public class WeakPasswordException extends AbstractCloudFilesException {

    private static final String MESSAGE = "Password must be at least 8 characters long, "
            + "with only Latin letters, digits or special characters (!@#$%^&*_) and at least one digit or special character.";

    public WeakPasswordException() {
        super(MESSAGE);
    }

    @Override
    public String getError() {
        return CloudFilesException.WEAK_PASSWORD;
    }
}
