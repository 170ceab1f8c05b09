package org.cloudfiles.storage.exception;

public abstract class AbstractCloudFilesException extends RuntimeException {

    public AbstractCloudFilesException(String message) {
        super(message);
    }

    public AbstractCloudFilesException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getError();

}
