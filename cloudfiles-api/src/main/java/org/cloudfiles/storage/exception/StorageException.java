package org.cloudfiles.storage.exception;

public class StorageException extends AbstractCloudFilesException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return CloudFilesException.STORAGE;
    }
}
