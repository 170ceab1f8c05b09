package org.cloudfiles.storage.exception;

public class NotDirectoryException extends AbstractCloudFilesException {

    public NotDirectoryException(Object path) {
        super("Resource path '" + path + "' is not a directory");
    }

    @Override
    public String getError() {
        return CloudFilesException.NOT_DIRECTORY;
    }
}
