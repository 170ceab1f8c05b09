package org.cloudfiles.storage.exception;

public class UnauthorizedException extends AbstractCloudFilesException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public String getError() {
        return CloudFilesException.UNAUTHORIZED;
    }
}
