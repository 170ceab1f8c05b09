package org.cloudfiles.storage.exception;

public class WrongPasswordException extends AbstractCloudFilesException {

    public WrongPasswordException() {
        super("Wrong password");
    }

    @Override
    public String getError() {
        return CloudFilesException.WRONG_PASSWORD;
    }
}
