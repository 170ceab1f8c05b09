package org.cloudfiles.storage.exception;

public class NotNestedPathException extends PathValidationException {

    public NotNestedPathException(String path, String base) {
        super("Path '" + path + "' is not nested under '" + base + "'");
    }
}
