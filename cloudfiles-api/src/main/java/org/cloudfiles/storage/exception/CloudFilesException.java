package org.cloudfiles.storage.exception;

public interface CloudFilesException {

    String ALREADY_EXISTS = "AlreadyExists";
    String DOMAIN_VALIDATION = "DomainValidation";
    String NOT_DIRECTORY = "NotDirectory";
    String NOT_FOUND = "NotFound";
    String PATH_VALIDATION = "PathValidation";
    String STORAGE = "Storage";
    String UNAUTHORIZED = "Unauthorized";
    String WEAK_PASSWORD = "WeakPassword";
    String WRONG_PASSWORD = "WrongPassword";
}
