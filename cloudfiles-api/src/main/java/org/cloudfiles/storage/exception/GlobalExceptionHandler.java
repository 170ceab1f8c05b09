package org.cloudfiles.storage.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DomainValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDomainValidation(DomainValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(WeakPasswordException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleWeakPassword(WeakPasswordException ex) {
        log.warn("Weak password rejected");
        return respond(HttpStatus.BAD_REQUEST, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(NotDirectoryException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotDirectory(NotDirectoryException ex) {
        log.warn("Not a directory: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(AlreadyExistsException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAlreadyExists(AlreadyExistsException ex) {
        log.warn("Already exists: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(WrongPasswordException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleWrongPassword(WrongPasswordException ex) {
        log.warn("Sign-in rejected: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnauthorized(UnauthorizedException ex) {
        log.debug("Unauthorized request: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStorageException(StorageException ex) {
        log.error("Storage exception: {}", ex.getMessage(), ex.getCause());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getError(), "Storage operation failed: " + ex.getMessage());
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleFileTooLarge(DataBufferLimitException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "FileTooLarge", "Uploaded file exceeds the maximum allowed size");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationExceptions(WebExchangeBindException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, CloudFilesException.DOMAIN_VALIDATION, "Validation failed: " + errors);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(ResponseStatusException ex) {
        log.warn("Request rejected: {}", ex.getMessage());
        HttpStatusCode status = ex.getStatusCode();
        return Mono.just(ResponseEntity.status(status).body(new ErrorResponse(status.value(), "BadRequest", ex.getReason())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Illegal argument : {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, CloudFilesException.DOMAIN_VALIDATION, ex.getMessage());
    }

    @ExceptionHandler(Throwable.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Throwable ex) {
        log.error("An unexpected error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal", "An unexpected error occurred. Please try again later.");
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String error, String message) {
        return Mono.just(ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message)));
    }

    public record ErrorResponse(int status, String error, String message) {
    }
}
