package com.ammann.fedstats.exception;

/**
 * Base unchecked exception for all application-level errors in the federated statistics service.
 *
 * <p>Subclasses represent specific error categories (invalid input, unknown runs, artifact store
 * failures, typed round failures) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler} when they reach the REST layer.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
