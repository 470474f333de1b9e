package com.ammann.randomness.exception;

/**
 * Base unchecked exception for all application-level errors in the randomness analyzer.
 *
 * <p>Subclasses represent specific error categories (input validation, sample loading)
 * and are mapped to appropriate HTTP status codes by {@link GlobalExceptionHandler}.
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
