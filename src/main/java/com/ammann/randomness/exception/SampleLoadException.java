/* (C)2026 */
package com.ammann.randomness.exception;

/**
 * Exception indicating that sample bytes could not be read from a file or stream.
 *
 * <p>Mapped to HTTP 500 by {@link GlobalExceptionHandler}; raised before any
 * statistic is computed.
 */
public class SampleLoadException extends ApiException {

    public SampleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
