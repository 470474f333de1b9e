/* (C)2026 */
package com.ammann.randomness.exception;

/**
 * Raised when the requested sample file does not exist. Mapped to HTTP 404.
 */
public class SampleNotFoundException extends SampleLoadException {

    public SampleNotFoundException(String path, Throwable cause) {
        super("Sample file not found: " + path, cause);
    }
}
