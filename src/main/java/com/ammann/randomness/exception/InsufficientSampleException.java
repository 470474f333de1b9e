/* (C)2026 */
package com.ammann.randomness.exception;

/**
 * Raised when a sample is too short for the Monte Carlo pi estimate, which needs at
 * least one complete group of coordinate bytes.
 */
public class InsufficientSampleException extends ValidationException {

    private final int required;
    private final int actual;

    public InsufficientSampleException(int required, int actual) {
        super(String.format(
                "Insufficient bytes for Monte Carlo pi estimate: need at least %d, but got %d",
                required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
