/* (C)2026 */
package com.ammann.randomness.exception;

/**
 * Raised when a sample holds no bytes. Mean, entropy and chi-square are all undefined
 * for an empty sample, so the analysis is rejected before any measurement runs.
 */
public class EmptySampleException extends ValidationException {

    public EmptySampleException() {
        super("Sample is empty: at least one byte is required");
    }
}
