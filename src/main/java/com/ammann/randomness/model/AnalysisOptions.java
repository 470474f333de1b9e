/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.SamplingMode;

/**
 * Immutable analysis configuration supplied alongside a sample.
 *
 * @param mode sampling granularity
 * @param foldCase map ASCII upper-case letters to lower case before analysis
 */
public record AnalysisOptions(SamplingMode mode, boolean foldCase) {

    public AnalysisOptions {
        if (mode == null) {
            throw new IllegalArgumentException("Sampling mode must not be null");
        }
    }

    /** Byte mode without case folding. */
    public static AnalysisOptions defaults() {
        return new AnalysisOptions(SamplingMode.BYTE, false);
    }
}
