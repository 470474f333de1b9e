/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.SamplingMode;

/**
 * Immutable snapshot of every measurement computed from one sample.
 *
 * <p>Entropy and compression are expressed per sample of {@code mode} (bits per byte or
 * bits per bit). The mean, pi estimate and serial correlation are always computed over
 * raw byte values.
 *
 * @param mode sampling mode used for entropy, chi-square and the frequency table
 * @param byteCount sample length in bytes
 * @param sampleCount number of symbols analysed ({@code byteCount}, or {@code 8 * byteCount} in bit mode)
 * @param entropy Shannon entropy in bits per sample
 * @param compression optimum compression estimate in percent
 * @param chiSquare chi-square statistic against the uniform distribution
 * @param pValue normal-approximation probability of exceeding {@code chiSquare}
 * @param exactPValue exact chi-square upper-tail probability
 * @param mean arithmetic mean of the byte values
 * @param piEstimate Monte Carlo estimate of pi
 * @param serialCorrelation lag-1 serial correlation coefficient of the byte values
 * @param frequencies symbol counts the entropy and chi-square were derived from
 */
public record RandomnessResult(
        SamplingMode mode,
        long byteCount,
        long sampleCount,
        double entropy,
        double compression,
        double chiSquare,
        Measurement pValue,
        double exactPValue,
        double mean,
        double piEstimate,
        Measurement serialCorrelation,
        FrequencyTable frequencies) {

    /** Relative deviation of {@link #piEstimate()} from {@link Math#PI}, in percent. */
    public double piErrorPercent() {
        return Math.abs(piEstimate - Math.PI) / Math.PI * 100.0;
    }

    /**
     * Probability quoted in reports: the normal approximation where it applies,
     * otherwise the exact chi-square tail.
     */
    public double reportedPValue() {
        return pValue.orElse(exactPValue);
    }
}
