/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.SamplingMode;
import java.util.Arrays;

/**
 * Occurrence counts per symbol of a sampling mode's alphabet.
 *
 * @param mode sampling mode that defines the alphabet
 * @param counts occurrences indexed by symbol value
 * @param totalSamples number of samples counted (bytes, or bits in bit mode)
 */
public record FrequencyTable(SamplingMode mode, long[] counts, long totalSamples) {

    public FrequencyTable {
        if (mode == null || counts == null) {
            throw new IllegalArgumentException("Frequency table requires a mode and counts");
        }
        if (counts.length != mode.getAlphabetSize()) {
            throw new IllegalArgumentException(
                    String.format(
                            "Expected %d counts for %s mode, got %d",
                            mode.getAlphabetSize(), mode, counts.length));
        }
        counts = counts.clone();
    }

    @Override
    public long[] counts() {
        return counts.clone();
    }

    public int alphabetSize() {
        return counts.length;
    }

    public long count(int symbol) {
        return counts[symbol];
    }

    /**
     * Returns the share of samples equal to {@code symbol}, or 0.0 for an empty table.
     */
    public double fraction(int symbol) {
        return totalSamples == 0 ? 0.0 : counts[symbol] / (double) totalSamples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyTable that)) return false;
        return totalSamples == that.totalSamples
                && mode == that.mode
                && Arrays.equals(counts, that.counts);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * mode.hashCode() + Arrays.hashCode(counts)) + Long.hashCode(totalSamples);
    }

    @Override
    public String toString() {
        return "FrequencyTable{mode=" + mode + ", totalSamples=" + totalSamples + "}";
    }
}
