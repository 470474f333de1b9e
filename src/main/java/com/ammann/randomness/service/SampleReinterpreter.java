/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.model.ByteSample;
import com.ammann.randomness.model.FrequencyTable;

/**
 * Reinterprets a byte sample as a sequence of symbols and counts their occurrences.
 *
 * <p>In {@link SamplingMode#BYTE} every byte is a symbol 0..255. In {@link SamplingMode#BIT}
 * every byte contributes its eight bits, least-significant first, as symbols 0 or 1.
 */
public final class SampleReinterpreter {

    private SampleReinterpreter() {}

    /**
     * Builds a fresh frequency table over the mode's alphabet.
     *
     * @param sample bytes to count, not modified
     * @param mode sampling mode
     * @return counts per symbol with the total number of samples
     */
    public static FrequencyTable countFrequencies(ByteSample sample, SamplingMode mode) {
        long[] counts = new long[mode.getAlphabetSize()];
        int length = sample.length();

        if (mode == SamplingMode.BIT) {
            for (int i = 0; i < length; i++) {
                int value = sample.unsignedAt(i);
                for (int bit = 0; bit < Byte.SIZE; bit++) {
                    counts[(value >> bit) & 1]++;
                }
            }
        } else {
            for (int i = 0; i < length; i++) {
                counts[sample.unsignedAt(i)]++;
            }
        }

        return new FrequencyTable(mode, counts, mode.totalSamples(length));
    }

    /**
     * Returns the symbol at {@code index} of the reinterpreted sequence.
     *
     * @param sample source bytes
     * @param mode sampling mode
     * @param index symbol index, {@code 0 <= index < mode.totalSamples(sample.length())}
     * @return symbol value
     */
    public static int symbolAt(ByteSample sample, SamplingMode mode, long index) {
        if (mode == SamplingMode.BIT) {
            int value = sample.unsignedAt((int) (index / Byte.SIZE));
            return (value >> (int) (index % Byte.SIZE)) & 1;
        }
        return sample.unsignedAt((int) index);
    }
}
