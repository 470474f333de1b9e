/* (C)2026 */
package com.ammann.randomness.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.randomness.enumeration.SamplingMode;
import org.junit.jupiter.api.Test;

class FrequencyTableTest {

    @Test
    void countsAreDefensivelyCopied() {
        long[] counts = {3, 5};
        FrequencyTable table = new FrequencyTable(SamplingMode.BIT, counts, 8);

        counts[0] = 100;
        table.counts()[1] = 100;

        assertThat(table.count(0)).isEqualTo(3);
        assertThat(table.count(1)).isEqualTo(5);
    }

    @Test
    void fractionsAreRelativeToTotalSamples() {
        FrequencyTable table = new FrequencyTable(SamplingMode.BIT, new long[] {6, 2}, 8);

        assertThat(table.fraction(0)).isEqualTo(0.75);
        assertThat(table.fraction(1)).isEqualTo(0.25);
    }

    @Test
    void emptyTableHasZeroFractions() {
        FrequencyTable table = new FrequencyTable(SamplingMode.BIT, new long[2], 0);

        assertThat(table.fraction(0)).isZero();
    }

    @Test
    void rejectsCountsNotMatchingAlphabet() {
        assertThatThrownBy(() -> new FrequencyTable(SamplingMode.BYTE, new long[2], 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 256 counts");
    }

    @Test
    void equalityComparesCountContents() {
        assertThat(new FrequencyTable(SamplingMode.BIT, new long[] {1, 1}, 2))
                .isEqualTo(new FrequencyTable(SamplingMode.BIT, new long[] {1, 1}, 2))
                .hasSameHashCodeAs(new FrequencyTable(SamplingMode.BIT, new long[] {1, 1}, 2));
    }
}
