/* (C)2026 */
package com.ammann.randomness.enumeration;

/**
 * Granularity at which a byte sample is reinterpreted into symbols.
 *
 * <ul>
 *   <li>BYTE: every byte is one symbol out of 256
 *   <li>BIT: every bit is one symbol out of 2, least-significant bit first within a byte
 * </ul>
 */
public enum SamplingMode {
    /** One symbol per byte, alphabet of 256 values. */
    BYTE(256, 1, 8.0, 127.5, "byte"),

    /** Eight symbols per byte, alphabet of 2 values. */
    BIT(2, 8, 1.0, 0.5, "bit");

    private final int alphabetSize;
    private final int samplesPerByte;
    private final double maxEntropy;
    private final double referenceMean;
    private final String unit;

    SamplingMode(
            int alphabetSize,
            int samplesPerByte,
            double maxEntropy,
            double referenceMean,
            String unit) {
        this.alphabetSize = alphabetSize;
        this.samplesPerByte = samplesPerByte;
        this.maxEntropy = maxEntropy;
        this.referenceMean = referenceMean;
        this.unit = unit;
    }

    public int getAlphabetSize() {
        return alphabetSize;
    }

    public int getSamplesPerByte() {
        return samplesPerByte;
    }

    /** Maximum entropy in bits per sample. */
    public double getMaxEntropy() {
        return maxEntropy;
    }

    /**
     * Value quoted next to the mean when reporting in this mode's units. The mean
     * itself is always computed over raw byte values.
     */
    public double getReferenceMean() {
        return referenceMean;
    }

    public String getUnit() {
        return unit;
    }

    /** Degrees of freedom of the chi-square test over this alphabet. */
    public int getDegreesOfFreedom() {
        return alphabetSize - 1;
    }

    /**
     * Number of samples a buffer of the given length yields in this mode.
     *
     * @param byteCount buffer length in bytes
     * @return total sample count
     */
    public long totalSamples(long byteCount) {
        return byteCount * samplesPerByte;
    }

    /**
     * Case-insensitive conversion from string.
     *
     * @param value String value ("byte", "bit", case-insensitive)
     * @return SamplingMode enum value
     * @throws IllegalArgumentException if value is invalid
     */
    public static SamplingMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("SamplingMode value cannot be null");
        }
        for (SamplingMode m : values()) {
            if (m.name().equalsIgnoreCase(value.trim())) {
                return m;
            }
        }
        throw new IllegalArgumentException(
                "Invalid sampling mode: " + value + ". Must be BYTE or BIT (case-insensitive).");
    }
}
