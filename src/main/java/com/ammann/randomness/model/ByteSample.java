/* (C)2026 */
package com.ammann.randomness.model;

import java.util.Arrays;

/**
 * Immutable, ordered sequence of unsigned 8-bit values under analysis.
 *
 * <p>The backing array is copied on construction and never handed out, so every
 * measurement computed from one instance observes the same bytes.
 */
public final class ByteSample {

    private final byte[] data;

    private ByteSample(byte[] data) {
        this.data = data;
    }

    /**
     * Creates a sample holding a copy of the given bytes.
     *
     * @param bytes raw bytes, must not be null
     * @return new sample
     */
    public static ByteSample of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Sample bytes must not be null");
        }
        return new ByteSample(bytes.clone());
    }

    /** Creates a sample from unsigned values in the range 0..255. */
    public static ByteSample ofUnsigned(int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0 || values[i] > 0xFF) {
                throw new IllegalArgumentException(
                        String.format("Value at index %d out of byte range: %d", i, values[i]));
            }
            bytes[i] = (byte) values[i];
        }
        return new ByteSample(bytes);
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    /**
     * Returns the byte at {@code index} as an unsigned value 0..255.
     */
    public int unsignedAt(int index) {
        return data[index] & 0xFF;
    }

    /** Returns a copy of the underlying bytes. */
    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Returns a new sample in which ASCII upper-case letters are mapped to lower case.
     * Non-letter bytes and bytes outside the ASCII range are unchanged.
     */
    public ByteSample foldCase() {
        byte[] folded = data.clone();
        for (int i = 0; i < folded.length; i++) {
            if (folded[i] >= 'A' && folded[i] <= 'Z') {
                folded[i] = (byte) (folded[i] + ('a' - 'A'));
            }
        }
        return new ByteSample(folded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteSample that)) return false;
        return Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ByteSample{length=" + data.length + "}";
    }
}
