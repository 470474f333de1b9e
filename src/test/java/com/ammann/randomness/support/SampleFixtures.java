/* (C)2026 */
package com.ammann.randomness.support;

import com.ammann.randomness.model.ByteSample;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class SampleFixtures {

    private SampleFixtures() {}

    /** {@code length} bytes all equal to {@code value}. */
    public static ByteSample constant(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return ByteSample.of(bytes);
    }

    /** {@code 0, 1, ..., 255, 0, 1, ...} for {@code length} bytes. */
    public static ByteSample cyclic(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) i;
        }
        return ByteSample.of(bytes);
    }

    /** Alternating {@code a, b, a, b, ...} for {@code length} bytes. */
    public static ByteSample alternating(int length, int a, int b) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i % 2 == 0 ? a : b);
        }
        return ByteSample.of(bytes);
    }

    public static ByteSample ascii(String text) {
        return ByteSample.of(text.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] cyclicBytes(int length) {
        return cyclic(length).toByteArray();
    }
}
