/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.UndefinedReason;
import java.util.Objects;

/**
 * A statistic that either carries a finite value or is explicitly undefined.
 *
 * <p>Exactly one of {@code value} and {@code undefinedReason} is non-null. An undefined
 * measurement never compares equal to a defined one, including a defined {@code 0.0}.
 */
public final class Measurement {

    private final Double value;
    private final UndefinedReason undefinedReason;

    private Measurement(Double value, UndefinedReason undefinedReason) {
        this.value = value;
        this.undefinedReason = undefinedReason;
    }

    /**
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static Measurement defined(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Measurement value must be finite, got " + value);
        }
        return new Measurement(value, null);
    }

    public static Measurement undefined(UndefinedReason reason) {
        return new Measurement(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isDefined() {
        return value != null;
    }

    /**
     * @return the numeric value
     * @throws IllegalStateException if the measurement is undefined
     */
    public double value() {
        if (value == null) {
            throw new IllegalStateException("Measurement is undefined: " + undefinedReason.getDescription());
        }
        return value;
    }

    public double orElse(double fallback) {
        return value != null ? value : fallback;
    }

    /** Reason for an undefined measurement, or {@code null} when defined. */
    public UndefinedReason undefinedReason() {
        return undefinedReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Measurement that)) return false;
        return Objects.equals(value, that.value) && undefinedReason == that.undefinedReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, undefinedReason);
    }

    @Override
    public String toString() {
        return isDefined() ? String.valueOf(value) : "undefined(" + undefinedReason + ")";
    }
}
