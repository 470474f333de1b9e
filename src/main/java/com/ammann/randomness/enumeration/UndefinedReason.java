package com.ammann.randomness.enumeration;

/**
 * Reason a measurement could not be given a numeric value.
 */
public enum UndefinedReason
{
    /** All values in one of the correlated sequences are equal; the denominator is zero. */
    DEGENERATE_VARIANCE("all values equal"),

    /** Chi-square statistic is below its degrees of freedom; the normal approximation does not apply. */
    INVALID_CHI_SQUARE_TAIL("chi-square below degrees of freedom"),

    /** Not enough values to form a single pair or group. */
    INSUFFICIENT_SAMPLES("not enough samples");

    private final String description;

    UndefinedReason(String description) {
        this.description = description;
    }

    public String getDescription() { return description; }
}
