/* (C)2026 */
package com.ammann.randomness.enumeration;

/**
 * Text rendering styles for an analysis result.
 */
public enum ReportFormat {
    /** Multi-line human-readable report. */
    VERBOSE,

    /** Line-prefixed CSV-like output ({@code 0,}/{@code 1,} summary, {@code 2,}/{@code 3,} table). */
    TERSE;

    /**
     * Case-insensitive conversion from string.
     *
     * @throws IllegalArgumentException if value is null or unknown
     */
    public static ReportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ReportFormat value cannot be null");
        }
        for (ReportFormat f : values()) {
            if (f.name().equalsIgnoreCase(value.trim())) {
                return f;
            }
        }
        throw new IllegalArgumentException(
                "Invalid report format: " + value + ". Must be VERBOSE or TERSE (case-insensitive).");
    }
}
