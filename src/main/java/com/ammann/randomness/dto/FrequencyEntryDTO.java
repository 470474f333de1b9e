/* (C)2026 */
package com.ammann.randomness.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One row of a symbol frequency table.
 *
 * @param value symbol value (0..255 in byte mode, 0..1 in bit mode)
 * @param occurrences number of samples equal to {@code value}
 * @param fraction share of all samples
 */
@Schema(description = "Occurrences of one symbol in the analysed sample")
public record FrequencyEntryDTO(
        @Schema(description = "Symbol value") Integer value,
        @Schema(description = "Number of occurrences") Long occurrences,
        @Schema(description = "Fraction of all samples") Double fraction) {}
