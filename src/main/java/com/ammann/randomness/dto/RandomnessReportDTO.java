package com.ammann.randomness.dto;

import com.ammann.randomness.model.FrequencyTable;
import com.ammann.randomness.model.Measurement;
import com.ammann.randomness.model.RandomnessResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Data transfer object for a complete randomness analysis.
 *
 * <p>Undefined measurements are serialized as an absent value together with a reason
 * ({@code pValueUndefinedReason}, {@code serialCorrelationUndefinedReason}) so that
 * clients never mistake them for a number.
 */
@Schema(description = "Randomness analysis of a byte sample")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RandomnessReportDTO(
        @Schema(description = "Sampling mode used for entropy, chi-square and the frequency table")
        String mode,

        @Schema(description = "Sample length in bytes")
        Long byteCount,

        @Schema(description = "Number of symbols analysed (bytes, or bits in bit mode)")
        Long sampleCount,

        @Schema(description = "Shannon entropy in bits per sample")
        Double entropy,

        @Schema(description = "Optimum compression estimate in percent")
        Double compressionPercent,

        @Schema(description = "Chi-square statistic against a uniform distribution")
        Double chiSquare,

        @Schema(description = "Normal-approximation probability of exceeding the chi-square value; absent when not computable")
        Double pValue,

        @Schema(description = "Why the approximate p-value is absent")
        String pValueUndefinedReason,

        @Schema(description = "Exact chi-square upper-tail probability")
        Double exactPValue,

        @Schema(description = "Arithmetic mean of the byte values (127.5 = random)")
        Double mean,

        @Schema(description = "Monte Carlo estimate of pi")
        Double piEstimate,

        @Schema(description = "Relative error of the pi estimate in percent")
        Double piErrorPercent,

        @Schema(description = "Lag-1 serial correlation coefficient; absent when undefined")
        Double serialCorrelation,

        @Schema(description = "Why the serial correlation is absent")
        String serialCorrelationUndefinedReason,

        @Schema(description = "Symbol frequency table, present when requested")
        List<FrequencyEntryDTO> frequencies
) {
    /**
     * Converts an engine result to a DTO.
     *
     * @param result Engine calculation result
     * @param includeTable whether to include the frequency table
     * @return DTO ready for JSON serialization
     */
    public static RandomnessReportDTO from(RandomnessResult result, boolean includeTable) {
        return new RandomnessReportDTO(
                result.mode().name(),
                result.byteCount(),
                result.sampleCount(),
                result.entropy(),
                result.compression(),
                result.chiSquare(),
                valueOf(result.pValue()),
                reasonOf(result.pValue()),
                result.exactPValue(),
                result.mean(),
                result.piEstimate(),
                result.piErrorPercent(),
                valueOf(result.serialCorrelation()),
                reasonOf(result.serialCorrelation()),
                includeTable ? toEntries(result.frequencies()) : null
        );
    }

    private static Double valueOf(Measurement measurement) {
        return measurement.isDefined() ? measurement.value() : null;
    }

    private static String reasonOf(Measurement measurement) {
        return measurement.isDefined() ? null : measurement.undefinedReason().name();
    }

    private static List<FrequencyEntryDTO> toEntries(FrequencyTable table) {
        List<FrequencyEntryDTO> entries = new ArrayList<>(table.alphabetSize());
        for (int symbol = 0; symbol < table.alphabetSize(); symbol++) {
            entries.add(new FrequencyEntryDTO(symbol, table.count(symbol), table.fraction(symbol)));
        }
        return entries;
    }
}
