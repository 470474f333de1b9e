/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.ReportFormat;
import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.model.FrequencyTable;
import com.ammann.randomness.model.RandomnessResult;
import jakarta.enterprise.context.ApplicationScoped;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 * Renders analysis results as plain text.
 *
 * <p>Two styles are supported:
 * <ul>
 *   <li>Verbose: a human-readable report, optionally preceded by the frequency table</li>
 *   <li>Terse: CSV-like lines prefixed with a record marker; {@code 0,} header and
 *       {@code 1,} values for the summary, {@code 2,} header and {@code 3,} rows for the table</li>
 * </ul>
 */
@ApplicationScoped
public class ReportFormatterService {

    private static final double P_VALUE_LOWER_BOUND = 0.0001;
    private static final double P_VALUE_UPPER_BOUND = 0.9999;
    private static final MathContext TERSE_PRECISION = new MathContext(6);

    /**
     * Renders a result in the requested style.
     *
     * @param result analysis result
     * @param format verbose or terse
     * @param includeTable also render the frequency table
     * @return rendered text, newline-terminated
     */
    public String format(RandomnessResult result, ReportFormat format, boolean includeTable) {
        StringBuilder out = new StringBuilder();
        if (format == ReportFormat.TERSE) {
            out.append(formatTerse(result));
            if (includeTable) {
                out.append(formatTerseTable(result));
            }
        } else {
            if (includeTable) {
                out.append(formatVerboseTable(result));
            }
            out.append(formatVerbose(result));
        }
        return out.toString();
    }

    /** Human-readable summary of all measurements. */
    public String formatVerbose(RandomnessResult result) {
        String unit = result.mode().getUnit();
        StringBuilder out = new StringBuilder();

        out.append(String.format(Locale.ROOT, "Entropy = %f bits per %s.\n\n", result.entropy(), unit));

        out.append(String.format(Locale.ROOT,
                "Optimum compression would reduce the size\nof this %d %s file by %d percent.\n\n",
                result.sampleCount(), unit, (int) result.compression()));

        out.append(String.format(Locale.ROOT,
                "Chi square distribution for %d samples is %f, and randomly\n",
                result.sampleCount(), result.chiSquare()));

        double pValue = result.reportedPValue();
        if (pValue < P_VALUE_LOWER_BOUND) {
            out.append("would exceed this value less than 0.01 percent of the times.\n\n");
        } else if (pValue > P_VALUE_UPPER_BOUND) {
            out.append("would exceed this value more than 99.99 percent of the times.\n\n");
        } else {
            out.append(String.format(Locale.ROOT,
                    "would exceed this value %f percent of the times.\n\n", pValue * 100.0));
        }

        out.append(String.format(Locale.ROOT,
                "Arithmetic mean value of data bytes is %f (%s = random).\n",
                result.mean(), terseNumber(result.mode().getReferenceMean())));

        out.append(String.format(Locale.ROOT,
                "Monte Carlo value for Pi is %f (error %f percent).\n",
                result.piEstimate(), result.piErrorPercent()));

        out.append("Serial correlation coefficient is ");
        if (result.serialCorrelation().isDefined()) {
            out.append(String.format(Locale.ROOT,
                    "%f (totally uncorrelated = 0.0).\n", result.serialCorrelation().value()));
        } else {
            out.append(String.format("undefined (%s!).\n",
                    result.serialCorrelation().undefinedReason().getDescription()));
        }

        return out.toString();
    }

    /** One line per symbol with its occurrences and share of the sample. */
    public String formatVerboseTable(RandomnessResult result) {
        FrequencyTable table = result.frequencies();
        boolean byteMode = table.mode() == SamplingMode.BYTE;
        StringBuilder out = new StringBuilder();

        for (int symbol = 0; symbol < table.alphabetSize(); symbol++) {
            out.append("Value: ").append(symbol);
            if (byteMode) {
                out.append(" Char: ").append(printable(symbol));
            }
            out.append(" Occurrences: ").append(table.count(symbol))
                    .append(" Fraction: ").append(terseNumber(table.fraction(symbol)))
                    .append('\n');
        }

        out.append('\n').append("Total: ").append(table.totalSamples()).append(" 1.0\n\n");
        return out.toString();
    }

    /** Summary as a {@code 0,} header line followed by a {@code 1,} value line. */
    public String formatTerse(RandomnessResult result) {
        String serial = result.serialCorrelation().isDefined()
                ? terseNumber(result.serialCorrelation().value())
                : "undefined";

        return "0,File-" + result.mode().getUnit() + "s,Entropy,Chi-square,Mean,Monte-Carlo-Pi,Serial-Correlation\n"
                + "1," + result.sampleCount()
                + "," + terseNumber(result.entropy())
                + "," + terseNumber(result.chiSquare())
                + "," + terseNumber(result.mean())
                + "," + terseNumber(result.piEstimate())
                + "," + serial + "\n";
    }

    /** Frequency table as a {@code 2,} header line followed by one {@code 3,} row per symbol. */
    public String formatTerseTable(RandomnessResult result) {
        FrequencyTable table = result.frequencies();
        StringBuilder out = new StringBuilder("2,Value,Occurrences,Fraction\n");
        for (int symbol = 0; symbol < table.alphabetSize(); symbol++) {
            out.append("3,").append(symbol)
                    .append(',').append(table.count(symbol))
                    .append(',').append(terseNumber(table.fraction(symbol)))
                    .append('\n');
        }
        return out.toString();
    }

    /**
     * Six significant digits without trailing zeros, e.g. {@code 8}, {@code 127.5},
     * {@code 0.00390625}.
     */
    static String terseNumber(double value) {
        if (value == 0.0) {
            return "0";
        }
        return new BigDecimal(value).round(TERSE_PRECISION).stripTrailingZeros().toPlainString();
    }

    private static char printable(int symbol) {
        return symbol >= 0x20 && symbol < 0x7F ? (char) symbol : ' ';
    }
}
