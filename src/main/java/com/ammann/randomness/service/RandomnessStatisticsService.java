/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.enumeration.UndefinedReason;
import com.ammann.randomness.exception.EmptySampleException;
import com.ammann.randomness.exception.InsufficientSampleException;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.ByteSample;
import com.ammann.randomness.model.ChiSquareResult;
import com.ammann.randomness.model.FrequencyTable;
import com.ammann.randomness.model.Measurement;
import com.ammann.randomness.model.RandomnessResult;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.special.Erf;
import org.jboss.logging.Logger;

/**
 * Statistical engine computing randomness measurements over a byte sample.
 *
 * <p>Implements five independent tests:
 * <ul>
 *   <li>Shannon entropy over the byte or bit alphabet (plus the derived compression estimate)</li>
 *   <li>Chi-square goodness-of-fit against the uniform distribution, with p-value</li>
 *   <li>Arithmetic mean of the byte values</li>
 *   <li>Monte Carlo estimate of pi from 24-bit coordinate pairs</li>
 *   <li>Lag-1 serial correlation coefficient of the byte values</li>
 * </ul>
 *
 * <p>The service holds no state. Every method is a pure function of its arguments and
 * never modifies the sample, so one instance may serve concurrent callers.
 */
@ApplicationScoped
public class RandomnessStatisticsService
{

    private static final Logger LOG = Logger.getLogger(RandomnessStatisticsService.class);

    /** Bytes per Monte Carlo point: three for x, three for y. */
    static final int MONTE_CARLO_GROUP_BYTES = 6;

    /** Squared radius of the quarter circle, (2^24)^2. */
    static final long MONTE_CARLO_RADIUS_SQUARED = 1L << 48;

    private static final double LOG_2 = Math.log(2.0);

    /**
     * Runs every measurement over the same sample.
     *
     * @param sample bytes to analyse (already case-folded if the caller wants that)
     * @param mode sampling granularity for entropy, chi-square and the frequency table
     * @return a new immutable result
     * @throws EmptySampleException if the sample has no bytes
     * @throws InsufficientSampleException if the sample is shorter than one Monte Carlo group
     */
    public RandomnessResult calculate(ByteSample sample, SamplingMode mode)
    {
        validateInput(sample, mode);
        requireMonteCarloGroup(sample);

        long startTime = System.nanoTime();

        FrequencyTable frequencies = countFrequencies(sample, mode);
        double entropy = calculateEntropy(sample, mode);
        double compression = calculateCompression(entropy, mode);
        ChiSquareResult chiSquare = calculateChiSquare(sample, mode);
        double mean = calculateMean(sample);
        double pi = calculatePiEstimate(sample);
        Measurement serialCorrelation = calculateSerialCorrelation(sample);

        LOG.debugf("Randomness measurements for %d bytes (%s mode) computed in %.2fms",
                (Object) sample.length(), mode, (System.nanoTime() - startTime) / 1_000_000.0);

        return new RandomnessResult(
                mode,
                sample.length(),
                frequencies.totalSamples(),
                entropy,
                compression,
                chiSquare.statistic(),
                chiSquare.pValue(),
                chiSquare.exactPValue(),
                mean,
                pi,
                serialCorrelation,
                frequencies
        );
    }

    /**
     * Counts symbol occurrences for the given mode.
     */
    public FrequencyTable countFrequencies(ByteSample sample, SamplingMode mode)
    {
        validateInput(sample, mode);
        return SampleReinterpreter.countFrequencies(sample, mode);
    }

    /**
     * Calculates Shannon entropy in bits per sample.
     *
     * <p>Computes H(X) = -sum(p(x) * log2(p(x))) over symbols with non-zero probability.
     *
     * @param sample bytes to analyse
     * @param mode BYTE for bits per byte, BIT for bits per bit
     * @return entropy in {@code [0, mode.getMaxEntropy()]}
     */
    public double calculateEntropy(ByteSample sample, SamplingMode mode)
    {
        validateInput(sample, mode);

        FrequencyTable table = SampleReinterpreter.countFrequencies(sample, mode);
        double total = table.totalSamples();
        double entropy = 0.0;

        for (int symbol = 0; symbol < table.alphabetSize(); symbol++) {
            long count = table.count(symbol);
            if (count > 0) {
                double probability = count / total;
                entropy -= probability * (Math.log(probability) / LOG_2);
            }
        }

        // -0.0 for a single-symbol sample
        return entropy == 0.0 ? 0.0 : entropy;
    }

    /**
     * Converts an entropy value into the percentage by which an optimal coder could
     * shrink the sample.
     */
    public double calculateCompression(double entropy, SamplingMode mode)
    {
        return 100.0 * (1.0 - entropy / mode.getMaxEntropy());
    }

    /**
     * Calculates the chi-square statistic against a uniform distribution over the
     * mode's alphabet.
     *
     * <p>The approximate p-value maps the statistic to a standard normal deviate
     * {@code z = sqrt(chi - df)} and returns {@code 1 - Phi(z)}. It is undefined when the
     * statistic is below the degrees of freedom. The exact upper tail is always provided.
     */
    public ChiSquareResult calculateChiSquare(ByteSample sample, SamplingMode mode)
    {
        validateInput(sample, mode);

        FrequencyTable table = SampleReinterpreter.countFrequencies(sample, mode);
        double expected = table.totalSamples() / (double) table.alphabetSize();

        double chiSquare = 0.0;
        for (int symbol = 0; symbol < table.alphabetSize(); symbol++) {
            double diff = table.count(symbol) - expected;
            chiSquare += diff * diff / expected;
        }

        int degreesOfFreedom = mode.getDegreesOfFreedom();
        Measurement pValue;
        if (chiSquare < degreesOfFreedom) {
            LOG.debugf("Chi-square %.4f below %d degrees of freedom, normal approximation undefined",
                    chiSquare, degreesOfFreedom);
            pValue = Measurement.undefined(UndefinedReason.INVALID_CHI_SQUARE_TAIL);
        } else {
            double z = Math.sqrt(chiSquare - degreesOfFreedom);
            pValue = Measurement.defined(1.0 - normalCdf(z));
        }

        return new ChiSquareResult(chiSquare, degreesOfFreedom, pValue,
                exactUpperTail(chiSquare, degreesOfFreedom));
    }

    /**
     * Calculates the arithmetic mean of the raw byte values. The result does not depend
     * on the sampling mode.
     */
    public double calculateMean(ByteSample sample)
    {
        requireNonEmpty(sample);

        long sum = 0;
        for (int i = 0; i < sample.length(); i++) {
            sum += sample.unsignedAt(i);
        }
        return sum / (double) sample.length();
    }

    /**
     * Estimates pi from consecutive six-byte groups interpreted as points in the unit
     * square scaled to 2^24. Trailing bytes that do not fill a group are ignored.
     *
     * @return {@code 4 * hits / groups}
     * @throws InsufficientSampleException if fewer than six bytes are available
     */
    public double calculatePiEstimate(ByteSample sample)
    {
        requireNonEmpty(sample);
        requireMonteCarloGroup(sample);

        long groups = countPiGroups(sample.length());
        long hits = 0;

        for (int i = 0; i + MONTE_CARLO_GROUP_BYTES <= sample.length(); i += MONTE_CARLO_GROUP_BYTES) {
            long x = coordinate(sample, i);
            long y = coordinate(sample, i + 3);
            if (isMonteCarloHit(x, y)) {
                hits++;
            }
        }

        return 4.0 * hits / groups;
    }

    /**
     * Number of complete Monte Carlo groups in a sample of {@code byteCount} bytes.
     */
    public static long countPiGroups(long byteCount)
    {
        return byteCount / MONTE_CARLO_GROUP_BYTES;
    }

    /**
     * Returns {@code true} when the point lies strictly inside the quarter circle of
     * radius 2^24. Coordinates must be in {@code [0, 2^24)}.
     */
    public static boolean isMonteCarloHit(long x, long y)
    {
        long distanceSquared = x * x + y * y;
        return distanceSquared < MONTE_CARLO_RADIUS_SQUARED;
    }

    /**
     * Calculates the Pearson correlation between every byte and its predecessor.
     *
     * @return the coefficient, or an undefined measurement when fewer than two bytes are
     *     present or either sequence has zero variance
     */
    public Measurement calculateSerialCorrelation(ByteSample sample)
    {
        requireNonEmpty(sample);

        int length = sample.length();
        if (length < 2) {
            return Measurement.undefined(UndefinedReason.INSUFFICIENT_SAMPLES);
        }

        long sumX = 0;
        long sumY = 0;
        long sumXY = 0;
        long sumX2 = 0;
        long sumY2 = 0;
        boolean xConstant = true;
        boolean yConstant = true;
        int firstX = sample.unsignedAt(0);
        int firstY = sample.unsignedAt(1);

        for (int i = 1; i < length; i++) {
            long x = sample.unsignedAt(i - 1);
            long y = sample.unsignedAt(i);

            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumX2 += x * x;
            sumY2 += y * y;

            xConstant &= x == firstX;
            yConstant &= y == firstY;
        }

        if (xConstant || yConstant) {
            return Measurement.undefined(UndefinedReason.DEGENERATE_VARIANCE);
        }

        double n = length - 1;
        double numerator = n * sumXY - (double) sumX * sumY;
        double denominator = Math.sqrt(
                (n * sumX2 - (double) sumX * sumX) * (n * sumY2 - (double) sumY * sumY));

        if (!(denominator > 0.0)) {
            LOG.warnf("Serial correlation denominator collapsed to %s for %d bytes", denominator, length);
            return Measurement.undefined(UndefinedReason.DEGENERATE_VARIANCE);
        }

        return Measurement.defined(numerator / denominator);
    }

    /** Standard normal CDF, Phi(x) = 0.5 * erfc(-x / sqrt(2)). */
    static double normalCdf(double x)
    {
        return 0.5 * Erf.erfc(-x / Math.sqrt(2.0));
    }

    private static double exactUpperTail(double chiSquare, int degreesOfFreedom)
    {
        ChiSquaredDistribution distribution = new ChiSquaredDistribution(degreesOfFreedom);
        return 1.0 - distribution.cumulativeProbability(chiSquare);
    }

    /** Packs three bytes big-endian into a 24-bit unsigned coordinate. */
    private static long coordinate(ByteSample sample, int offset)
    {
        return ((long) sample.unsignedAt(offset) << 16)
                | ((long) sample.unsignedAt(offset + 1) << 8)
                | sample.unsignedAt(offset + 2);
    }

    private void validateInput(ByteSample sample, SamplingMode mode)
    {
        if (mode == null) {
            throw ValidationException.invalidParameter("mode", null, "BYTE or BIT");
        }
        requireNonEmpty(sample);
    }

    private void requireNonEmpty(ByteSample sample)
    {
        if (sample == null) {
            throw ValidationException.invalidParameter("sample", null, "non-null byte sample");
        }
        if (sample.isEmpty()) {
            throw new EmptySampleException();
        }
    }

    private void requireMonteCarloGroup(ByteSample sample)
    {
        if (sample.length() < MONTE_CARLO_GROUP_BYTES) {
            throw new InsufficientSampleException(MONTE_CARLO_GROUP_BYTES, sample.length());
        }
    }
}
