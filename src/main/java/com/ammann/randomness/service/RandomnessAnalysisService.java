/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.AnalysisOptions;
import com.ammann.randomness.model.ByteSample;
import com.ammann.randomness.model.RandomnessResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Runs a complete randomness analysis for one sample.
 *
 * <p>Applies the optional case folding requested by the caller, delegates every
 * measurement to {@link RandomnessStatisticsService}, and records how many analyses and
 * bytes were processed.
 */
@ApplicationScoped
public class RandomnessAnalysisService {

    private static final Logger LOG = Logger.getLogger(RandomnessAnalysisService.class);

    @Inject
    RandomnessStatisticsService statisticsService;

    @Inject
    MeterRegistry meterRegistry;

    private Counter analysesCounter;
    private Counter bytesAnalyzedCounter;

    public RandomnessAnalysisService() {}

    public RandomnessAnalysisService(RandomnessStatisticsService statisticsService, MeterRegistry meterRegistry) {
        this.statisticsService = statisticsService;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    @PostConstruct
    void initMetrics() {
        // Safe without a registry (plain unit tests)
        if (meterRegistry == null) {
            return;
        }
        analysesCounter = Counter.builder("randomness.analyses")
                .description("Number of completed randomness analyses")
                .register(meterRegistry);
        bytesAnalyzedCounter = Counter.builder("randomness.bytes.analyzed")
                .description("Number of bytes passed through the statistical engine")
                .baseUnit("bytes")
                .register(meterRegistry);
    }

    /**
     * Analyses a sample.
     *
     * @param sample raw bytes as loaded
     * @param options sampling mode and case-folding flag
     * @return immutable result computed from the (possibly folded) sample
     */
    public RandomnessResult analyze(ByteSample sample, AnalysisOptions options) {
        if (options == null) {
            throw ValidationException.invalidParameter("options", null, "analysis options");
        }
        if (sample == null) {
            throw ValidationException.invalidParameter("sample", null, "non-null byte sample");
        }

        ByteSample effective = options.foldCase() ? sample.foldCase() : sample;
        RandomnessResult result = statisticsService.calculate(effective, options.mode());

        increment(analysesCounter, 1);
        increment(bytesAnalyzedCounter, effective.length());

        LOG.infof("Analysed %d bytes (%s mode, foldCase=%s): entropy=%.6f, chi2=%.2f, mean=%.4f, pi=%.6f, serial=%s",
                effective.length(), options.mode(), options.foldCase(), result.entropy(), result.chiSquare(),
                result.mean(), result.piEstimate(), result.serialCorrelation());

        return result;
    }

    private static void increment(Counter counter, double amount) {
        if (counter != null) {
            counter.increment(amount);
        }
    }
}
