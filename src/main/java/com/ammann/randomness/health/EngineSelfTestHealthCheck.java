/* (C)2026 */
package com.ammann.randomness.health;

import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.model.ByteSample;
import com.ammann.randomness.model.RandomnessResult;
import com.ammann.randomness.service.RandomnessStatisticsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that runs the statistical engine on a known vector.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: a cyclic 0..255 sample yields 8 bits of entropy and a chi-square of zero</li>
 *   <li>DOWN: the engine returned anything else or failed</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class EngineSelfTestHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(EngineSelfTestHealthCheck.class);

    static final String NAME = "randomness-engine-self-test";
    private static final int VECTOR_LENGTH = 4096;
    private static final double TOLERANCE = 1e-9;

    @Inject RandomnessStatisticsService statisticsService;

    @Override
    public HealthCheckResponse call() {
        try {
            RandomnessResult result = statisticsService.calculate(referenceVector(), SamplingMode.BYTE);
            boolean healthy = Math.abs(result.entropy() - 8.0) < TOLERANCE
                    && Math.abs(result.chiSquare()) < TOLERANCE;

            return HealthCheckResponse.named(NAME)
                    .status(healthy)
                    .withData("entropy", String.valueOf(result.entropy()))
                    .withData("chi-square", String.valueOf(result.chiSquare()))
                    .withData("status", healthy ? "PASSED" : "MISMATCH")
                    .build();
        } catch (RuntimeException e) {
            LOG.error("Engine self-test failed", e);
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("status", "FAILED")
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }

    static ByteSample referenceVector() {
        byte[] bytes = new byte[VECTOR_LENGTH];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        return ByteSample.of(bytes);
    }
}
