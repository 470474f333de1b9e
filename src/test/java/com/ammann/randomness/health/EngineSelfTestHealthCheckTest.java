/* (C)2026 */
package com.ammann.randomness.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.randomness.service.RandomnessStatisticsService;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EngineSelfTestHealthCheck")
class EngineSelfTestHealthCheckTest {

    @Test
    @DisplayName("should report UP for a correct engine")
    void shouldReportUpForCorrectEngine() {
        EngineSelfTestHealthCheck check = new EngineSelfTestHealthCheck();
        check.statisticsService = new RandomnessStatisticsService();

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("randomness-engine-self-test");
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsEntry("status", "PASSED"));
    }

    @Test
    @DisplayName("should report DOWN when the engine fails")
    void shouldReportDownWhenEngineFails() {
        RandomnessStatisticsService engine = mock(RandomnessStatisticsService.class);
        when(engine.calculate(any(), any())).thenThrow(new IllegalStateException("broken"));
        EngineSelfTestHealthCheck check = new EngineSelfTestHealthCheck();
        check.statisticsService = engine;

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsEntry("error", "broken"));
    }

    @Test
    @DisplayName("should use a uniform reference vector")
    void shouldUseUniformReferenceVector() {
        assertThat(EngineSelfTestHealthCheck.referenceVector().length()).isEqualTo(4096);
        assertThat(EngineSelfTestHealthCheck.referenceVector().unsignedAt(255)).isEqualTo(255);
        assertThat(EngineSelfTestHealthCheck.referenceVector().unsignedAt(256)).isZero();
    }
}
