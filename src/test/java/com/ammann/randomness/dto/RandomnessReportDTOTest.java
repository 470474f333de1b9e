/* (C)2026 */
package com.ammann.randomness.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.model.RandomnessResult;
import com.ammann.randomness.service.RandomnessStatisticsService;
import com.ammann.randomness.support.SampleFixtures;
import org.junit.jupiter.api.Test;

class RandomnessReportDTOTest {

    private final RandomnessStatisticsService service = new RandomnessStatisticsService();

    @Test
    void undefinedMeasurementsBecomeAbsentValuesWithReasons() {
        RandomnessResult result = service.calculate(SampleFixtures.constant(64, 0x20), SamplingMode.BYTE);

        RandomnessReportDTO dto = RandomnessReportDTO.from(result, false);

        assertThat(dto.serialCorrelation()).isNull();
        assertThat(dto.serialCorrelationUndefinedReason()).isEqualTo("DEGENERATE_VARIANCE");
        assertThat(dto.pValue()).isNotNull();
        assertThat(dto.pValueUndefinedReason()).isNull();
        assertThat(dto.frequencies()).isNull();
    }

    @Test
    void copiesEveryMeasurement() {
        RandomnessResult result = service.calculate(SampleFixtures.cyclic(2048), SamplingMode.BIT);

        RandomnessReportDTO dto = RandomnessReportDTO.from(result, true);

        assertThat(dto.mode()).isEqualTo("BIT");
        assertThat(dto.byteCount()).isEqualTo(2048L);
        assertThat(dto.sampleCount()).isEqualTo(8L * 2048);
        assertThat(dto.entropy()).isEqualTo(result.entropy());
        assertThat(dto.compressionPercent()).isEqualTo(result.compression());
        assertThat(dto.chiSquare()).isEqualTo(result.chiSquare());
        assertThat(dto.pValue()).isNull();
        assertThat(dto.pValueUndefinedReason()).isEqualTo("INVALID_CHI_SQUARE_TAIL");
        assertThat(dto.exactPValue()).isEqualTo(result.exactPValue());
        assertThat(dto.mean()).isEqualTo(127.5);
        assertThat(dto.piEstimate()).isEqualTo(result.piEstimate());
        assertThat(dto.piErrorPercent()).isEqualTo(result.piErrorPercent());
        assertThat(dto.serialCorrelation()).isEqualTo(result.serialCorrelation().value());
        assertThat(dto.frequencies()).hasSize(2);
        assertThat(dto.frequencies().get(1).occurrences()).isEqualTo(8L * 1024);
        assertThat(dto.frequencies().get(1).fraction()).isEqualTo(0.5);
    }
}
