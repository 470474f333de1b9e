/* (C)2026 */
package com.ammann.randomness.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.randomness.dto.RandomnessReportDTO;
import com.ammann.randomness.exception.EmptySampleException;
import com.ammann.randomness.exception.InsufficientSampleException;
import com.ammann.randomness.exception.SampleNotFoundException;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.service.RandomnessAnalysisService;
import com.ammann.randomness.service.RandomnessStatisticsService;
import com.ammann.randomness.service.ReportFormatterService;
import com.ammann.randomness.service.SampleLoaderService;
import com.ammann.randomness.support.SampleFixtures;
import jakarta.ws.rs.core.Response;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisResourceTest {

    @TempDir
    Path sampleDir;

    @Test
    void analyzeReturnsDtoForCyclicBody() {
        AnalysisResource resource = buildResource();

        Response response = resource.analyze(stream(SampleFixtures.cyclicBytes(4096)), "byte", false, false);

        assertThat(response.getStatus()).isEqualTo(200);
        RandomnessReportDTO dto = (RandomnessReportDTO) response.getEntity();
        assertThat(dto.mode()).isEqualTo("BYTE");
        assertThat(dto.byteCount()).isEqualTo(4096L);
        assertThat(dto.entropy()).isEqualTo(8.0);
        assertThat(dto.chiSquare()).isZero();
        assertThat(dto.mean()).isEqualTo(127.5);
        assertThat(dto.frequencies()).isNull();
    }

    @Test
    void analyzeIncludesTableWhenRequested() {
        AnalysisResource resource = buildResource();

        Response response = resource.analyze(stream(SampleFixtures.cyclicBytes(512)), "BIT", false, true);

        RandomnessReportDTO dto = (RandomnessReportDTO) response.getEntity();
        assertThat(dto.mode()).isEqualTo("BIT");
        assertThat(dto.sampleCount()).isEqualTo(4096L);
        assertThat(dto.frequencies()).hasSize(2);
    }

    @Test
    void analyzeFoldsCaseWhenRequested() {
        AnalysisResource resource = buildResource();
        byte[] text = "AbCdEfGhIj".getBytes(StandardCharsets.US_ASCII);

        RandomnessReportDTO folded =
                (RandomnessReportDTO) resource.analyze(stream(text), "byte", true, false).getEntity();
        RandomnessReportDTO lower = (RandomnessReportDTO) resource
                .analyze(stream("abcdefghij".getBytes(StandardCharsets.US_ASCII)), "byte", false, false)
                .getEntity();

        assertThat(folded).isEqualTo(lower);
    }

    @Test
    void analyzeRejectsUnknownMode() {
        AnalysisResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyze(stream(new byte[16]), "nibble", false, false))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mode");
    }

    @Test
    void analyzeRejectsEmptyAndShortBodies() {
        AnalysisResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyze(stream(new byte[0]), "byte", false, false))
                .isInstanceOf(EmptySampleException.class);
        assertThatThrownBy(() -> resource.analyze(stream(new byte[5]), "byte", false, false))
                .isInstanceOf(InsufficientSampleException.class);
    }

    @Test
    void reportRendersTerseRecords() {
        AnalysisResource resource = buildResource();

        Response response = resource.report(stream(SampleFixtures.cyclicBytes(4096)), "byte", false, "terse", false);

        String text = (String) response.getEntity();
        assertThat(text).startsWith("0,File-bytes,Entropy,Chi-square,Mean,Monte-Carlo-Pi,Serial-Correlation\n");
        assertThat(text).contains("\n1,4096,8,0,127.5,");
    }

    @Test
    void reportRendersVerboseText() {
        AnalysisResource resource = buildResource();

        Response response = resource.report(stream(SampleFixtures.cyclicBytes(4096)), "byte", false, "verbose", false);

        assertThat((String) response.getEntity())
                .startsWith("Entropy = 8.000000 bits per byte.")
                .contains("Arithmetic mean value of data bytes is 127.500000 (127.5 = random).");
    }

    @Test
    void reportRejectsUnknownFormat() {
        AnalysisResource resource = buildResource();

        assertThatThrownBy(() -> resource.report(stream(new byte[16]), "byte", false, "xml", false))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("format");
    }

    @Test
    void analyzeFileReadsSampleBelowBaseDirectory() throws IOException {
        Files.write(sampleDir.resolve("cyclic.bin"), SampleFixtures.cyclicBytes(1024));
        AnalysisResource resource = buildResource();

        Response response = resource.analyzeFile("cyclic.bin", "byte", false, false);

        RandomnessReportDTO dto = (RandomnessReportDTO) response.getEntity();
        assertThat(dto.byteCount()).isEqualTo(1024L);
        assertThat(dto.entropy()).isEqualTo(8.0);
    }

    @Test
    void analyzeFileReportsMissingFile() {
        AnalysisResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeFile("missing.bin", "byte", false, false))
                .isInstanceOf(SampleNotFoundException.class);
    }

    @Test
    void analyzeFileRejectsPathsOutsideBaseDirectory() {
        AnalysisResource resource = buildResource();

        assertThatThrownBy(() -> resource.analyzeFile("../secret.bin", "byte", false, false))
                .isInstanceOf(ValidationException.class);
    }

    private AnalysisResource buildResource() {
        AnalysisResource resource = new AnalysisResource();
        resource.analysisService = new RandomnessAnalysisService(new RandomnessStatisticsService(), null);
        resource.sampleLoaderService = new SampleLoaderService(1024 * 1024, sampleDir.toString());
        resource.reportFormatterService = new ReportFormatterService();
        return resource;
    }

    private static ByteArrayInputStream stream(byte[] bytes) {
        return new ByteArrayInputStream(bytes);
    }
}
