/* (C)2026 */
package com.ammann.randomness.resource;

import com.ammann.randomness.dto.ErrorResponseDTO;
import com.ammann.randomness.dto.RandomnessReportDTO;
import com.ammann.randomness.enumeration.ReportFormat;
import com.ammann.randomness.enumeration.SamplingMode;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.AnalysisOptions;
import com.ammann.randomness.model.ByteSample;
import com.ammann.randomness.model.RandomnessResult;
import com.ammann.randomness.properties.ApiProperties;
import com.ammann.randomness.service.RandomnessAnalysisService;
import com.ammann.randomness.service.ReportFormatterService;
import com.ammann.randomness.service.SampleLoaderService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.InputStream;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for randomness analysis of byte samples.
 *
 * <p>Samples are supplied either as a raw {@code application/octet-stream} request body
 * or as a file below the configured sample directory. Results are returned as JSON or
 * rendered as a verbose or terse text report.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Randomness API", description = "Entropy, chi-square, mean, Monte Carlo pi and serial correlation of byte samples")
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    RandomnessAnalysisService analysisService;

    @Inject
    SampleLoaderService sampleLoaderService;

    @Inject
    ReportFormatterService reportFormatterService;

    @POST
    @Path(ApiProperties.Analysis.BASE)
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Analyse Byte Sample",
            description = "Computes entropy, chi-square, arithmetic mean, Monte Carlo pi and serial correlation of the request body"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(implementation = RandomnessReportDTO.class))),
            @APIResponse(responseCode = "400", description = "Empty or too short sample, or invalid parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class))),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response analyze(
            InputStream body,
            @Parameter(description = "Sampling mode: byte (default) or bit")
            @QueryParam("mode") @DefaultValue("byte") String mode,
            @Parameter(description = "Fold ASCII upper-case letters to lower case before analysis")
            @QueryParam("foldCase") @DefaultValue("false") boolean foldCase,
            @Parameter(description = "Include the symbol frequency table")
            @QueryParam("includeTable") @DefaultValue("false") boolean includeTable) {

        AnalysisOptions options = new AnalysisOptions(parseMode(mode), foldCase);
        LOG.debugf("Analysis request: mode=%s, foldCase=%s, includeTable=%s", options.mode(), foldCase, includeTable);

        ByteSample sample = sampleLoaderService.load(body);
        RandomnessResult result = analysisService.analyze(sample, options);

        return Response.ok(RandomnessReportDTO.from(result, includeTable)).build();
    }

    @POST
    @Path(ApiProperties.Analysis.REPORT)
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Render Text Report",
            description = "Analyses the request body and renders the result as a verbose report or terse CSV-like records"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Report rendered"),
            @APIResponse(responseCode = "400", description = "Empty or too short sample, or invalid parameters"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response report(
            InputStream body,
            @Parameter(description = "Sampling mode: byte (default) or bit")
            @QueryParam("mode") @DefaultValue("byte") String mode,
            @Parameter(description = "Fold ASCII upper-case letters to lower case before analysis")
            @QueryParam("foldCase") @DefaultValue("false") boolean foldCase,
            @Parameter(description = "Report style: verbose (default) or terse")
            @QueryParam("format") @DefaultValue("verbose") String format,
            @Parameter(description = "Include the symbol frequency table")
            @QueryParam("includeTable") @DefaultValue("false") boolean includeTable) {

        AnalysisOptions options = new AnalysisOptions(parseMode(mode), foldCase);
        ReportFormat reportFormat = parseFormat(format);
        LOG.debugf("Report request: mode=%s, foldCase=%s, format=%s, includeTable=%s",
                options.mode(), foldCase, reportFormat, includeTable);

        ByteSample sample = sampleLoaderService.load(body);
        RandomnessResult result = analysisService.analyze(sample, options);

        String text = reportFormatterService.format(result, reportFormat, includeTable);
        return Response.ok(text, MediaType.TEXT_PLAIN_TYPE).build();
    }

    @GET
    @Path(ApiProperties.Analysis.FILE)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Analyse Sample File",
            description = "Analyses a file located below the configured sample directory"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(implementation = RandomnessReportDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid path, empty or too short sample"),
            @APIResponse(responseCode = "404", description = "Sample file not found"),
            @APIResponse(responseCode = "500", description = "Sample file could not be read")
    })
    public Response analyzeFile(
            @Parameter(description = "File path relative to the sample directory", required = true)
            @QueryParam("path") String path,
            @Parameter(description = "Sampling mode: byte (default) or bit")
            @QueryParam("mode") @DefaultValue("byte") String mode,
            @Parameter(description = "Fold ASCII upper-case letters to lower case before analysis")
            @QueryParam("foldCase") @DefaultValue("false") boolean foldCase,
            @Parameter(description = "Include the symbol frequency table")
            @QueryParam("includeTable") @DefaultValue("false") boolean includeTable) {

        AnalysisOptions options = new AnalysisOptions(parseMode(mode), foldCase);
        java.nio.file.Path file = sampleLoaderService.resolve(path);
        LOG.debugf("File analysis request: file=%s, mode=%s, foldCase=%s", file, options.mode(), foldCase);

        ByteSample sample = sampleLoaderService.load(file);
        RandomnessResult result = analysisService.analyze(sample, options);

        LOG.infof("File %s analysed: entropy=%.6f bits per %s", path, result.entropy(), options.mode().getUnit());
        return Response.ok(RandomnessReportDTO.from(result, includeTable)).build();
    }

    private static SamplingMode parseMode(String mode) {
        try {
            return SamplingMode.fromString(mode);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("mode", mode, "byte or bit");
        }
    }

    private static ReportFormat parseFormat(String format) {
        try {
            return ReportFormat.fromString(format);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("format", format, "verbose or terse");
        }
    }
}
