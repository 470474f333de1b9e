package com.ammann.randomness.exception;

import com.ammann.randomness.dto.ErrorResponseDTO;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Handles empty and undersized samples, validation failures, missing or unreadable
 * sample files, and generic internal errors. Unhandled exceptions are logged at ERROR
 * level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof EmptySampleException) {
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage(), "EMPTY_INPUT", path);
        }

        if (exception instanceof InsufficientSampleException) {
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage(), "INSUFFICIENT_SAMPLE", path);
        }

        if (exception instanceof ValidationException) {
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage(), "VALIDATION_ERROR", path);
        }

        if (exception instanceof SampleNotFoundException || exception instanceof NotFoundException) {
            return createResponse(Response.Status.NOT_FOUND, exception.getMessage(), "NOT_FOUND", path);
        }

        if (exception instanceof SampleLoadException) {
            LOG.warnf("Sample load failed for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "SAMPLE_LOAD_ERROR",
                    path
            );
        }

        if (exception instanceof WebApplicationException webException) {
            Response.StatusType status = webException.getResponse().getStatusInfo();
            LOG.debugf("Request to %s rejected with %d: %s", path, status.getStatusCode(), exception.getMessage());
            return Response.status(status)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponseDTO(exception.getMessage(), "HTTP_ERROR", path, status.getStatusCode()))
                    .build();
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponseDTO errorResponse = new ErrorResponseDTO(message, code, path, status.getStatusCode());
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(errorResponse).build();
    }
}
