package com.e2eq.attribute.rest.exceptions;

import com.e2eq.attribute.exceptions.ErrorCode;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Keeps the status JAX-RS chose (unknown URL, wrong method, unsupported media type) and wraps it in
 * the error envelope.
 */
@Provider
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

    @Override
    public Response toResponse(WebApplicationException exception) {
        int status = exception.getResponse() == null ? 500 : exception.getResponse().getStatus();
        ErrorCode code;
        if (status == Response.Status.NOT_FOUND.getStatusCode()) {
            code = ErrorCode.NOT_FOUND;
        } else if (status >= 500) {
            code = ErrorCode.INTERNAL_ERROR;
        } else {
            code = ErrorCode.VALIDATION_ERROR;
        }

        if (status >= 500) {
            ExceptionLoggingUtils.logError(exception, "Request failed with status %d", status);
        } else {
            ExceptionLoggingUtils.logDebug(exception, "Request rejected with status %d", status);
        }

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(code, exception.getMessage(), null))
                .build();
    }
}
