package com.e2eq.attribute.rest.exceptions;

import com.e2eq.attribute.exceptions.ErrorCode;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class UncaughtExceptionMapper implements ExceptionMapper<Exception> {

    @Override
    public Response toResponse(Exception exception) {
        ExceptionLoggingUtils.logError(exception, "An unexpected / uncaught exception occurred");

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(ErrorCode.INTERNAL_ERROR,
                        "Internal server error: " + (exception.getMessage() == null
                                ? exception.getClass().getSimpleName()
                                : exception.getMessage()),
                        null))
                .build();
    }
}
