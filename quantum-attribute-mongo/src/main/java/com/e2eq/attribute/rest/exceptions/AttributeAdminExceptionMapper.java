package com.e2eq.attribute.rest.exceptions;

import com.e2eq.attribute.exceptions.AttributeAdminException;
import com.e2eq.attribute.exceptions.ValueConstraintException;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps the attribute error taxonomy to HTTP status codes and the error envelope.
 */
@Provider
public class AttributeAdminExceptionMapper implements ExceptionMapper<AttributeAdminException> {

    @Override
    public Response toResponse(AttributeAdminException exception) {
        Response.Status status = statusFor(exception);
        ExceptionLoggingUtils.logByCode(exception, "Attribute request failed with " + status.getStatusCode());

        String message = status == Response.Status.INTERNAL_SERVER_ERROR
                ? "Internal server error: " + exception.getMessage()
                : exception.getMessage();
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(exception.getCode(), message, exception.getDetails()))
                .build();
    }

    static Response.Status statusFor(AttributeAdminException exception) {
        switch (exception.getCode()) {
            case VALIDATION_ERROR:
            case PARSE_ERROR:
                return Response.Status.BAD_REQUEST;
            case CONSTRAINT_VIOLATION:
                // usage rule violations: the request is valid, the attribute state refuses it
                if (exception instanceof ValueConstraintException
                        && ((ValueConstraintException) exception).getViolation() != null
                        && ((ValueConstraintException) exception).getViolation().which().isUsageRule()) {
                    return Response.Status.CONFLICT;
                }
                return Response.Status.BAD_REQUEST;
            case CONFLICT:
                return Response.Status.CONFLICT;
            case FORBIDDEN:
                return Response.Status.FORBIDDEN;
            case NOT_FOUND:
                return Response.Status.NOT_FOUND;
            default:
                return Response.Status.INTERNAL_SERVER_ERROR;
        }
    }
}
