package com.e2eq.attribute.rest.exceptions;

import com.e2eq.attribute.exceptions.ErrorCode;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bean Validation failures on request bodies and parameters.
 */
@Provider
public class ConstraintViolationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Request failed bean validation");

        List<String> violations = exception.getConstraintViolations().stream()
                .map(violation -> leafOf(violation.getPropertyPath().toString()) + " " + violation.getMessage())
                .sorted()
                .collect(Collectors.toList());

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(ErrorCode.VALIDATION_ERROR, "Validation failed", violations))
                .build();
    }

    /**
     * "bulkDelete.request.attributeIds" becomes "attributeIds".
     */
    static String leafOf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }
}
