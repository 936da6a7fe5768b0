package com.e2eq.attribute.rest.exceptions;

import com.e2eq.attribute.exceptions.ErrorCode;
import com.e2eq.attribute.rest.models.ApiResponse;
import com.e2eq.attribute.util.ExceptionLoggingUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Request bodies that are not valid JSON or carry unknown enum names (data type, category, format).
 */
@Provider
public class JsonProcessingExceptionMapper implements ExceptionMapper<JsonProcessingException> {

    @Override
    public Response toResponse(JsonProcessingException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Unreadable request body");

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(ErrorCode.VALIDATION_ERROR, messageOf(exception), null))
                .build();
    }

    static String messageOf(JsonProcessingException exception) {
        Throwable root = exception;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof IllegalArgumentException && root.getMessage() != null) {
            return root.getMessage();
        }
        return "Malformed request body: " + exception.getOriginalMessage();
    }
}
