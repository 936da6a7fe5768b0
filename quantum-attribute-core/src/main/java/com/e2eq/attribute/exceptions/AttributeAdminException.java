package com.e2eq.attribute.exceptions;

import java.util.List;

/**
 * Base of every error the attribute administration API reports to its callers. Unchecked: the
 * repository surfaces these untranslated and the REST layer maps them by {@link #getCode()}.
 */
public abstract class AttributeAdminException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final List<String> details;

    protected AttributeAdminException(ErrorCode code, String message, List<String> details) {
        super(message);
        this.code = code;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    protected AttributeAdminException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = List.of();
    }

    public ErrorCode getCode() {
        return code;
    }

    public List<String> getDetails() {
        return details;
    }
}
