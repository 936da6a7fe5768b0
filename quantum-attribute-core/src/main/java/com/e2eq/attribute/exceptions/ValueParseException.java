package com.e2eq.attribute.exceptions;

import com.e2eq.attribute.value.ParseError;

import java.util.List;

/**
 * Permitted-value text does not parse for the declared data type.
 */
public class ValueParseException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    private final transient ParseError parseError;

    public ValueParseException(ParseError parseError) {
        super(ErrorCode.PARSE_ERROR, "Permitted values could not be parsed: " + parseError.message(),
                List.of(parseError.message()));
        this.parseError = parseError;
    }

    public ParseError getParseError() {
        return parseError;
    }
}
