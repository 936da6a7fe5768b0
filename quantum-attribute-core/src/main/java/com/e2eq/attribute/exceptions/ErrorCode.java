package com.e2eq.attribute.exceptions;

public enum ErrorCode {
    VALIDATION_ERROR,
    PARSE_ERROR,
    CONSTRAINT_VIOLATION,
    CONFLICT,
    FORBIDDEN,
    NOT_FOUND,
    INTERNAL_ERROR
}
