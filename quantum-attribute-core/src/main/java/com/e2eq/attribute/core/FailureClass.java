package com.e2eq.attribute.core;

/**
 * Why one item of a bulk operation failed. Declaration order is reporting precedence: when a bulk
 * run fails for several reasons, the first class present decides the status reported for the run.
 */
public enum FailureClass {
    FORBIDDEN,
    CONFLICT,
    NOT_FOUND,
    OTHER
}
