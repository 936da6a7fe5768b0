package com.e2eq.attribute.core;

import java.util.regex.Pattern;

/**
 * Field limits applied on create and update.
 */
public record AttributeLimits(int nameMaxLength, int descriptionMaxLength, Pattern namePattern, int pageMaxLimit) {

    public static final String DEFAULT_NAME_PATTERN = "^[A-Za-z][A-Za-z0-9_.\\-]*$";

    public static AttributeLimits defaults() {
        return new AttributeLimits(100, 500, Pattern.compile(DEFAULT_NAME_PATTERN), 100);
    }
}
