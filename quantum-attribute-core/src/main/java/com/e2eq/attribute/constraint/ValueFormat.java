package com.e2eq.attribute.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Well known string formats a {@code format} constraint may name.
 */
public enum ValueFormat {
    EMAIL("email") {
        @Override
        public boolean matches(String value) {
            return EMAIL_PATTERN.matcher(value).matches();
        }
    },
    URL("url") {
        @Override
        public boolean matches(String value) {
            try {
                URI uri = new URI(value);
                return uri.isAbsolute() && (uri.getHost() != null || uri.isOpaque());
            } catch (URISyntaxException e) {
                return false;
            }
        }
    },
    PHONE("phone") {
        @Override
        public boolean matches(String value) {
            return PHONE_PATTERN.matcher(value).matches();
        }
    },
    IPV4("ipv4") {
        @Override
        public boolean matches(String value) {
            return IPV4_PATTERN.matcher(value).matches();
        }
    },
    IPV6("ipv6") {
        @Override
        public boolean matches(String value) {
            return IPV6_PATTERN.matcher(value).matches();
        }
    };

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[\\d\\s\\-()]{10,}$");
    private static final Pattern IPV4_PATTERN = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");
    private static final Pattern IPV6_PATTERN = Pattern.compile("^(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$");

    private final String wireName;

    ValueFormat(String wireName) {
        this.wireName = wireName;
    }

    public abstract boolean matches(String value);

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Blank means "no format"; anything else must name a known format.
     */
    @JsonCreator
    public static ValueFormat fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ValueFormat f : values()) {
            if (f.wireName.equals(normalized)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown format '" + value + "'. Valid formats: email, url, phone, ipv4, ipv6");
    }
}
