package com.e2eq.attribute.exceptions;

import java.util.List;

public class AttributeConflictException extends AttributeAdminException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        DUPLICATE_NAME,
        IN_USE,
        STALE_REVISION
    }

    private final Reason reason;

    public AttributeConflictException(Reason reason, String message) {
        this(reason, message, List.of());
    }

    public AttributeConflictException(Reason reason, String message, List<String> details) {
        super(ErrorCode.CONFLICT, message, details);
        this.reason = reason;
    }

    public static AttributeConflictException staleRevision(String id, long expected) {
        return new AttributeConflictException(Reason.STALE_REVISION,
                String.format("Attribute %s was modified concurrently (expected revision %d); reload and retry", id, expected));
    }

    public Reason getReason() {
        return reason;
    }
}
