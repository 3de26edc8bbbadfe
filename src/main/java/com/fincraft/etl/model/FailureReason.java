package com.fincraft.etl.model;

import java.util.Locale;

public enum FailureReason {
    NONE("none"),
    TIMEOUT("timeout"),
    RATE_LIMIT("rate_limit"),
    TRANSPORT("transport"),
    HTTP_STATUS("http_status"),
    UPSTREAM_ERROR("upstream_error"),
    VALIDATION("validation"),
    PARSE_ERROR("parse_error"),
    INTERRUPTED("interrupted"),
    OTHER("other");

    private final String label;

    FailureReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public ErrorClass errorClass() {
        switch (this) {
            case NONE:
                return null;
            case UPSTREAM_ERROR:
            case VALIDATION:
            case PARSE_ERROR:
                return ErrorClass.PERMANENT_VALIDATION;
            default:
                return ErrorClass.TRANSIENT_FETCH;
        }
    }

    public static FailureReason fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NONE;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (FailureReason reason : values()) {
            if (reason.label.equals(target)) {
                return reason;
            }
        }
        return OTHER;
    }
}
