package com.fincraft.etl.model;

import java.util.Locale;

public enum FetchStatus {
    SUCCESS("success"),
    EMPTY("empty"),
    ERROR("error");

    private final String label;

    FetchStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FetchStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (FetchStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        return ERROR;
    }
}
