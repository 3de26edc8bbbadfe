package com.fincraft.etl.model;

import java.util.Locale;

/**
 * Kind of extraction identity held in the entity catalog.
 */
public enum EntityKind {
    SYMBOL,
    INDICATOR;

    public static EntityKind fromText(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return SYMBOL;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.name().equals(value)) {
                return kind;
            }
        }
        return SYMBOL;
    }
}
