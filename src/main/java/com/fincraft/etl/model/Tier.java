package com.fincraft.etl.model;

import java.util.Locale;

/**
 * Coarse priority class derived from a coverage score. Lower rank is scheduled first.
 */
public enum Tier {
    CORE("core", 0),
    EXTENDED("extended", 1),
    LONG_TAIL("long_tail", 2);

    private final String label;
    private final int rank;

    Tier(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    public static Tier fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return LONG_TAIL;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.label.equals(target)) {
                return tier;
            }
        }
        return LONG_TAIL;
    }
}
