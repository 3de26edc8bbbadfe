package com.fincraft.etl.model;

/**
 * Per-entity outcome of one scheduling pass.
 */
public enum FetchOutcome {
    INSERTED("inserted"),
    UPDATED("updated"),
    UNCHANGED("unchanged"),
    EMPTY("empty"),
    ERROR("error"),
    SUSPENDED("suspended"),
    SKIPPED("skipped");

    private final String label;

    FetchOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isFailure() {
        return this == ERROR || this == SUSPENDED;
    }
}
