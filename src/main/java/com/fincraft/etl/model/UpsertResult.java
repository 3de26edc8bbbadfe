package com.fincraft.etl.model;

public enum UpsertResult {
    INSERTED,
    UPDATED,
    UNCHANGED
}
