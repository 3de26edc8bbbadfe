package com.fincraft.etl.model;

/**
 * Logical per-entity state. Derived from the watermark, never persisted on its own.
 */
public enum EntityState {
    NEVER_FETCHED,
    SUCCESS,
    EMPTY,
    ERROR,
    SUSPENDED;

    public static EntityState of(Watermark watermark, int failureCeiling) {
        if (watermark == null) {
            return NEVER_FETCHED;
        }
        if (watermark.isSuspended(failureCeiling)) {
            return SUSPENDED;
        }
        if (watermark.consecutiveFailures > 0) {
            return ERROR;
        }
        if (watermark.lastStatus == FetchStatus.EMPTY) {
            return EMPTY;
        }
        if (watermark.lastSuccessTime == null) {
            return NEVER_FETCHED;
        }
        return SUCCESS;
    }
}
