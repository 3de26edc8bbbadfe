package com.fincraft.etl.runner;

public enum PassStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    ABORTED,
    FAILED
}
