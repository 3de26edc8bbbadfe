package com.fincraft.etl.pipeline;

import com.fincraft.core.PassTelemetry;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.fingerprint.ContentFingerprinter;
import com.fincraft.etl.table.TableDescriptor;

import java.util.concurrent.ExecutorService;

/**
 * Per-pass values handed to every entity; the run id travels here instead of living in shared state.
 */
public final class PassContext {
    public final String runId;
    public final TableDescriptor descriptor;
    public final ExtractionSettings settings;
    public final ContentFingerprinter fingerprinter;
    public final ExecutorService fetchExecutor;
    public final PassTelemetry telemetry;

    public PassContext(
            String runId,
            TableDescriptor descriptor,
            ExtractionSettings settings,
            ExecutorService fetchExecutor,
            PassTelemetry telemetry
    ) {
        this.runId = runId;
        this.descriptor = descriptor;
        this.settings = settings;
        this.fingerprinter = new ContentFingerprinter(descriptor.getExcludedFields());
        this.fetchExecutor = fetchExecutor;
        this.telemetry = telemetry;
    }

    public String tableName() {
        return descriptor.getTableName();
    }
}
