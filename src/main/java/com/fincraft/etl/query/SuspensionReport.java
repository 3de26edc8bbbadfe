package com.fincraft.etl.query;

import com.fincraft.etl.model.Watermark;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Operator-facing list of entities held back by the failure ceiling.
 */
public final class SuspensionReport {
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    public final List<Watermark> entries;

    public SuspensionReport(List<Watermark> entries) {
        this.entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<String> toLines() {
        List<String> lines = new ArrayList<>();
        if (entries.isEmpty()) {
            lines.add("no suspended entities");
            return lines;
        }
        lines.add(String.format(Locale.US, "%-28s %-14s %8s  %-16s %s", "table", "entity", "failures", "reason", "last_failure"));
        for (Watermark wm : entries) {
            lines.add(String.format(
                    Locale.US,
                    "%-28s %-14s %8d  %-16s %s",
                    wm.tableName,
                    wm.entityId,
                    wm.consecutiveFailures,
                    wm.lastFailureReason == null ? "-" : wm.lastFailureReason,
                    wm.lastFailureTime == null ? "-" : ISO.format(wm.lastFailureTime)
            ));
        }
        return lines;
    }
}
