package com.fincraft.etl.support;

import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.store.WatermarkRepository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Applies the same transitions as the SQL statements, through the {@link Watermark} with* methods.
 */
public final class InMemoryWatermarkRepository implements WatermarkRepository {
    private final Map<String, Map<String, Watermark>> byTable = new TreeMap<>();

    public synchronized void put(Watermark watermark) {
        byTable.computeIfAbsent(watermark.tableName, t -> new TreeMap<>()).put(watermark.entityId, watermark);
    }

    @Override
    public synchronized Optional<Watermark> find(String tableName, String entityId) {
        return Optional.ofNullable(table(tableName).get(entityId));
    }

    @Override
    public synchronized Map<String, Watermark> findAll(String tableName) {
        return new TreeMap<>(table(tableName));
    }

    @Override
    public synchronized void markSuccess(String tableName, String entityId, LocalDate period, String fingerprint, Instant at) {
        put(current(tableName, entityId, at).withSuccess(period, fingerprint, at));
    }

    @Override
    public synchronized void markEmpty(String tableName, String entityId, Instant at) {
        put(current(tableName, entityId, at).withEmpty(at));
    }

    @Override
    public synchronized int markFailure(String tableName, String entityId, FailureReason reason, Instant at) {
        Watermark next = current(tableName, entityId, at).withFailure(reason, at);
        put(next);
        return next.consecutiveFailures;
    }

    @Override
    public synchronized int resetFailures(String tableName, String entityId, Instant at) {
        int count = 0;
        for (Watermark wm : new ArrayList<>(table(tableName).values())) {
            if (entityId != null && !entityId.equals(wm.entityId)) {
                continue;
            }
            if (wm.consecutiveFailures > 0) {
                put(wm.withReset(at));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized List<Watermark> listAtOrAboveFailures(String tableName, int failureCeiling) {
        List<Watermark> out = new ArrayList<>();
        for (Watermark wm : table(tableName).values()) {
            if (wm.consecutiveFailures >= failureCeiling) {
                out.add(wm);
            }
        }
        return out;
    }

    private Watermark current(String tableName, String entityId, Instant at) {
        Watermark existing = table(tableName).get(entityId);
        return existing == null ? Watermark.initial(tableName, entityId, at) : existing;
    }

    private Map<String, Watermark> table(String tableName) {
        return byTable.computeIfAbsent(tableName, t -> new TreeMap<>());
    }
}
