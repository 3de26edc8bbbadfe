package com.fincraft.etl.pipeline;

import com.fincraft.etl.fingerprint.ContentFingerprinter;
import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.UpsertResult;
import com.fincraft.etl.model.Watermark;
import com.fincraft.etl.store.BusinessRecordRepository;
import com.fincraft.etl.watermark.WatermarkStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Writes business records by natural key and advances the entity watermark afterwards.
 * A record is only upserted when its content fingerprint differs from the stored one.
 */
public final class UpsertEngine {
    private static final Logger LOG = LogManager.getLogger(UpsertEngine.class);

    private final BusinessRecordRepository records;
    private final WatermarkStore watermarks;
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter(Set.of());

    public UpsertEngine(BusinessRecordRepository records, WatermarkStore watermarks) {
        this.records = records;
        this.watermarks = watermarks;
    }

    /**
     * Single-record apply. The watermark keeps its payload fingerprint since one record
     * does not describe a whole payload.
     */
    public UpsertResult apply(String table, BusinessRecord record, Instant at) throws SQLException {
        requireDataRecord(record);
        UpsertResult result = records.upsert(table, fingerprinted(record));
        watermarks.recordSuccess(table, record.entityId, record.period, null, at);
        return result;
    }

    public ApplyReport applyBatch(
            String table,
            String entityId,
            List<BusinessRecord> batch,
            String payloadFingerprint,
            Instant at
    ) throws SQLException {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("applyBatch needs at least one record; use acknowledgeEmpty");
        }
        LocalDate maxPeriod = null;
        List<BusinessRecord> prepared = new ArrayList<>(batch.size());
        for (BusinessRecord record : batch) {
            requireDataRecord(record);
            if (!record.entityId.equals(entityId)) {
                throw new IllegalArgumentException("record " + record.naturalKey() + " does not belong to " + entityId);
            }
            maxPeriod = Watermark.laterOf(maxPeriod, record.period);
            prepared.add(fingerprinted(record));
        }

        List<UpsertResult> results = records.upsertAll(table, prepared);
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (UpsertResult r : results) {
            switch (r) {
                case INSERTED:
                    inserted++;
                    break;
                case UPDATED:
                    updated++;
                    break;
                default:
                    unchanged++;
                    break;
            }
        }
        watermarks.recordSuccess(table, entityId, maxPeriod, payloadFingerprint, at);
        LOG.debug("apply table={} entity={} inserted={} updated={} unchanged={} max_period={}",
                table, entityId, inserted, updated, unchanged, maxPeriod);
        return new ApplyReport(inserted, updated, unchanged, maxPeriod);
    }

    /**
     * Content matches what was stored last time: no record write, the watermark still advances.
     */
    public void confirmUnchanged(String table, String entityId, LocalDate period, String payloadFingerprint, Instant at)
            throws SQLException {
        watermarks.recordSuccess(table, entityId, period, payloadFingerprint, at);
    }

    public void acknowledgeEmpty(String table, String entityId, Instant at) throws SQLException {
        watermarks.recordEmpty(table, entityId, at);
    }

    /** Stored rows are compared by fingerprint, so a record without one gets it from its fields. */
    private BusinessRecord fingerprinted(BusinessRecord record) {
        if (record.fingerprint != null) {
            return record;
        }
        return record.withFingerprint(fingerprinter.fingerprintFields(record.fields));
    }

    private static void requireDataRecord(BusinessRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        record.naturalKey().requireWellFormed();
    }
}
