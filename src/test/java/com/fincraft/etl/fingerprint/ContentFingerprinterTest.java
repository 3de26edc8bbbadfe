package com.fincraft.etl.fingerprint;

import com.fincraft.etl.model.BusinessRecord;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ContentFingerprinterTest {
    private final ContentFingerprinter fingerprinter = new ContentFingerprinter(Set.of("fetched_at", "source_run_id"));

    @Test
    void fingerprint_shouldIgnoreKeyOrderAndExcludedFields() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("total_assets", new BigDecimal("100"));
        a.put("currency", "USD");
        a.put("fetched_at", "2026-01-01T00:00:00Z");
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("currency", "USD");
        b.put("fetched_at", "2026-09-09T09:09:09Z");
        b.put("total_assets", new BigDecimal("100"));

        String fp = fingerprinter.fingerprintFields(a);
        assertEquals(fp, fingerprinter.fingerprintFields(b));
        assertEquals(ContentFingerprinter.FINGERPRINT_LENGTH, fp.length());
    }

    @Test
    void fingerprint_shouldNormalizeNumericScale() {
        Map<String, Object> a = Map.of("v", new BigDecimal("1.50"));
        Map<String, Object> b = Map.of("v", new BigDecimal("1.5"));
        assertEquals(fingerprinter.fingerprintFields(a), fingerprinter.fingerprintFields(b));
    }

    @Test
    void fingerprint_shouldChangeWhenBusinessValueChanges() {
        Map<String, Object> a = Map.of("v", new BigDecimal("1.5"));
        Map<String, Object> b = Map.of("v", new BigDecimal("1.6"));
        assertNotEquals(fingerprinter.fingerprintFields(a), fingerprinter.fingerprintFields(b));
    }

    @Test
    void payloadFingerprint_shouldDropExcludedKeysAtAnyDepth() {
        JSONObject a = new JSONObject("{\"data\":[{\"date\":\"2026-01-01\",\"value\":\"1\",\"fetched_at\":\"x\"}]}");
        JSONObject b = new JSONObject("{\"data\":[{\"value\":\"1\",\"date\":\"2026-01-01\",\"fetched_at\":\"y\"}]}");
        assertEquals(fingerprinter.fingerprintPayload(a), fingerprinter.fingerprintPayload(b));
    }

    @Test
    void recordsFingerprint_shouldNotDependOnRecordOrder() {
        BusinessRecord q1 = record(LocalDate.of(2026, 3, 31), "10");
        BusinessRecord q2 = record(LocalDate.of(2026, 6, 30), "12");
        assertEquals(
                fingerprinter.fingerprintRecords(List.of(q1, q2)),
                fingerprinter.fingerprintRecords(List.of(q2, q1))
        );
    }

    @Test
    void sha256_shouldMatchKnownDigest() {
        assertEquals(
                "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ContentFingerprinter.sha256("")
        );
    }

    private static BusinessRecord record(LocalDate period, String value) {
        return new BusinessRecord("IBM", period, "quarterly", Map.of("total_assets", new BigDecimal(value)),
                null, "run-1", Instant.parse("2026-07-01T00:00:00Z"));
    }
}
