package com.fincraft.etl.fingerprint;

import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.NaturalKey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SHA-256 digests over business content only. Pure and thread-safe.
 */
public final class ContentFingerprinter {
    public static final int FINGERPRINT_LENGTH = 64;

    private final Set<String> excludedFields;

    public ContentFingerprinter(Set<String> excludedFields) {
        this.excludedFields = excludedFields == null ? Set.of() : Set.copyOf(excludedFields);
    }

    /**
     * Fingerprint of one record's business fields.
     */
    public String fingerprintFields(Map<String, Object> fields) {
        return sha256(CanonicalJson.render(fields, excludedFields));
    }

    /**
     * Fingerprint of any parsed payload fragment (org.json objects, maps, lists, scalars).
     */
    public String fingerprintPayload(Object payload) {
        return sha256(CanonicalJson.render(payload, excludedFields));
    }

    /**
     * Combined fingerprint of a transformed payload: record fingerprints in natural-key order.
     * Records without their own fingerprint are fingerprinted here.
     */
    public String fingerprintRecords(List<BusinessRecord> records) {
        List<BusinessRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(BusinessRecord::naturalKey));
        StringBuilder sb = new StringBuilder();
        for (BusinessRecord record : sorted) {
            NaturalKey key = record.naturalKey();
            String fp = record.fingerprint == null ? fingerprintFields(record.fields) : record.fingerprint;
            sb.append(key.entityId()).append('|')
                    .append(key.period()).append('|')
                    .append(key.reportType()).append('|')
                    .append(fp).append('\n');
        }
        return sha256(sb.toString());
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] out = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
