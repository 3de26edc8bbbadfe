package com.fincraft.etl.transform;

import com.fincraft.etl.fingerprint.ContentFingerprinter;
import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.model.NaturalKey;
import com.fincraft.etl.table.FieldSpec;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a raw upstream payload onto business records according to a {@link TableDescriptor}.
 */
public final class PayloadTransformer {
    private static final Logger LOG = LogManager.getLogger(PayloadTransformer.class);
    private static final Set<String> NULL_TOKENS = Set.of("", "None", "none", "null", "-", ".", "N/A");

    public TransformResult transform(
            TableDescriptor descriptor,
            String entityId,
            Map<String, String> requestParams,
            JSONObject payload,
            String runId,
            Instant fetchedAt,
            ContentFingerprinter fingerprinter
    ) throws PayloadValidationException {
        if (payload == null || payload.isEmpty()) {
            return TransformResult.empty();
        }
        List<BusinessRecord> raw;
        switch (descriptor.getLayout()) {
            case REPORT_SECTIONS:
                raw = fromSections(descriptor, entityId, payload, runId, fetchedAt);
                break;
            case PERIOD_KEYED:
                raw = fromPeriodKeyed(descriptor, entityId, payload, runId, fetchedAt);
                break;
            case SERIES_ARRAY:
                raw = fromSeries(descriptor, entityId, requestParams, payload, runId, fetchedAt);
                break;
            default:
                throw new PayloadValidationException("unsupported layout: " + descriptor.getLayout());
        }

        Map<NaturalKey, BusinessRecord> unique = new LinkedHashMap<>();
        int duplicates = 0;
        for (BusinessRecord record : raw) {
            BusinessRecord withFp = record.withFingerprint(fingerprinter.fingerprintFields(record.fields));
            if (unique.putIfAbsent(withFp.naturalKey(), withFp) != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            LOG.debug("dropped {} duplicate rows table={} entity={}", duplicates, descriptor.getTableName(), entityId);
        }
        return TransformResult.of(new ArrayList<>(unique.values()), duplicates);
    }

    private List<BusinessRecord> fromSections(
            TableDescriptor descriptor,
            String entityId,
            JSONObject payload,
            String runId,
            Instant fetchedAt
    ) throws PayloadValidationException {
        List<BusinessRecord> out = new ArrayList<>();
        boolean anySection = false;
        for (Map.Entry<String, String> section : descriptor.getSections().entrySet()) {
            if (!payload.has(section.getKey())) {
                continue;
            }
            anySection = true;
            JSONArray reports = payload.optJSONArray(section.getKey());
            if (reports == null) {
                throw new PayloadValidationException("section " + section.getKey() + " is not an array");
            }
            for (int i = 0; i < reports.length(); i++) {
                JSONObject report = reports.optJSONObject(i);
                if (report == null) {
                    throw new PayloadValidationException("section " + section.getKey() + "[" + i + "] is not an object");
                }
                LocalDate period = parsePeriod(report.opt(descriptor.getPeriodField()), section.getKey() + "[" + i + "]");
                out.add(new BusinessRecord(
                        entityId,
                        period,
                        section.getValue(),
                        mapFields(descriptor, report),
                        null,
                        runId,
                        fetchedAt
                ));
            }
        }
        if (!anySection) {
            throw new PayloadValidationException("payload has none of the sections " + descriptor.getSections().keySet());
        }
        return out;
    }

    private List<BusinessRecord> fromPeriodKeyed(
            TableDescriptor descriptor,
            String entityId,
            JSONObject payload,
            String runId,
            Instant fetchedAt
    ) throws PayloadValidationException {
        if (!payload.has(descriptor.getContainerKey())) {
            throw new PayloadValidationException("payload has no " + descriptor.getContainerKey());
        }
        JSONObject container = payload.optJSONObject(descriptor.getContainerKey());
        if (container == null) {
            throw new PayloadValidationException(descriptor.getContainerKey() + " is not an object");
        }
        List<BusinessRecord> out = new ArrayList<>();
        for (String key : container.keySet()) {
            JSONObject point = container.optJSONObject(key);
            if (point == null) {
                throw new PayloadValidationException("point " + key + " is not an object");
            }
            out.add(new BusinessRecord(
                    entityId,
                    parsePeriod(key, descriptor.getContainerKey()),
                    descriptor.getFixedReportType(),
                    mapFields(descriptor, point),
                    null,
                    runId,
                    fetchedAt
            ));
        }
        return out;
    }

    private List<BusinessRecord> fromSeries(
            TableDescriptor descriptor,
            String entityId,
            Map<String, String> requestParams,
            JSONObject payload,
            String runId,
            Instant fetchedAt
    ) throws PayloadValidationException {
        if (!payload.has(descriptor.getContainerKey())) {
            throw new PayloadValidationException("payload has no " + descriptor.getContainerKey());
        }
        JSONArray points = payload.optJSONArray(descriptor.getContainerKey());
        if (points == null) {
            throw new PayloadValidationException(descriptor.getContainerKey() + " is not an array");
        }
        String reportType = requestParams == null ? null : requestParams.get("interval");
        if (reportType == null || reportType.isEmpty()) {
            reportType = descriptor.getFixedReportType() == null ? "series" : descriptor.getFixedReportType();
        }
        String unit = payload.optString("unit", null);
        List<BusinessRecord> out = new ArrayList<>();
        for (int i = 0; i < points.length(); i++) {
            JSONObject point = points.optJSONObject(i);
            if (point == null) {
                throw new PayloadValidationException("data[" + i + "] is not an object");
            }
            Map<String, Object> fields = mapFields(descriptor, point);
            if (unit != null && fields.containsKey("unit") && fields.get("unit") == null) {
                fields.put("unit", unit);
            }
            out.add(new BusinessRecord(
                    entityId,
                    parsePeriod(point.opt(descriptor.getPeriodField()), "data[" + i + "]"),
                    reportType,
                    fields,
                    null,
                    runId,
                    fetchedAt
            ));
        }
        return out;
    }

    private Map<String, Object> mapFields(TableDescriptor descriptor, JSONObject source) throws PayloadValidationException {
        Map<String, Object> out = new LinkedHashMap<>();
        for (FieldSpec field : descriptor.getFields()) {
            Object raw = source.opt(field.apiField());
            out.put(field.column(), convert(field, raw));
        }
        return out;
    }

    private Object convert(FieldSpec field, Object raw) throws PayloadValidationException {
        if (raw == null || raw == JSONObject.NULL) {
            return null;
        }
        String text = String.valueOf(raw).trim();
        if (NULL_TOKENS.contains(text)) {
            return null;
        }
        if (field.type() == FieldSpec.ValueType.TEXT) {
            return text;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new PayloadValidationException("field " + field.apiField() + " is not numeric: " + text, e);
        }
    }

    private LocalDate parsePeriod(Object raw, String where) throws PayloadValidationException {
        if (raw == null || raw == JSONObject.NULL) {
            throw new PayloadValidationException("missing period at " + where);
        }
        String text = String.valueOf(raw).trim();
        if (NULL_TOKENS.contains(text)) {
            throw new PayloadValidationException("missing period at " + where);
        }
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new PayloadValidationException("invalid period '" + text + "' at " + where, e);
        }
    }
}
