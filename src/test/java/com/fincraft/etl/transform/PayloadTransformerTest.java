package com.fincraft.etl.transform;

import com.fincraft.etl.fingerprint.ContentFingerprinter;
import com.fincraft.etl.model.BusinessRecord;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.table.TableRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadTransformerTest {
    private static final Instant AT = Instant.parse("2026-10-17T08:00:00Z");

    private final TableRegistry registry = TableRegistry.builtIn();
    private final PayloadTransformer transformer = new PayloadTransformer();

    @Test
    void statementSections_shouldMapToReportTypes() throws Exception {
        TableDescriptor table = registry.require(TableRegistry.BALANCE_SHEET);
        JSONObject payload = new JSONObject("{"
                + "\"symbol\":\"IBM\","
                + "\"annualReports\":[{\"fiscalDateEnding\":\"2025-12-31\",\"reportedCurrency\":\"USD\",\"totalAssets\":\"137175000000\"}],"
                + "\"quarterlyReports\":["
                + "{\"fiscalDateEnding\":\"2026-06-30\",\"reportedCurrency\":\"USD\",\"totalAssets\":\"140000000000\",\"goodwill\":\"None\"},"
                + "{\"fiscalDateEnding\":\"2026-03-31\",\"reportedCurrency\":\"USD\",\"totalAssets\":\"139000000000\"}"
                + "]}");

        TransformResult result = transform(table, "IBM", payload);

        assertEquals(3, result.records.size());
        assertEquals(LocalDate.of(2026, 6, 30), result.maxPeriod());
        BusinessRecord latest = result.records.stream()
                .filter(r -> r.period.equals(LocalDate.of(2026, 6, 30)))
                .findFirst()
                .orElseThrow();
        assertEquals("quarterly", latest.reportType);
        assertEquals(new BigDecimal("140000000000"), latest.fields.get("total_assets"));
        assertNull(latest.fields.get("goodwill"));
        assertEquals("USD", latest.fields.get("reported_currency"));
        assertNotNull(latest.fingerprint);
        assertEquals("run-1", latest.sourceRunId);
        assertTrue(result.records.stream().anyMatch(r -> "annual".equals(r.reportType)));
    }

    @Test
    void duplicateNaturalKeys_shouldKeepFirstOccurrence() throws Exception {
        TableDescriptor table = registry.require(TableRegistry.INCOME_STATEMENT);
        JSONObject payload = new JSONObject("{\"quarterlyReports\":["
                + "{\"fiscalDateEnding\":\"2026-06-30\",\"netIncome\":\"5\"},"
                + "{\"fiscalDateEnding\":\"2026-06-30\",\"netIncome\":\"7\"}"
                + "]}");

        TransformResult result = transform(table, "IBM", payload);

        assertEquals(1, result.records.size());
        assertEquals(1, result.duplicatesDropped);
        assertEquals(new BigDecimal("5"), result.records.get(0).fields.get("net_income"));
    }

    @Test
    void dailySeries_shouldUseDateKeys() throws Exception {
        TableDescriptor table = registry.require(TableRegistry.TIME_SERIES_DAILY_ADJUSTED);
        JSONObject payload = new JSONObject("{"
                + "\"Meta Data\":{\"2. Symbol\":\"IBM\"},"
                + "\"Time Series (Daily)\":{"
                + "\"2026-10-16\":{\"1. open\":\"10\",\"4. close\":\"11\",\"6. volume\":\"1000\"},"
                + "\"2026-10-15\":{\"1. open\":\"9\",\"4. close\":\"10\",\"6. volume\":\"900\"}"
                + "}}");

        TransformResult result = transform(table, "IBM", payload);

        assertEquals(2, result.records.size());
        assertEquals(LocalDate.of(2026, 10, 16), result.maxPeriod());
        assertTrue(result.records.stream().allMatch(r -> "daily".equals(r.reportType)));
    }

    @Test
    void indicatorSeries_shouldTakeReportTypeFromInterval() throws Exception {
        TableDescriptor table = registry.require(TableRegistry.ECONOMIC_INDICATORS);
        JSONObject payload = new JSONObject("{\"name\":\"Real GDP\",\"unit\":\"billions of dollars\",\"data\":["
                + "{\"date\":\"2026-04-01\",\"value\":\"5800.1\"},"
                + "{\"date\":\"2026-01-01\",\"value\":\".\"}"
                + "]}");

        TransformResult result = transformer.transform(
                table, "REAL_GDP", table.requestParamsFor("REAL_GDP"), payload, "run-1", AT,
                new ContentFingerprinter(table.getExcludedFields()));

        assertEquals(2, result.records.size());
        BusinessRecord first = result.records.get(0);
        assertEquals("quarterly", first.reportType);
        assertEquals("billions of dollars", first.fields.get("unit"));
        assertNull(result.records.get(1).fields.get("value"));
    }

    @Test
    void emptyPayload_shouldYieldNoRecords() throws Exception {
        TableDescriptor table = registry.require(TableRegistry.BALANCE_SHEET);
        assertTrue(transform(table, "IBM", new JSONObject()).isEmpty());
        assertTrue(transform(table, "IBM", new JSONObject("{\"quarterlyReports\":[]}")).isEmpty());
    }

    @Test
    void missingSections_shouldFailValidation() {
        TableDescriptor table = registry.require(TableRegistry.BALANCE_SHEET);
        JSONObject payload = new JSONObject("{\"symbol\":\"IBM\"}");
        assertThrows(PayloadValidationException.class, () -> transform(table, "IBM", payload));
    }

    @Test
    void nonNumericValue_shouldFailValidation() {
        TableDescriptor table = registry.require(TableRegistry.BALANCE_SHEET);
        JSONObject payload = new JSONObject("{\"quarterlyReports\":[{\"fiscalDateEnding\":\"2026-06-30\",\"totalAssets\":\"abc\"}]}");
        assertThrows(PayloadValidationException.class, () -> transform(table, "IBM", payload));
    }

    @Test
    void missingPeriod_shouldFailValidation() {
        TableDescriptor table = registry.require(TableRegistry.BALANCE_SHEET);
        JSONObject payload = new JSONObject("{\"quarterlyReports\":[{\"totalAssets\":\"1\"}]}");
        assertThrows(PayloadValidationException.class, () -> transform(table, "IBM", payload));
    }

    private TransformResult transform(TableDescriptor table, String entityId, JSONObject payload)
            throws PayloadValidationException {
        return transformer.transform(table, entityId, Map.of(), payload, "run-1", AT,
                new ContentFingerprinter(table.getExcludedFields()));
    }
}
