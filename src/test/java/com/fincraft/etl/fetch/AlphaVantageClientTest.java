package com.fincraft.etl.fetch;

import com.fincraft.etl.config.Config;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.FetchStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlphaVantageClientTest {

    @Test
    void classify_shouldTreatRateLimitNotesAsFailures() {
        FetchResponse note = AlphaVantageClient.classify(200,
                "{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute.\"}");
        FetchResponse info = AlphaVantageClient.classify(200, "{\"Information\":\"premium endpoint\"}");
        FetchResponse http429 = AlphaVantageClient.classify(429, "");

        assertEquals(FailureReason.RATE_LIMIT, note.failureReason);
        assertEquals(FailureReason.RATE_LIMIT, info.failureReason);
        assertEquals(FailureReason.RATE_LIMIT, http429.failureReason);
        assertEquals(FetchStatus.ERROR, note.status);
    }

    @Test
    void classify_shouldMapUpstreamErrorMessage() {
        FetchResponse r = AlphaVantageClient.classify(200, "{\"Error Message\":\"Invalid API call.\"}");
        assertEquals(FailureReason.UPSTREAM_ERROR, r.failureReason);
        assertEquals("Invalid API call.", r.message);
    }

    @Test
    void classify_shouldMapHttpAndParseFailures() {
        assertEquals(FailureReason.HTTP_STATUS, AlphaVantageClient.classify(503, "oops").failureReason);
        assertEquals(FailureReason.PARSE_ERROR, AlphaVantageClient.classify(200, "<html>").failureReason);
    }

    @Test
    void classify_shouldReportEmptyBodies() {
        assertEquals(FetchStatus.EMPTY, AlphaVantageClient.classify(200, "").status);
        assertEquals(FetchStatus.EMPTY, AlphaVantageClient.classify(200, "{}").status);
    }

    @Test
    void classify_shouldAcceptDataPayload() {
        FetchResponse r = AlphaVantageClient.classify(200, "{\"symbol\":\"IBM\",\"quarterlyReports\":[]}");
        assertTrue(r.isSuccess());
        assertEquals("IBM", r.payload.getString("symbol"));
        assertEquals(FailureReason.NONE, r.failureReason);
    }

    @Test
    void buildUrl_shouldEncodeParamsAndAppendKey() {
        AlphaVantageClient client = new AlphaVantageClient(
                "https://example.test/query", "demo", Duration.ofSeconds(5), RequestThrottle.perMinute(0));
        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", "BALANCE_SHEET");
        params.put("symbol", "BRK.B");

        assertEquals("https://example.test/query?function=BALANCE_SHEET&symbol=BRK.B&apikey=demo", client.buildUrl(params));
    }

    @Test
    void requestBudget_shouldComeFromGlobalKeyOnly() {
        Config config = Config.of(Map.of(
                "fetch.requests_per_minute", "5",
                "extract.balance_sheet.requests_per_minute", "60",
                "alphavantage.api_key", "demo"));

        AlphaVantageClient client = new AlphaVantageClient(config);

        assertEquals(12_000L, client.throttleSpacingMs());
    }

    @Test
    void awaitPermit_shouldSpaceConsecutiveCalls() throws Exception {
        AlphaVantageClient client = new AlphaVantageClient(
                "https://example.test/query", "demo", Duration.ofSeconds(5), new RequestThrottle(200L));

        long started = System.nanoTime();
        client.awaitPermit();
        client.awaitPermit();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(elapsedMs >= 150L, "second permit should wait for the spacing, waited " + elapsedMs + "ms");
    }
}
