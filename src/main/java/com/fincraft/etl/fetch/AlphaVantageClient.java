package com.fincraft.etl.fetch;

import com.fincraft.etl.config.Config;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for the Alpha Vantage query endpoint. One call per entity, no retries:
 * a failed attempt is retried by a later scheduling pass.
 */
public final class AlphaVantageClient implements UpstreamFetchService {
    private static final Logger LOG = LogManager.getLogger(AlphaVantageClient.class);
    private static final int SAMPLE_CHARS = 160;

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final RequestThrottle throttle;
    private final HttpClient httpClient;

    public AlphaVantageClient(Config config) {
        this(
                config.getString("alphavantage.base_url", "https://www.alphavantage.co/query"),
                firstNonBlank(System.getenv("ALPHAVANTAGE_API_KEY"), config.getString("alphavantage.api_key", "")),
                Duration.ofSeconds(Math.max(1, config.getInt("fetch.timeout_sec", 30))),
                RequestThrottle.perMinute(config.getInt("fetch.requests_per_minute", 75))
        );
    }

    public AlphaVantageClient(String baseUrl, String apiKey, Duration timeout, RequestThrottle throttle) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeout = timeout;
        this.throttle = throttle;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        if (this.apiKey.isEmpty()) {
            LOG.warn("alphavantage api key is not configured; requests will be rejected upstream");
        }
    }

    @Override
    public void awaitPermit() throws InterruptedException {
        throttle.acquire();
    }

    @Override
    public FetchResponse fetch(String entityId, TableDescriptor table, Map<String, String> params) throws InterruptedException {
        long started = System.nanoTime();
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(buildUrl(params)))
                    .header("User-Agent", "fincraft-etl/0.1")
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
            FetchResponse result = classify(response.statusCode(), response.body()).withLatency(elapsedMs);
            if (!result.isSuccess()) {
                LOG.debug("fetch table={} entity={} status={} reason={} msg={}",
                        table.getTableName(), entityId, result.status.label(), result.failureReason.label(), result.message);
            }
            return result;
        } catch (HttpTimeoutException e) {
            return FetchResponse.failed(FailureReason.TIMEOUT, "request timed out after " + timeout.toSeconds() + "s",
                    "", 0, elapsedSince(started));
        } catch (IOException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return FetchResponse.failed(FailureReason.TRANSPORT, msg, "", 0, elapsedSince(started));
        }
    }

    long throttleSpacingMs() {
        return throttle.spacingMs();
    }

    String buildUrl(Map<String, String> params) {
        StringBuilder sb = new StringBuilder(baseUrl);
        char sep = baseUrl.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> e : params.entrySet()) {
            sb.append(sep).append(encode(e.getKey())).append('=').append(encode(e.getValue()));
            sep = '&';
        }
        sb.append(sep).append("apikey=").append(encode(apiKey));
        return sb.toString();
    }

    /**
     * Maps an HTTP answer onto success, empty or a failure reason. The upstream reports most
     * errors with HTTP 200 and a message object.
     */
    static FetchResponse classify(int httpStatus, String body) {
        if (httpStatus == 429) {
            return FetchResponse.failed(FailureReason.RATE_LIMIT, "http status=429", body, httpStatus, 0L);
        }
        if (httpStatus / 100 != 2) {
            return FetchResponse.failed(FailureReason.HTTP_STATUS, "http status=" + httpStatus, body, httpStatus, 0L);
        }
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            return FetchResponse.empty(text, httpStatus, 0L);
        }
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            return FetchResponse.failed(FailureReason.PARSE_ERROR, "unexpected_payload:" + sample(text), body, httpStatus, 0L);
        }
        if (json.has("Error Message")) {
            return FetchResponse.failed(FailureReason.UPSTREAM_ERROR, json.optString("Error Message"), body, httpStatus, 0L);
        }
        if (json.has("Note") || json.has("Information")) {
            String note = json.has("Note") ? json.optString("Note") : json.optString("Information");
            return FetchResponse.failed(FailureReason.RATE_LIMIT, sample(note), body, httpStatus, 0L);
        }
        if (json.isEmpty()) {
            return FetchResponse.empty(text, httpStatus, 0L);
        }
        return FetchResponse.success(json, text, httpStatus, 0L);
    }

    private static long elapsedSince(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static String sample(String text) {
        String t = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        return t.length() > SAMPLE_CHARS ? t.substring(0, SAMPLE_CHARS) : t;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.trim().isEmpty()) {
                return v.trim();
            }
        }
        return "";
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "AlphaVantageClient{baseUrl=%s, throttle_ms=%d}", baseUrl, throttle.spacingMs());
    }
}
