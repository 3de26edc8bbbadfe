package com.fincraft.etl.pipeline;

import com.fincraft.core.PassTelemetry;
import com.fincraft.etl.fetch.FetchResponse;
import com.fincraft.etl.fetch.UpstreamFetchService;
import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.LandingRecord;
import com.fincraft.etl.scheduler.ScheduledEntity;
import com.fincraft.etl.store.LandingRepository;
import com.fincraft.etl.transform.PayloadTransformer;
import com.fincraft.etl.transform.PayloadValidationException;
import com.fincraft.etl.transform.TransformResult;
import com.fincraft.etl.watermark.WatermarkStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 模块说明：EntityProcessor（class）。
 * 主要职责：单个实体的完整处理链路：抓取、转换、指纹、落地日志、写入与水位更新。
 * 使用建议：抓取与校验失败转换为 record_failure；存储异常（SQLException）直接向上抛出，终止整个批次。
 */
public final class EntityProcessor {
    private static final Logger LOG = LogManager.getLogger(EntityProcessor.class);

    private final UpstreamFetchService upstream;
    private final PayloadTransformer transformer;
    private final LandingRepository landing;
    private final WatermarkStore watermarks;
    private final UpsertEngine upsertEngine;
    private final Clock clock;

    public EntityProcessor(
            UpstreamFetchService upstream,
            PayloadTransformer transformer,
            LandingRepository landing,
            WatermarkStore watermarks,
            UpsertEngine upsertEngine,
            Clock clock
    ) {
        this.upstream = upstream;
        this.transformer = transformer;
        this.landing = landing;
        this.watermarks = watermarks;
        this.upsertEngine = upsertEngine;
        this.clock = clock;
    }

    public EntityResult process(PassContext ctx, ScheduledEntity scheduled) throws SQLException, InterruptedException {
        String entityId = scheduled.entityId();
        Map<String, String> params;
        try {
            params = ctx.descriptor.requestParamsFor(entityId);
        } catch (IllegalArgumentException e) {
            return fail(ctx, entityId, FailureReason.VALIDATION, e.getMessage(), "");
        }

        upstream.awaitPermit();
        long fetchStarted = System.nanoTime();
        FetchResponse response = fetchWithTimeout(ctx, entityId, params);
        ctx.telemetry.recordStep(PassTelemetry.STEP_FETCH, elapsedMs(fetchStarted),
                response.isSuccess() ? 1 : 0, response.failureReason == FailureReason.NONE ? 0 : 1);

        try {
            switch (response.status) {
                case ERROR:
                    return fail(ctx, entityId, response.failureReason, response.message, response.rawBody);
                case EMPTY:
                    return recordEmpty(ctx, entityId, response.rawBody);
                default:
                    return processPayload(ctx, scheduled, params, response);
            }
        } catch (RuntimeException e) {
            LOG.error("entity crashed table={} entity={}", ctx.tableName(), entityId, e);
            return fail(ctx, entityId, FailureReason.OTHER, describe(e), "");
        }
    }

    private EntityResult processPayload(
            PassContext ctx,
            ScheduledEntity scheduled,
            Map<String, String> params,
            FetchResponse response
    ) throws SQLException {
        String table = ctx.tableName();
        String entityId = scheduled.entityId();
        Instant fetchedAt = clock.instant();

        long transformStarted = System.nanoTime();
        TransformResult transformed;
        String payloadFp;
        try {
            transformed = transformer.transform(
                    ctx.descriptor, entityId, params, response.payload, ctx.runId, fetchedAt, ctx.fingerprinter);
            payloadFp = transformed.isEmpty() ? null : ctx.fingerprinter.fingerprintRecords(transformed.records);
        } catch (PayloadValidationException e) {
            ctx.telemetry.recordStep(PassTelemetry.STEP_TRANSFORM, elapsedMs(transformStarted), 0, 1);
            return fail(ctx, entityId, FailureReason.VALIDATION, e.getMessage(), response.rawBody);
        } catch (RuntimeException e) {
            ctx.telemetry.recordStep(PassTelemetry.STEP_TRANSFORM, elapsedMs(transformStarted), 0, 1);
            return fail(ctx, entityId, FailureReason.PARSE_ERROR, describe(e), response.rawBody);
        }
        ctx.telemetry.recordStep(PassTelemetry.STEP_TRANSFORM, elapsedMs(transformStarted), transformed.records.size(), 0);

        if (transformed.isEmpty()) {
            return recordEmpty(ctx, entityId, response.rawBody);
        }

        long landingStarted = System.nanoTime();
        landing.append(LandingRecord.success(table, entityId, ctx.runId, payloadFp, response.rawBody, fetchedAt));
        ctx.telemetry.recordStep(PassTelemetry.STEP_LANDING, elapsedMs(landingStarted), 1, 0);

        long upsertStarted = System.nanoTime();
        Instant at = clock.instant();
        if (payloadFp.equals(scheduled.due.lastFingerprint())) {
            upsertEngine.confirmUnchanged(table, entityId, transformed.maxPeriod(), payloadFp, at);
            ctx.telemetry.recordStep(PassTelemetry.STEP_UPSERT, elapsedMs(upsertStarted), 0, 0);
            return EntityResult.unchanged(entityId, transformed.maxPeriod());
        }
        ApplyReport report = upsertEngine.applyBatch(table, entityId, transformed.records, payloadFp, at);
        ctx.telemetry.recordStep(PassTelemetry.STEP_UPSERT, elapsedMs(upsertStarted), report.written(), 0);
        return EntityResult.applied(entityId, report);
    }

    private FetchResponse fetchWithTimeout(PassContext ctx, String entityId, Map<String, String> params)
            throws InterruptedException {
        Future<FetchResponse> future = ctx.fetchExecutor.submit(() -> upstream.fetch(entityId, ctx.descriptor, params));
        long timeoutMs = ctx.settings.fetchTimeout.toMillis();
        try {
            FetchResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || response.status == null) {
                return FetchResponse.failed(FailureReason.OTHER, "fetch returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            return FetchResponse.failed(FailureReason.TIMEOUT, "fetch timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof InterruptedException) {
                return FetchResponse.failed(FailureReason.INTERRUPTED, "fetch interrupted");
            }
            return FetchResponse.failed(FailureReason.TRANSPORT, describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private EntityResult recordEmpty(PassContext ctx, String entityId, String rawBody) throws SQLException {
        Instant at = clock.instant();
        landing.append(LandingRecord.empty(ctx.tableName(), entityId, ctx.runId, rawBody, at));
        upsertEngine.acknowledgeEmpty(ctx.tableName(), entityId, at);
        return EntityResult.empty(entityId);
    }

    private EntityResult fail(PassContext ctx, String entityId, FailureReason reason, String message, String rawBody)
            throws SQLException {
        String table = ctx.tableName();
        Instant at = clock.instant();
        landing.append(LandingRecord.error(table, entityId, ctx.runId, reason, message, rawBody, at));
        int failures = watermarks.recordFailure(table, entityId, reason, at);
        boolean suspended = failures >= ctx.settings.failureCeiling;
        if (suspended) {
            LOG.warn("entity suspended table={} entity={} failures={} reason={} msg={}",
                    table, entityId, failures, reason.label(), message);
        } else {
            LOG.info("entity failed table={} entity={} failures={} reason={} msg={}",
                    table, entityId, failures, reason.label(), message);
        }
        return EntityResult.failed(entityId, reason, message, suspended);
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
