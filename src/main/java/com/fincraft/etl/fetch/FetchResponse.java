package com.fincraft.etl.fetch;

import com.fincraft.etl.model.FailureReason;
import com.fincraft.etl.model.FetchStatus;
import org.json.JSONObject;

/**
 * Result of one upstream call.
 */
public final class FetchResponse {
    public final FetchStatus status;
    public final JSONObject payload;
    public final String rawBody;
    public final FailureReason failureReason;
    public final String message;
    public final int httpStatus;
    public final long latencyMs;

    private FetchResponse(
            FetchStatus status,
            JSONObject payload,
            String rawBody,
            FailureReason failureReason,
            String message,
            int httpStatus,
            long latencyMs
    ) {
        this.status = status;
        this.payload = payload;
        this.rawBody = rawBody == null ? "" : rawBody;
        this.failureReason = failureReason == null ? FailureReason.NONE : failureReason;
        this.message = message == null ? "" : message;
        this.httpStatus = httpStatus;
        this.latencyMs = Math.max(0L, latencyMs);
    }

    public static FetchResponse success(JSONObject payload, String rawBody, int httpStatus, long latencyMs) {
        return new FetchResponse(FetchStatus.SUCCESS, payload, rawBody, FailureReason.NONE, "", httpStatus, latencyMs);
    }

    public static FetchResponse empty(String rawBody, int httpStatus, long latencyMs) {
        return new FetchResponse(FetchStatus.EMPTY, null, rawBody, FailureReason.NONE, "", httpStatus, latencyMs);
    }

    public static FetchResponse failed(FailureReason reason, String message, String rawBody, int httpStatus, long latencyMs) {
        FailureReason r = reason == null || reason == FailureReason.NONE ? FailureReason.OTHER : reason;
        return new FetchResponse(FetchStatus.ERROR, null, rawBody, r, message, httpStatus, latencyMs);
    }

    public static FetchResponse success(JSONObject payload) {
        return success(payload, payload == null ? "" : payload.toString(), 200, 0L);
    }

    public static FetchResponse failed(FailureReason reason, String message) {
        return failed(reason, message, "", 0, 0L);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    public FetchResponse withLatency(long elapsedMs) {
        return new FetchResponse(status, payload, rawBody, failureReason, message, httpStatus, elapsedMs);
    }
}
