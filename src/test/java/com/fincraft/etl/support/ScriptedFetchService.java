package com.fincraft.etl.support;

import com.fincraft.etl.fetch.FetchResponse;
import com.fincraft.etl.fetch.RequestThrottle;
import com.fincraft.etl.fetch.UpstreamFetchService;
import com.fincraft.etl.table.TableDescriptor;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Upstream stand-in. Responses are queued per entity; the last one repeats.
 */
public final class ScriptedFetchService implements UpstreamFetchService {
    private final Map<String, Deque<FetchResponse>> scripts = new HashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private volatile Consumer<String> onFetch = id -> { };
    private volatile RequestThrottle throttle = new RequestThrottle(0L);

    public synchronized ScriptedFetchService respond(String entityId, FetchResponse... responses) {
        Deque<FetchResponse> queue = scripts.computeIfAbsent(entityId, id -> new ArrayDeque<>());
        for (FetchResponse r : responses) {
            queue.addLast(r);
        }
        return this;
    }

    public ScriptedFetchService delay(String entityId, Duration delay) {
        delays.put(entityId, delay);
        return this;
    }

    public ScriptedFetchService onFetch(Consumer<String> hook) {
        this.onFetch = hook;
        return this;
    }

    public ScriptedFetchService throttle(RequestThrottle value) {
        this.throttle = value;
        return this;
    }

    public int calls(String entityId) {
        AtomicInteger n = calls.get(entityId);
        return n == null ? 0 : n.get();
    }

    public int totalCalls() {
        int total = 0;
        for (AtomicInteger n : calls.values()) {
            total += n.get();
        }
        return total;
    }

    @Override
    public void awaitPermit() throws InterruptedException {
        throttle.acquire();
    }

    @Override
    public FetchResponse fetch(String entityId, TableDescriptor table, Map<String, String> params) throws InterruptedException {
        calls.computeIfAbsent(entityId, id -> new AtomicInteger()).incrementAndGet();
        onFetch.accept(entityId);
        Duration delay = delays.get(entityId);
        if (delay != null) {
            Thread.sleep(delay.toMillis());
        }
        return next(entityId);
    }

    private synchronized FetchResponse next(String entityId) {
        Deque<FetchResponse> queue = scripts.get(entityId);
        if (queue == null || queue.isEmpty()) {
            return FetchResponse.empty("", 200, 0L);
        }
        return queue.size() == 1 ? queue.peekFirst() : queue.pollFirst();
    }
}
