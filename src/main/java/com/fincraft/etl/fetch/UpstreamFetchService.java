package com.fincraft.etl.fetch;

import com.fincraft.etl.table.TableDescriptor;

import java.util.Map;

/**
 * Rate-limited upstream data source. Implementations report failures through {@link FetchResponse}
 * rather than by throwing.
 */
public interface UpstreamFetchService {

    /**
     * Blocks until the shared request budget allows another call. Callers wait here before starting
     * the fetch timeout, so queueing behind the budget never counts as a timed-out fetch.
     */
    default void awaitPermit() throws InterruptedException {
    }

    FetchResponse fetch(String entityId, TableDescriptor table, Map<String, String> params) throws InterruptedException;
}
