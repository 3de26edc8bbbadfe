package com.fincraft.etl.support;

import com.fincraft.etl.catalog.EntityCatalog;
import com.fincraft.etl.catalog.SymbolScreener;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.pipeline.EntityProcessor;
import com.fincraft.etl.pipeline.UpsertEngine;
import com.fincraft.etl.runner.ExtractionRunner;
import com.fincraft.etl.scheduler.PriorityScheduler;
import com.fincraft.etl.table.TableDescriptor;
import com.fincraft.etl.transform.PayloadTransformer;
import com.fincraft.etl.watermark.WatermarkStore;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * The extraction engine wired over in-memory stores.
 */
public final class EngineFixture {
    public final InMemoryCatalogRepository catalogRepo = new InMemoryCatalogRepository();
    public final InMemoryWatermarkRepository watermarkRepo = new InMemoryWatermarkRepository();
    public final InMemoryBusinessRecordRepository recordRepo = new InMemoryBusinessRecordRepository();
    public final InMemoryLandingRepository landingRepo = new InMemoryLandingRepository();
    public final InMemoryRunRepository runRepo = new InMemoryRunRepository();
    public final ScriptedFetchService upstream = new ScriptedFetchService();
    public final MutableClock clock;
    public final TableDescriptor table;
    public final ExtractionSettings settings;
    public final WatermarkStore watermarks;
    public final UpsertEngine upsertEngine;
    public final EntityProcessor processor;
    public final ExtractionRunner runner;

    public EngineFixture(Instant start, Map<String, String> overrides) {
        this(start, overrides, Payloads.statementTable());
    }

    public EngineFixture(Instant start, Map<String, String> overrides, TableDescriptor table) {
        this.clock = new MutableClock(start);
        this.table = table;
        Map<String, String> values = new HashMap<>();
        values.put("fetch.concurrent", "2");
        values.put("fetch.timeout_sec", "2");
        values.putAll(overrides);
        this.settings = ExtractionSettings.forTable(Config.of(values), table.getTableName());
        this.watermarks = new WatermarkStore(new EntityCatalog(catalogRepo, new SymbolScreener()), watermarkRepo, recordRepo);
        this.upsertEngine = new UpsertEngine(recordRepo, watermarks);
        this.processor = new EntityProcessor(upstream, new PayloadTransformer(), landingRepo, watermarks, upsertEngine, clock);
        this.runner = new ExtractionRunner(new PriorityScheduler(watermarks, null), processor, runRepo, clock);
    }
}
