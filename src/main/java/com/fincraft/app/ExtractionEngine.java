package com.fincraft.app;

import com.fincraft.etl.catalog.CoverageScorer;
import com.fincraft.etl.catalog.EntityCatalog;
import com.fincraft.etl.catalog.SymbolScreener;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.db.BusinessRecordDao;
import com.fincraft.etl.db.CatalogDao;
import com.fincraft.etl.db.CoverageDao;
import com.fincraft.etl.db.Database;
import com.fincraft.etl.db.LandingDao;
import com.fincraft.etl.db.RunDao;
import com.fincraft.etl.db.WatermarkDao;
import com.fincraft.etl.fetch.UpstreamFetchService;
import com.fincraft.etl.pipeline.EntityProcessor;
import com.fincraft.etl.pipeline.UpsertEngine;
import com.fincraft.etl.query.FreshnessQueryService;
import com.fincraft.etl.runner.ExtractionRunner;
import com.fincraft.etl.scheduler.PriorityScheduler;
import com.fincraft.etl.table.TableRegistry;
import com.fincraft.etl.transform.PayloadTransformer;
import com.fincraft.etl.watermark.WatermarkStore;

import java.time.Clock;

/**
 * Wires the extraction components over one database. Shared by the CLI and the Spring configuration.
 */
public final class ExtractionEngine {
    private final Config config;
    private final TableRegistry registry;
    private final CatalogDao catalogDao;
    private final WatermarkDao watermarkDao;
    private final BusinessRecordDao businessRecordDao;
    private final RunDao runDao;
    private final CoverageDao coverageDao;
    private final EntityCatalog catalog;
    private final WatermarkStore watermarkStore;
    private final PriorityScheduler scheduler;
    private final ExtractionRunner runner;
    private final FreshnessQueryService freshness;

    public ExtractionEngine(Config config, Database database, UpstreamFetchService upstream, Clock clock) {
        this.config = config;
        this.registry = TableRegistry.builtIn();
        this.catalogDao = new CatalogDao(database, clock);
        this.watermarkDao = new WatermarkDao(database);
        this.businessRecordDao = new BusinessRecordDao(database);
        LandingDao landingDao = new LandingDao(database);
        this.runDao = new RunDao(database);
        this.coverageDao = new CoverageDao(database, registry, new CoverageScorer());
        this.catalog = new EntityCatalog(catalogDao, new SymbolScreener());
        this.watermarkStore = new WatermarkStore(catalog, watermarkDao, businessRecordDao);
        this.scheduler = new PriorityScheduler(watermarkStore, coverageDao);
        UpsertEngine upsertEngine = new UpsertEngine(businessRecordDao, watermarkStore);
        EntityProcessor processor = new EntityProcessor(
                upstream, new PayloadTransformer(), landingDao, watermarkStore, upsertEngine, clock);
        this.runner = new ExtractionRunner(scheduler, processor, runDao, clock);
        this.freshness = new FreshnessQueryService(watermarkDao, businessRecordDao, clock);
    }

    public ExtractionSettings settingsFor(String table) {
        return ExtractionSettings.forTable(config, table);
    }

    public TableRegistry registry() {
        return registry;
    }

    public EntityCatalog catalog() {
        return catalog;
    }

    public WatermarkStore watermarkStore() {
        return watermarkStore;
    }

    public PriorityScheduler scheduler() {
        return scheduler;
    }

    public ExtractionRunner runner() {
        return runner;
    }

    public FreshnessQueryService freshness() {
        return freshness;
    }

    public RunDao runDao() {
        return runDao;
    }

    public CoverageDao coverageDao() {
        return coverageDao;
    }
}
