package com.fincraft.app;

import com.fincraft.app.properties.AlphaVantageProperties;
import com.fincraft.app.properties.DbProperties;
import com.fincraft.app.properties.FetchProperties;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.db.Database;
import com.fincraft.etl.db.MigrationRunner;
import com.fincraft.etl.fetch.AlphaVantageClient;
import com.fincraft.etl.fetch.RequestThrottle;
import com.fincraft.etl.fetch.UpstreamFetchService;
import com.fincraft.etl.query.FreshnessQueryService;
import com.fincraft.etl.runner.ExtractionRunner;
import com.fincraft.etl.scheduler.PriorityScheduler;
import com.fincraft.etl.table.TableRegistry;
import com.fincraft.etl.watermark.WatermarkStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Spring wiring for hosts that embed the engine. Everything touching the database is lazy.
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, AlphaVantageProperties.class, FetchProperties.class})
public class FinCraftBootstrapConfig {
    @Bean
    public Config fincraftConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Clock fincraftClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TableRegistry tableRegistry() {
        return TableRegistry.builtIn();
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                firstNonBlank(System.getenv("FINCRAFT_DB_URL"), dbProperties.getUrl()),
                firstNonBlank(System.getenv("FINCRAFT_DB_USER"), dbProperties.getUser()),
                firstNonBlank(System.getenv("FINCRAFT_DB_PASS"), dbProperties.getPass()),
                dbProperties.getSchema(),
                dbProperties.getSqlLog() != null && dbProperties.getSqlLog().isEnabled(),
                dbProperties.getSqlLog() == null ? 250L : dbProperties.getSqlLog().getSlowMs()
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public UpstreamFetchService upstreamFetchService(AlphaVantageProperties alphaVantage, FetchProperties fetch) {
        return new AlphaVantageClient(
                alphaVantage.getBaseUrl(),
                firstNonBlank(System.getenv("ALPHAVANTAGE_API_KEY"), alphaVantage.getApiKey()),
                Duration.ofSeconds(Math.max(1, fetch.getTimeoutSec())),
                RequestThrottle.perMinute(fetch.getRequestsPerMinute())
        );
    }

    @Bean
    @Lazy
    public ExtractionEngine extractionEngine(Config config, Database database, UpstreamFetchService upstream, Clock clock) {
        return new ExtractionEngine(config, database, upstream, clock);
    }

    @Bean
    @Lazy
    public WatermarkStore watermarkStore(ExtractionEngine engine) {
        return engine.watermarkStore();
    }

    @Bean
    @Lazy
    public PriorityScheduler priorityScheduler(ExtractionEngine engine) {
        return engine.scheduler();
    }

    @Bean
    @Lazy
    public ExtractionRunner extractionRunner(ExtractionEngine engine) {
        return engine.runner();
    }

    @Bean
    @Lazy
    public FreshnessQueryService freshnessQueryService(ExtractionEngine engine) {
        return engine.freshness();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
