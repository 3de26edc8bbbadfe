package com.fincraft.app;

import com.fincraft.etl.catalog.ListingCsvParser;
import com.fincraft.etl.catalog.TierClassifier;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.config.ExtractionSettings;
import com.fincraft.etl.db.Database;
import com.fincraft.etl.db.MigrationRunner;
import com.fincraft.etl.fetch.AlphaVantageClient;
import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityFreshness;
import com.fincraft.etl.model.RunRow;
import com.fincraft.etl.model.Tier;
import com.fincraft.etl.query.SuspensionReport;
import com.fincraft.etl.runner.PassReport;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Operator CLI. Exit codes: 0 ok, 1 every processed entity failed, 2 usage or configuration error,
 * 3 infrastructure failure.
 */
public final class FinCraftApplication {
    private static final Logger LOG = LogManager.getLogger(FinCraftApplication.class);
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_ALL_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INFRA = 3;

    public static void main(String[] args) {
        int exit = new FinCraftApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("fincraft", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("fincraft", options);
            return args == null || args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            Database database = new Database(
                    firstNonBlank(System.getenv("FINCRAFT_DB_URL"), config.getString("db.url")),
                    firstNonBlank(System.getenv("FINCRAFT_DB_USER"), config.getString("db.user")),
                    firstNonBlank(System.getenv("FINCRAFT_DB_PASS"), config.getString("db.pass")),
                    config.getString("db.schema"),
                    config.getBoolean("db.sql_log.enabled", false),
                    config.getLong("db.sql_log.slow_ms", 250L)
            );
            System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
            new MigrationRunner().run(database);

            Clock clock = Clock.systemUTC();
            ExtractionEngine engine = new ExtractionEngine(config, database, new AlphaVantageClient(config), clock);
            engine.runDao().recoverDanglingRuns(clock.instant());
            return dispatch(cmd, engine, clock);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (SQLException e) {
            LOG.error("infrastructure failure: {}", e.getMessage(), e);
            return EXIT_INFRA;
        } catch (IllegalStateException e) {
            LOG.error("cannot proceed: {}", e.getMessage());
            return EXIT_INFRA;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("interrupted");
            return EXIT_INFRA;
        } catch (IOException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    int dispatch(CommandLine cmd, ExtractionEngine engine, Clock clock)
            throws SQLException, InterruptedException, IOException {
        if (cmd.hasOption("extract")) {
            return runExtract(cmd, engine);
        }
        if (cmd.hasOption("reset-failures")) {
            TableDescriptor table = requireTable(cmd, engine);
            String entity = trimToNull(cmd.getOptionValue("entity"));
            int rows = engine.watermarkStore().resetFailures(table.getTableName(), entity, clock.instant());
            System.out.println("reset_failures table=" + table.getTableName()
                    + " entity=" + (entity == null ? "*" : entity) + " rows=" + rows);
            return EXIT_OK;
        }
        if (cmd.hasOption("report-suspended")) {
            List<String> tables = new ArrayList<>();
            if (cmd.hasOption("table")) {
                tables.add(requireTable(cmd, engine).getTableName());
            } else {
                tables.addAll(engine.registry().tableNames());
            }
            SuspensionReport report = engine.freshness().suspended(tables, t -> engine.settingsFor(t).failureCeiling);
            report.toLines().forEach(System.out::println);
            return EXIT_OK;
        }
        if (cmd.hasOption("freshness")) {
            return printFreshness(cmd, engine);
        }
        if (cmd.hasOption("tiers")) {
            return printTiers(cmd, engine, clock);
        }
        if (cmd.hasOption("import-listing")) {
            Path file = Path.of(cmd.getOptionValue("import-listing"));
            String body = Files.readString(file, StandardCharsets.UTF_8);
            List<CatalogEntity> entities = new ListingCsvParser().parse(body, "listing");
            int count = engine.catalog().importListing("listing", entities);
            System.out.println("import_listing file=" + file + " rows=" + count);
            return EXIT_OK;
        }
        if (cmd.hasOption("seed-indicators")) {
            int count = engine.catalog().seedIndicators();
            System.out.println("seed_indicators rows=" + count);
            return EXIT_OK;
        }
        if (cmd.hasOption("recent-runs")) {
            int limit = parsePositiveInt(cmd.getOptionValue("limit"), 20);
            for (RunRow row : engine.runDao().listRecent(limit)) {
                System.out.println(String.format(
                        Locale.US,
                        "%s %-28s %-8s started=%s scheduled=%d ins=%d upd=%d unch=%d empty=%d err=%d susp=%d",
                        row.runId,
                        row.tableName,
                        row.status,
                        row.startedAt == null ? "-" : ISO.format(row.startedAt),
                        row.scheduledCount,
                        row.insertedCount,
                        row.updatedCount,
                        row.unchangedCount,
                        row.emptyCount,
                        row.errorCount,
                        row.suspendedCount
                ));
            }
            return EXIT_OK;
        }
        throw new IllegalArgumentException("no command given, see --help");
    }

    private int runExtract(CommandLine cmd, ExtractionEngine engine) throws SQLException, InterruptedException {
        TableDescriptor table = requireTable(cmd, engine);
        ExtractionSettings settings = engine.settingsFor(table.getTableName());
        int batchSize = parsePositiveInt(cmd.getOptionValue("limit"), settings.batchSize);
        Instant asOf = parseAsOf(cmd.getOptionValue("as-of"));

        CountDownLatch done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            engine.runner().abort();
            try {
                done.await(settings.fetchTimeout.toSeconds() + 5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "fincraft-abort");
        Runtime.getRuntime().addShutdownHook(hook);
        PassReport report;
        try {
            report = engine.runner().run(table, settings, batchSize, asOf);
        } finally {
            done.countDown();
        }

        System.out.println("run_id=" + report.runId + " table=" + report.tableName + " status=" + report.status
                + " due=" + report.dueCount + " scheduled=" + report.scheduled);
        System.out.println(report.countsLine());
        System.out.println("errors " + report.errorClassLine());
        LOG.info("pass summary\n{}", report.summary);
        return report.allFailed() ? EXIT_ALL_FAILED : EXIT_OK;
    }

    private int printFreshness(CommandLine cmd, ExtractionEngine engine) throws SQLException {
        TableDescriptor table = requireTable(cmd, engine);
        int ceiling = engine.settingsFor(table.getTableName()).failureCeiling;
        String entity = trimToNull(cmd.getOptionValue("entity"));
        List<EntityFreshness> rows = new ArrayList<>();
        if (entity != null) {
            rows.add(engine.freshness().freshness(table.getTableName(), entity, ceiling));
        } else {
            List<EntityFreshness> all = engine.freshness().freshness(table.getTableName(), ceiling);
            int limit = parsePositiveInt(cmd.getOptionValue("limit"), 20);
            rows.addAll(all.subList(0, Math.min(limit, all.size())));
        }
        for (EntityFreshness f : rows) {
            System.out.println(String.format(
                    Locale.US,
                    "%-14s state=%-13s covered=%s stored=%s last_success=%s age_h=%s failures=%d reason=%s",
                    f.entityId,
                    f.state,
                    f.lastPeriodCovered == null ? "-" : f.lastPeriodCovered,
                    f.latestStoredPeriod == null ? "-" : f.latestStoredPeriod,
                    f.lastSuccessTime == null ? "-" : ISO.format(f.lastSuccessTime),
                    f.ageHours == null ? "-" : f.ageHours,
                    f.consecutiveFailures,
                    f.lastFailureReason == null ? "-" : f.lastFailureReason
            ));
        }
        return EXIT_OK;
    }

    private int printTiers(CommandLine cmd, ExtractionEngine engine, Clock clock) throws SQLException {
        TableDescriptor table = requireTable(cmd, engine);
        ExtractionSettings settings = engine.settingsFor(table.getTableName());
        LocalDate asOf = clock.instant().atZone(ZoneOffset.UTC).toLocalDate();
        Map<String, Double> scores = engine.coverageDao().coverageScores(table.getTableName(), asOf);
        List<String> ids = new ArrayList<>();
        for (CatalogEntity entity : engine.catalog().trackable(table)) {
            ids.add(entity.entityId);
        }
        Map<String, Tier> tiers = TierClassifier.from(settings).classifyAll(ids, scores);
        Map<Tier, Integer> counts = new EnumMap<>(Tier.class);
        int belowFloor = 0;
        for (Map.Entry<String, Tier> e : tiers.entrySet()) {
            counts.merge(e.getValue(), 1, Integer::sum);
            Double score = scores.get(e.getKey());
            if (score != null && score < settings.coverageFloor) {
                belowFloor++;
            }
        }
        System.out.println("tiers table=" + table.getTableName() + " entities=" + ids.size());
        for (Tier tier : Tier.values()) {
            System.out.println("  " + tier.label() + "=" + counts.getOrDefault(tier, 0));
        }
        System.out.println("  below_floor=" + belowFloor);
        return EXIT_OK;
    }

    private TableDescriptor requireTable(CommandLine cmd, ExtractionEngine engine) {
        String name = trimToNull(cmd.getOptionValue("table"));
        if (name == null) {
            throw new IllegalArgumentException("--table is required; known tables: " + engine.registry().tableNames());
        }
        return engine.registry().require(name.toLowerCase(Locale.ROOT));
    }

    static Instant parseAsOf(String raw) {
        String text = trimToNull(raw);
        if (text == null) {
            return null;
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--as-of must be yyyy-MM-dd or an ISO instant: " + text);
        }
    }

    static int parsePositiveInt(String raw, int fallback) {
        String text = trimToNull(raw);
        if (text == null) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(text);
            if (value <= 0) {
                throw new IllegalArgumentException("expected a positive integer: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected a positive integer: " + text);
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("extract").desc("run one scheduling pass for --table").build());
        options.addOption(Option.builder().longOpt("reset-failures").desc("clear the failure streak of --table (optionally one --entity)").build());
        options.addOption(Option.builder().longOpt("report-suspended").desc("list entities held back by the failure ceiling").build());
        options.addOption(Option.builder().longOpt("freshness").desc("show watermark freshness for --table (optionally one --entity)").build());
        options.addOption(Option.builder().longOpt("tiers").desc("show the tier distribution for --table").build());
        options.addOption(Option.builder().longOpt("import-listing").hasArg().argName("file").desc("import a listing CSV into the entity catalog").build());
        options.addOption(Option.builder().longOpt("seed-indicators").desc("register the built-in macro indicator series").build());
        options.addOption(Option.builder().longOpt("recent-runs").desc("list recent extraction passes").build());
        options.addOption(Option.builder().longOpt("table").hasArg().argName("name").desc("target table").build());
        options.addOption(Option.builder().longOpt("entity").hasArg().argName("id").desc("single entity id").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("batch size or row limit").build());
        options.addOption(Option.builder().longOpt("as-of").hasArg().argName("iso").desc("evaluate staleness as of this date or instant").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (FinCraftApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("fincraft.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(FinCraftApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (IOException | RuntimeException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            String t = trimToNull(value);
            if (t != null) {
                return t;
            }
        }
        return "";
    }
}
