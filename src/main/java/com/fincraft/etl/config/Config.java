package com.fincraft.etl.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：合并 classpath 中的 config.properties、工作目录覆盖文件与内置默认值，提供类型化读取。
 * 使用建议：新增配置项时同步补充 DEFAULTS，避免调用方各自写死回退值。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：先读 classpath 资源，再用工作目录下的同名文件覆盖，缺失项回落到内置默认值。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    /**
     * Config holding only the given entries on top of the defaults.
     */
    public static Config of(Map<String, String> values) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                putBoundValue(config, entry.getKey(), entry.getValue());
            }
        }
        return config;
    }

    public boolean has(String key) {
        String raw = key == null ? null : props.getProperty(key);
        return raw != null && !raw.trim().isEmpty();
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

/**
 * 方法说明：sourceOf，返回配置项实际生效的来源（override / resource / default）。
 */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/fincraft");
        defaults.put("db.user", "fincraft");
        defaults.put("db.pass", "fincraft");
        defaults.put("db.schema", "source");
        defaults.put("db.sql_log.enabled", "false");
        defaults.put("db.sql_log.slow_ms", "250");

        defaults.put("alphavantage.base_url", "https://www.alphavantage.co/query");
        defaults.put("alphavantage.api_key", "");

        defaults.put("fetch.concurrent", "4");
        defaults.put("fetch.timeout_sec", "30");
        defaults.put("fetch.requests_per_minute", "75");

        defaults.put("extract.max_failures", "3");
        defaults.put("extract.batch_size", "50");
        defaults.put("extract.progress.log_every", "25");
        defaults.put("extract.staleness_hours.core", "24");
        defaults.put("extract.staleness_hours.extended", "72");
        defaults.put("extract.staleness_hours.long_tail", "168");
        defaults.put("extract.staleness_hours.default", "24");

        defaults.put("tier.core_threshold", "0.70");
        defaults.put("tier.extended_threshold", "0.40");
        defaults.put("tier.neutral_score", "0.50");
        defaults.put("tier.coverage_floor", "0.20");

        return Collections.unmodifiableMap(defaults);
    }
}
