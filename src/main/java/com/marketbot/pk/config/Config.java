package com.marketbot.pk.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then classpath {@code config.properties},
 * then {@code config.properties} in the working directory.
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
     * Config with only defaults plus the given overrides. Used by tests and embedded callers.
     */
    public static Config of(Map<String, String> overrides) {
        Config config = new Config(Path.of(".").toAbsolutePath().normalize());
        if (overrides != null) {
            for (Map.Entry<String, String> entry : overrides.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                config.overrideProps.setProperty(entry.getKey().trim(), entry.getValue());
                config.props.setProperty(entry.getKey().trim(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
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

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
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

    /**
     * Reads {@code KEY=value,KEY2=value2} into an ordered map with upper-cased keys.
     */
    public Map<String, String> getMap(String key) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String pair : getList(key)) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                continue;
            }
            String k = pair.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            String v = pair.substring(eq + 1).trim();
            if (!k.isEmpty() && !v.isEmpty()) {
                out.put(k, v);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

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
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/marketbot");
        defaults.put("db.user", "marketbot");
        defaults.put("db.pass", "marketbot");
        defaults.put("db.schema", "marketbot");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("psx.base_url", "https://dps.psx.com.pk");
        defaults.put("psx.market_watch_path", "/market-watch");
        defaults.put("psx.company_path", "/company/%s");

        defaults.put("fetch.timeout_sec", "30");
        defaults.put("fetch.connect_timeout_sec", "15");
        defaults.put("fetch.user_agent",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36");

        defaults.put("batch.size", "5");
        defaults.put("batch.delay_ms", "1000");
        defaults.put("batch.request_delay_ms", "300");
        defaults.put("batch.progress_every", "50");

        defaults.put("schedule.zone", "Asia/Karachi");
        defaults.put("schedule.daily", "15:45");
        defaults.put("schedule.full", "SUN 20:00");
        defaults.put("schedule.commodities", "18:00");

        defaults.put("commodity.gold_url", "https://gold.pk/");
        defaults.put("commodity.silver_url", "https://gold.pk/pakistan-silver-rates-xagp.php");

        defaults.put("logo.websites", "");

        return Collections.unmodifiableMap(defaults);
    }
}
