package com.marketbot.pk.parse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * PSX sector code to sector name, loaded once from {@code psx_sectors.properties}.
 */
public final class SectorCodes {
    private static final Logger LOG = LogManager.getLogger(SectorCodes.class);
    private static final String RESOURCE = "psx_sectors.properties";
    private static final Map<String, String> NAMES = load();

    private SectorCodes() {
    }

    public static String nameOf(String code) {
        if (code == null) {
            return null;
        }
        return NAMES.get(code.trim());
    }

    static int size() {
        return NAMES.size();
    }

    private static Map<String, String> load() {
        Properties props = new Properties();
        try (InputStream in = SectorCodes.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOG.warn("sector table {} not found on classpath", RESOURCE);
                return Collections.emptyMap();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        } catch (IOException e) {
            LOG.warn("failed to read sector table {}: {}", RESOURCE, e.getMessage());
            return Collections.emptyMap();
        }
        Map<String, String> out = new HashMap<>();
        for (String key : props.stringPropertyNames()) {
            out.put(key.trim(), props.getProperty(key).trim());
        }
        return Collections.unmodifiableMap(out);
    }
}
