/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.bus6.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only property accessor handed to the messaging components at construction time.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 *   Bus6Properties props = Bus6Properties.fromClasspath("bus6.properties");
 *   String host = props.getString("bus6.rabbitmq.host", "localhost");
 *   Duration lifetime = props.getDuration("bus6.connection.lifetime", Duration.ofMinutes(10));
 *   Map<String, String> rabbit = props.getSubProperties("bus6.rabbitmq.");
 * }</pre>
 *
 * <p>Instances are immutable and safe to share between threads. There is no
 * process-wide instance; each owner builds the one it needs.</p>
 */
public final class Bus6Properties {

    private static final Logger log = LoggerFactory.getLogger(Bus6Properties.class);

    private final Map<String, String> properties;

    private Bus6Properties(Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Bus6Properties of(Map<String, String> properties) {
        return new Bus6Properties(properties != null ? properties : Map.of());
    }

    /**
     * Load a properties file from the classpath. Values are overridden by JVM
     * system properties ({@code -Dkey=value}) with the same key. A missing
     * resource yields only the system-property overrides.
     */
    public static Bus6Properties fromClasspath(String resource) {
        Properties loaded = new Properties();
        try (InputStream is = Bus6Properties.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                loaded.load(is);
                log.info("Loaded {} properties from classpath:{}", loaded.size(), resource);
            } else {
                log.warn("Properties resource not found on classpath: {}", resource);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read classpath:" + resource, e);
        }
        Map<String, String> merged = new LinkedHashMap<>();
        loaded.stringPropertyNames().forEach(k -> merged.put(k, loaded.getProperty(k)));
        System.getProperties().stringPropertyNames().stream()
                .filter(k -> k.startsWith("bus6."))
                .forEach(k -> merged.put(k, System.getProperty(k)));
        return new Bus6Properties(merged);
    }

    // ─── Typed getters ─────────────────────────────────────────────

    /**
     * Raw property value, or {@code null} if absent.
     */
    public String getString(String key) {
        return properties.get(key);
    }

    public String getString(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = value(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            log.warn("Invalid integer '{}' for {}, using {}", val, key, defaultValue);
            return defaultValue;
        }
    }

    /**
     * {@code true} only for a case-insensitive {@code "true"}; anything else set is {@code false}.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String val = value(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val);
    }

    /**
     * Parse a duration. Accepts a bare number of milliseconds, a number with one of
     * the suffixes {@code ms}, {@code s}, {@code m}, {@code h}, or an ISO-8601
     * value such as {@code PT30S}. Unparseable values fall back to {@code defaultValue}.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = value(key);
        if (val == null) return defaultValue;
        try {
            return parseDuration(val.toLowerCase(Locale.ROOT));
        } catch (RuntimeException e) {
            log.warn("Invalid duration '{}' for {}, using {}", val, key, defaultValue);
            return defaultValue;
        }
    }

    private static Duration parseDuration(String text) {
        if (text.startsWith("pt")) {
            return Duration.parse(text.toUpperCase(Locale.ROOT));
        }
        int split = 0;
        while (split < text.length() && Character.isDigit(text.charAt(split))) split++;
        long amount = Long.parseLong(text.substring(0, split));
        String unit = text.substring(split).trim();
        switch (unit) {
            case "":
            case "ms":
                return Duration.ofMillis(amount);
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
    }

    /** Trimmed value, or {@code null} when absent or blank. */
    private String value(String key) {
        String raw = properties.get(key);
        if (raw == null || raw.isBlank()) return null;
        return raw.trim();
    }

    // ─── Namespace helpers ─────────────────────────────────────────

    /**
     * All properties under a prefix, with the prefix stripped.
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        Map.Entry::getValue,
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    public boolean containsKey(String key) {
        return properties.containsKey(key);
    }

    public int size() {
        return properties.size();
    }

    @Override
    public String toString() {
        // Never print credentials
        return properties.keySet().stream()
                .map(k -> k.contains("password") ? k + "=****" : k + "=" + properties.get(k))
                .collect(Collectors.joining(", ", "Bus6Properties{", "}"));
    }
}
