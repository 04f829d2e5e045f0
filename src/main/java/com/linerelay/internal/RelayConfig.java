package com.linerelay.internal;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Server settings. {@link #load(String...)} layers, lowest first: built-in
 * defaults, {@code relay.properties} on the classpath, JVM system properties,
 * then {@code --key=value} arguments.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@ToString
public class RelayConfig {
    public static final String CONFIG_FILE = "relay.properties";

    public static final String HOST = "relay.host";
    public static final String PORT = "relay.port";
    public static final String CORE_THREADS = "relay.core-threads";
    public static final String MAX_THREADS = "relay.max-threads";
    public static final String MAX_LINE_BYTES = "relay.max-line-bytes";
    public static final String TCP_NO_DELAY = "relay.tcp-no-delay";

    @Builder.Default
    private final String host = "127.0.0.1";
    @Builder.Default
    private final int port = 8888;
    @Builder.Default
    private final int coreThreads = 4;
    /** 0 means no upper bound. */
    @Builder.Default
    private final int maxThreads = 0;
    @Builder.Default
    private final int maxLineBytes = 1024 * 1024;
    @Builder.Default
    private final boolean tcpNoDelay = true;

    public static RelayConfig defaults() {
        return RelayConfig.builder().build();
    }

    public static RelayConfig load(String... args) {
        Properties props = new Properties();
        try (InputStream input = RelayConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                log.debug("[CONFIG] {} not on classpath, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            log.warn("[CONFIG] Failed to load {}: {}", CONFIG_FILE, e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("relay.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }
        for (String arg : args) {
            if (!arg.startsWith("--") || !arg.contains("=")) {
                throw new IllegalArgumentException("Expected --key=value, got: " + arg);
            }
            String[] kv = arg.substring(2).split("=", 2);
            String key = kv[0].startsWith("relay.") ? kv[0] : "relay." + kv[0];
            props.setProperty(key, kv[1]);
        }
        return fromProperties(props);
    }

    public static RelayConfig fromProperties(Properties props) {
        RelayConfig d = defaults();
        RelayConfig config = RelayConfig.builder()
              .host(props.getProperty(HOST, d.host).trim())
              .port(intValue(props, PORT, d.port, 0, 65535))
              .coreThreads(intValue(props, CORE_THREADS, d.coreThreads, 1, Integer.MAX_VALUE))
              .maxThreads(intValue(props, MAX_THREADS, d.maxThreads, 0, Integer.MAX_VALUE))
              .maxLineBytes(intValue(props, MAX_LINE_BYTES, d.maxLineBytes, 1, Integer.MAX_VALUE))
              .tcpNoDelay(booleanValue(props, TCP_NO_DELAY, d.tcpNoDelay))
              .build();
        if (config.maxThreads != 0 && config.maxThreads < config.coreThreads) {
            throw new IllegalArgumentException(MAX_THREADS + " must be 0 or >= " + CORE_THREADS);
        }
        return config;
    }

    private static int intValue(Properties props, String key, int fallback, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " out of range [" + min + ", " + max + "]: " + value);
        }
        return value;
    }

    private static boolean booleanValue(Properties props, String key, boolean fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        String v = raw.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + raw);
    }
}
