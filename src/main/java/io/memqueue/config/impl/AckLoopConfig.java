package io.memqueue.config.impl;

import io.memqueue.broker.ack.RetirementMode;
import io.memqueue.broker.callback.DispatchMode;
import io.memqueue.broker.callback.ShutdownPolicy;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable config holder for the ack sequencer, loaded from YAML.
 * Missing keys take their defaults.
 */
@Getter
public final class AckLoopConfig {

    public static final DispatchMode DEFAULT_DISPATCH_MODE = DispatchMode.ASYNC;
    public static final ShutdownPolicy DEFAULT_SHUTDOWN_POLICY = ShutdownPolicy.DROP_PENDING;
    public static final RetirementMode DEFAULT_RETIREMENT_MODE = RetirementMode.COLLAPSED;
    public static final int DEFAULT_BATCH_POOL_CAPACITY = 1024;
    public static final String DEFAULT_THREAD_NAME_PREFIX = "memqueue-ack";
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

    private DispatchMode dispatchMode = DEFAULT_DISPATCH_MODE;
    private ShutdownPolicy shutdownPolicy = DEFAULT_SHUTDOWN_POLICY;
    private RetirementMode retirementMode = DEFAULT_RETIREMENT_MODE;
    private int batchPoolCapacity = DEFAULT_BATCH_POOL_CAPACITY;
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private long shutdownTimeoutMillis = DEFAULT_SHUTDOWN_TIMEOUT_MILLIS;

    private AckLoopConfig() {
    }

    public static AckLoopConfig defaults() {
        return new AckLoopConfig();
    }

    public static AckLoopConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static AckLoopConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        return fromMap(m);
    }

    public static AckLoopConfig fromMap(final Map<String, ?> m) {
        final AckLoopConfig cfg = new AckLoopConfig();
        if (m == null) return cfg;

        if (m.containsKey("dispatchMode")) {
            cfg.dispatchMode = DispatchMode.valueOf(upper(m.get("dispatchMode")));
        }
        if (m.containsKey("shutdownPolicy")) {
            cfg.shutdownPolicy = ShutdownPolicy.valueOf(upper(m.get("shutdownPolicy")));
        }
        if (m.containsKey("retirementMode")) {
            cfg.retirementMode = RetirementMode.valueOf(upper(m.get("retirementMode")));
        }
        cfg.batchPoolCapacity     = number(m, "batchPoolCapacity", DEFAULT_BATCH_POOL_CAPACITY).intValue();
        cfg.threadNamePrefix      = string(m, "threadNamePrefix", DEFAULT_THREAD_NAME_PREFIX);
        cfg.shutdownTimeoutMillis = number(m, "shutdownTimeoutMillis", DEFAULT_SHUTDOWN_TIMEOUT_MILLIS).longValue();

        if (cfg.batchPoolCapacity < 0) {
            throw new IllegalArgumentException("batchPoolCapacity must be >= 0");
        }
        if (cfg.shutdownTimeoutMillis <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutMillis must be > 0");
        }
        return cfg;
    }

    public Duration shutdownTimeout() {
        return Duration.ofMillis(shutdownTimeoutMillis);
    }

    public AckLoopConfig withDispatchMode(final DispatchMode mode) {
        final AckLoopConfig copy = copy();
        copy.dispatchMode = mode;
        return copy;
    }

    public AckLoopConfig withShutdownPolicy(final ShutdownPolicy policy) {
        final AckLoopConfig copy = copy();
        copy.shutdownPolicy = policy;
        return copy;
    }

    public AckLoopConfig withRetirementMode(final RetirementMode mode) {
        final AckLoopConfig copy = copy();
        copy.retirementMode = mode;
        return copy;
    }

    private AckLoopConfig copy() {
        final AckLoopConfig copy = new AckLoopConfig();
        copy.dispatchMode = dispatchMode;
        copy.shutdownPolicy = shutdownPolicy;
        copy.retirementMode = retirementMode;
        copy.batchPoolCapacity = batchPoolCapacity;
        copy.threadNamePrefix = threadNamePrefix;
        copy.shutdownTimeoutMillis = shutdownTimeoutMillis;
        return copy;
    }

    private static Number number(final Map<String, ?> m, final String key, final Number fallback) {
        final Object value = m.get(key);
        if (value == null) return fallback;
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException(key + " must be a number, got: " + value);
        }
        return n;
    }

    private static String string(final Map<String, ?> m, final String key, final String fallback) {
        final Object value = m.get(key);
        if (value == null) return fallback;
        if (!(value instanceof String str)) {
            throw new IllegalArgumentException(key + " must be a string, got: " + value);
        }
        return str;
    }

    private static String upper(final Object value) {
        return String.valueOf(value).trim().toUpperCase(Locale.ROOT);
    }
}
