package io.memqueue.config.type;

import io.memqueue.broker.ack.RetirementMode;
import io.memqueue.broker.callback.DispatchMode;
import io.memqueue.broker.callback.ShutdownPolicy;
import io.memqueue.config.impl.AckLoopConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void bundledDefaultsMatchBuiltInDefaults() throws Exception {
        final AckLoopConfig cfg = ConfigLoader.loadDefault();

        assertEquals(DispatchMode.ASYNC, cfg.getDispatchMode());
        assertEquals(ShutdownPolicy.DROP_PENDING, cfg.getShutdownPolicy());
        assertEquals(RetirementMode.COLLAPSED, cfg.getRetirementMode());
        assertEquals(AckLoopConfig.DEFAULT_BATCH_POOL_CAPACITY, cfg.getBatchPoolCapacity());
        assertEquals(AckLoopConfig.DEFAULT_THREAD_NAME_PREFIX, cfg.getThreadNamePrefix());
        assertEquals(Duration.ofSeconds(5), cfg.shutdownTimeout());
    }

    @Test
    void loadsFileAndFillsMissingKeys() throws Exception {
        final Path file = dir.resolve("ack.yaml");
        Files.writeString(file, String.join("\n",
                "dispatchMode: INLINE",
                "retirementMode: per_batch",
                "batchPoolCapacity: 16",
                ""));

        final AckLoopConfig cfg = ConfigLoader.load(file.toString());

        assertEquals(DispatchMode.INLINE, cfg.getDispatchMode());
        assertEquals(RetirementMode.PER_BATCH, cfg.getRetirementMode());
        assertEquals(16, cfg.getBatchPoolCapacity());
        assertEquals(ShutdownPolicy.DROP_PENDING, cfg.getShutdownPolicy());
        assertEquals(AckLoopConfig.DEFAULT_SHUTDOWN_TIMEOUT_MILLIS, cfg.getShutdownTimeoutMillis());
    }

    @Test
    void loadsClasspathResourceCaseInsensitively() throws Exception {
        final AckLoopConfig cfg = ConfigLoader.loadResource("ack-loop-drain.yaml");

        assertEquals(DispatchMode.ASYNC, cfg.getDispatchMode());
        assertEquals(ShutdownPolicy.DRAIN_PENDING, cfg.getShutdownPolicy());
        assertEquals(8, cfg.getBatchPoolCapacity());
        assertEquals("test-ack", cfg.getThreadNamePrefix());
        assertEquals(2_000L, cfg.getShutdownTimeoutMillis());
    }

    @Test
    void missingResourceFails() {
        assertThrows(IOException.class, () -> ConfigLoader.loadResource("does-not-exist.yaml"));
    }

    @Test
    void emptyDocumentYieldsDefaults() throws Exception {
        final Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "");

        final AckLoopConfig cfg = ConfigLoader.load(file.toString());

        assertEquals(AckLoopConfig.DEFAULT_DISPATCH_MODE, cfg.getDispatchMode());
        assertEquals(AckLoopConfig.DEFAULT_RETIREMENT_MODE, cfg.getRetirementMode());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> AckLoopConfig.fromMap(Map.of("dispatchMode", "sometimes")));
        assertThrows(IllegalArgumentException.class,
                () -> AckLoopConfig.fromMap(Map.of("batchPoolCapacity", -1)));
        assertThrows(IllegalArgumentException.class,
                () -> AckLoopConfig.fromMap(Map.of("shutdownTimeoutMillis", 0)));
    }

    @Test
    void wronglyTypedValuesNameTheirKey() {
        final IllegalArgumentException prefix = assertThrows(IllegalArgumentException.class,
                () -> AckLoopConfig.fromMap(Map.of("threadNamePrefix", 42)));
        assertTrue(prefix.getMessage().contains("threadNamePrefix"));

        final IllegalArgumentException capacity = assertThrows(IllegalArgumentException.class,
                () -> AckLoopConfig.fromMap(Map.of("batchPoolCapacity", "16")));
        assertTrue(capacity.getMessage().contains("batchPoolCapacity"));
    }

    @Test
    void withersLeaveOriginalUntouched() {
        final AckLoopConfig base = AckLoopConfig.defaults();
        final AckLoopConfig inline = base.withDispatchMode(DispatchMode.INLINE)
                .withShutdownPolicy(ShutdownPolicy.DRAIN_PENDING);

        assertEquals(DispatchMode.ASYNC, base.getDispatchMode());
        assertEquals(DispatchMode.INLINE, inline.getDispatchMode());
        assertEquals(ShutdownPolicy.DRAIN_PENDING, inline.getShutdownPolicy());
    }
}
