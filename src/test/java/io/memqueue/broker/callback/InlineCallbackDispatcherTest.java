package io.memqueue.broker.callback;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InlineCallbackDispatcherTest {

    @Test
    void runsWaveOnCallingThreadInOrder() {
        final InlineCallbackDispatcher dispatcher = new InlineCallbackDispatcher();
        final List<String> calls = new ArrayList<>();
        final Thread caller = Thread.currentThread();

        dispatcher.submit(List.of(
                () -> calls.add("a"),
                () -> { throw new RuntimeException("ignored"); },
                () -> calls.add(Thread.currentThread() == caller ? "same-thread" : "other-thread")));

        assertEquals(List.of("a", "same-thread"), calls);
        assertEquals(0, dispatcher.pendingWaves());
    }

    @Test
    void rejectsWavesAfterClose() {
        final InlineCallbackDispatcher dispatcher = new InlineCallbackDispatcher();
        dispatcher.close();

        assertThrows(IllegalStateException.class, () -> dispatcher.submit(List.of()));
    }
}
