package io.memqueue.broker.callback;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs each wave on the submitting thread. Only suitable when callbacks are
 * guaranteed to return quickly: a slow callback stalls the submitter.
 */
@Slf4j
public final class InlineCallbackDispatcher implements CallbackDispatcher {

    private volatile boolean closed;

    @Override
    public void submit(final List<Runnable> wave) {
        if (closed) {
            throw new IllegalStateException("dispatcher is closed");
        }
        CallbackRunner.runWave(wave);
    }

    @Override
    public int pendingWaves() {
        return 0;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Inline callback dispatcher closed");
        }
    }
}
