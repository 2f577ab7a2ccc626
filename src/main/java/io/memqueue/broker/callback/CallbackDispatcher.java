package io.memqueue.broker.callback;

import java.util.List;

/**
 * Executes producer acknowledgment callbacks in waves.
 * <p>
 * Waves run in submission order and the callbacks of a wave run in list
 * order. A callback that throws is logged and does not stop the wave.
 */
public sealed interface CallbackDispatcher extends AutoCloseable
        permits AsyncCallbackDispatcher, InlineCallbackDispatcher {

    /**
     * Hands one wave of callbacks to the dispatcher.
     *
     * @throws IllegalStateException if the dispatcher has been closed
     */
    void submit(List<Runnable> wave);

    /**
     * @return waves accepted but not yet started
     */
    int pendingWaves();

    /**
     * @return true when the calling thread is the one running callbacks
     */
    default boolean isCallbackThread() {
        return false;
    }

    /**
     * Stops accepting waves and waits for the running wave to finish. From
     * a callback thread it requests the stop without waiting.
     */
    @Override
    void close();
}
