package io.memqueue.core.entry;

/**
 * Counted completion callback: receives the number of entries newly
 * acknowledged since the previous invocation.
 */
@FunctionalInterface
public interface AckCallback {
    void onAck(int count);
}
