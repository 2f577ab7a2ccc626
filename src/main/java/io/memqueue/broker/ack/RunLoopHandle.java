package io.memqueue.broker.ack;

/**
 * The ack sequencer's view of the queue run loop that owns the entry buffer.
 */
public interface RunLoopHandle {

    /**
     * Called once per advancement with the number of acknowledged entries,
     * oldest first, that can now be deleted from the buffer.
     */
    void deleteEntries(int count);

    /**
     * Called after an advancement that retired more than one batch, so that
     * producers blocked on a full buffer are woken up.
     */
    default void unblockProducers() {
    }
}
