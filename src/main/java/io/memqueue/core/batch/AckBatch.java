package io.memqueue.core.batch;

import io.memqueue.core.entry.QueueEntry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A view of {@code count} consecutive entries of a shared entry buffer,
 * starting at {@code start} and wrapping around the buffer's end.
 * <p>
 * Instances are recycled through {@link BatchPool}. The {@code acked} flag
 * and the {@code next} link belong to the ack sequencer; consumers only see
 * the {@link Batch} methods.
 *
 * @param <E> event payload type
 */
public final class AckBatch<E> implements Batch<E> {

    private List<QueueEntry<E>> buffer;
    private int start;
    private int count;
    private Consumer<AckBatch<E>> onDone;

    private final AtomicBoolean doneCalled = new AtomicBoolean();

    /* sequencer only */
    private boolean acked;

    /* intrusive link for BatchList */
    AckBatch<E> next;

    AckBatch() {
    }

    void init(final List<QueueEntry<E>> buffer,
              final int start,
              final int count,
              final Consumer<AckBatch<E>> onDone) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(onDone, "onDone");
        if (count < 0 || count > buffer.size()) {
            throw new IllegalArgumentException(
                    "batch count " + count + " outside buffer of size " + buffer.size());
        }
        if (count > 0 && (start < 0 || start >= buffer.size())) {
            throw new IllegalArgumentException(
                    "batch start " + start + " outside buffer of size " + buffer.size());
        }

        this.buffer = buffer;
        this.start = start;
        this.count = count;
        this.onDone = onDone;
    }

    void reset() {
        buffer = null;
        start = 0;
        count = 0;
        onDone = null;
        doneCalled.set(false);
        acked = false;
        next = null;
    }

    @Override
    public int count() {
        return count;
    }

    @Override
    public E entry(final int i) {
        return rawEntry(i).getEvent();
    }

    /**
     * @return the queue entry at position {@code i} of this batch
     */
    public QueueEntry<E> rawEntry(final int i) {
        if (i < 0 || i >= count) {
            throw new IndexOutOfBoundsException("index " + i + " outside batch of " + count);
        }
        return buffer.get((start + i) % buffer.size());
    }

    /**
     * Consumer-side acknowledgment. Hands the batch to the ack sequencer.
     *
     * @throws IllegalStateException if the batch was already acknowledged
     */
    @Override
    public void done() {
        if (!doneCalled.compareAndSet(false, true)) {
            throw new IllegalStateException("batch acknowledged twice");
        }
        onDone.accept(this);
    }

    public boolean isAcked() {
        return acked;
    }

    /**
     * Sets the completion flag. Called by the ack sequencer only.
     *
     * @throws IllegalStateException if the flag was already set
     */
    public void markAcked() {
        if (acked) {
            throw new IllegalStateException("batch completion flag set twice");
        }
        acked = true;
    }
}
