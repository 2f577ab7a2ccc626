package io.memqueue.core.batch;

import io.memqueue.core.entry.QueueEntry;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded free list of {@link AckBatch} objects.
 * <p>
 * The run loop acquires, the ack sequencer releases. Both sides may run on
 * different threads. Batches released beyond {@code capacity} are left to
 * the garbage collector.
 *
 * @param <E> event payload type
 */
public final class BatchPool<E> {

    private final ConcurrentLinkedQueue<AckBatch<E>> free = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pooled = new AtomicInteger();
    private final int capacity;

    public BatchPool(final int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
        this.capacity = capacity;
    }

    public AckBatch<E> acquire(final List<QueueEntry<E>> buffer,
                               final int start,
                               final int count,
                               final Consumer<AckBatch<E>> onDone) {
        AckBatch<E> batch = free.poll();
        if (batch != null) {
            pooled.decrementAndGet();
        } else {
            batch = new AckBatch<>();
        }
        batch.init(buffer, start, count, onDone);
        return batch;
    }

    /**
     * Returns a fully retired batch to the pool. The batch must not be
     * referenced by the caller afterwards.
     */
    public void release(final AckBatch<E> batch) {
        batch.reset();
        if (pooled.incrementAndGet() <= capacity) {
            free.offer(batch);
        } else {
            pooled.decrementAndGet();
        }
    }

    /**
     * @return number of batches currently available for reuse
     */
    public int available() {
        return pooled.get();
    }
}
