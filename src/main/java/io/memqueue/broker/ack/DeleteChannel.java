package io.memqueue.broker.ack;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RunLoopHandle} for run loops that consume deletions as a channel:
 * every advancement enqueues its count, which the run loop takes in order.
 */
public final class DeleteChannel implements RunLoopHandle {

    private final BlockingQueue<Integer> deletions = new LinkedBlockingQueue<>();
    private final AtomicLong unblockSignals = new AtomicLong();

    @Override
    public void deleteEntries(final int count) {
        deletions.add(count);
    }

    @Override
    public void unblockProducers() {
        unblockSignals.incrementAndGet();
    }

    /**
     * Blocks until the next deletion count is available.
     */
    public int take() throws InterruptedException {
        return deletions.take();
    }

    /**
     * @return the next deletion count, or {@code null} if none arrived within the timeout
     */
    public Integer poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        return deletions.poll(timeout, unit);
    }

    public boolean isEmpty() {
        return deletions.isEmpty();
    }

    public long unblockSignals() {
        return unblockSignals.get();
    }
}
