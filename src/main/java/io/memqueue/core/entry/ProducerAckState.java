package io.memqueue.core.entry;

import lombok.Getter;

import java.util.Objects;

/**
 * Per-producer acknowledgment bookkeeping.
 * <p>
 * Two writers touch this object, each owning its own field:
 * <ul>
 *   <li>the producer thread advances {@code lastIssued} through {@link #issue(Object)};</li>
 *   <li>the ack sequencer advances {@code lastAck} through {@link #acknowledgeUpTo(long)}.</li>
 * </ul>
 */
public final class ProducerAckState {

    @Getter
    private final AckCallback callback;

    /* producer thread only */
    private long lastIssued;

    /* ack sequencer only; volatile so other threads can observe progress */
    private volatile long lastAck;

    public ProducerAckState(final AckCallback callback) {
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    /**
     * Wraps {@code event} into an entry carrying the next producer-scoped ID.
     * IDs start at 1 and increase by one per call.
     */
    public <E> QueueEntry<E> issue(final E event) {
        return new QueueEntry<>(event, this, ++lastIssued);
    }

    /**
     * @return the highest producer ID already credited to {@link #getCallback()}
     */
    public long lastAck() {
        return lastAck;
    }

    /**
     * Moves {@code lastAck} forward to {@code producerId} and returns how many
     * entries that confirms.
     *
     * @throws IllegalStateException if {@code producerId} is not beyond the current position
     */
    public int acknowledgeUpTo(final long producerId) {
        final long previous = lastAck;
        if (producerId <= previous) {
            throw new IllegalStateException(
                    "lastAck must increase: current=" + previous + ", requested=" + producerId);
        }
        lastAck = producerId;
        return Math.toIntExact(producerId - previous);
    }
}
