package io.memqueue.core.entry;

import lombok.Getter;

/**
 * One published item as seen by the ack sequencer.
 * <p>
 * The producer reference is a back pointer, not ownership. It is cleared
 * once the entry has been credited (or its producer cancelled) so that a
 * second pass over an overlapping batch view cannot credit it again.
 *
 * @param <E> event payload type
 */
public final class QueueEntry<E> {

    @Getter
    private final E event;

    @Getter
    private final long producerId;

    private ProducerAckState producer;

    public QueueEntry(final E event, final ProducerAckState producer, final long producerId) {
        this.event = event;
        this.producer = producer;
        this.producerId = producerId;
    }

    /**
     * @return the producer to credit, or {@code null} once detached
     */
    public ProducerAckState producer() {
        return producer;
    }

    public void detachProducer() {
        producer = null;
    }
}
