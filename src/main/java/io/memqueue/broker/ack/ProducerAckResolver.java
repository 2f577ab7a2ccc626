package io.memqueue.broker.ack;

import io.memqueue.core.batch.AckBatch;
import io.memqueue.core.batch.BatchList;
import io.memqueue.core.entry.AckCallback;
import io.memqueue.core.entry.ProducerAckState;
import io.memqueue.core.entry.QueueEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns retired batches into producer callbacks.
 * <p>
 * Entries are visited from the most recent to the oldest, across and
 * within batches. Producer IDs are issued in order, so confirming the
 * highest pending ID of a producer confirms every lower one as well: one
 * callback covers them all, and the older entries are then found to be at
 * or below {@code lastAck} and skipped.
 * <p>
 * Runs on the ack sequencer thread only.
 */
public final class ProducerAckResolver {

    /**
     * Resolves {@code retired} into an ordered wave of callbacks. The list is
     * left reversed (newest batch first).
     */
    public <E> List<Runnable> resolve(final BatchList<E> retired) {
        final List<Runnable> wave = new ArrayList<>();

        retired.reverse();
        for (final AckBatch<E> batch : retired) {
            for (int i = batch.count() - 1; i >= 0; i--) {
                final QueueEntry<E> entry = batch.rawEntry(i);
                final ProducerAckState producer = entry.producer();
                if (producer == null) {
                    continue;
                }

                if (entry.getProducerId() > producer.lastAck()) {
                    final AckCallback callback = producer.getCallback();
                    final int count = producer.acknowledgeUpTo(entry.getProducerId());
                    wave.add(() -> callback.onAck(count));
                }
                // credited now or by an earlier pass over an overlapping view
                entry.detachProducer();
            }
        }
        return wave;
    }
}
