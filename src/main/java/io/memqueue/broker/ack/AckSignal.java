package io.memqueue.broker.ack;

import io.memqueue.core.batch.AckBatch;
import io.memqueue.core.batch.BatchList;

/**
 * Messages delivered to the ack sequencer's mailbox.
 */
sealed interface AckSignal<E> permits AckSignal.NewBatches, AckSignal.BatchAcked, AckSignal.Shutdown {

    /** Batches issued to consumers, in issue order. */
    record NewBatches<E>(BatchList<E> batches) implements AckSignal<E> {
    }

    /** A consumer finished the batch. */
    record BatchAcked<E>(AckBatch<E> batch) implements AckSignal<E> {
    }

    record Shutdown<E>() implements AckSignal<E> {
    }
}
