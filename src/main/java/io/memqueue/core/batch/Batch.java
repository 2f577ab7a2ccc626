package io.memqueue.core.batch;

/**
 * Batch of events handed to a consumer.
 * <p>
 * {@link #done()} tells the queue the batch has been consumed and its
 * entries can be acknowledged and discarded.
 *
 * @param <E> event payload type
 */
public interface Batch<E> {
    int count();

    E entry(int i);

    void done();
}
