package io.memqueue.core.batch;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Ordered ledger of in-flight batches, linked through {@link AckBatch#next}.
 * <p>
 * Not thread-safe: a list is owned by one thread at a time and ownership
 * moves with {@link #concat(BatchList)}. A batch can be a member of one
 * list only.
 *
 * @param <E> event payload type
 */
public final class BatchList<E> implements Iterable<AckBatch<E>> {

    private AckBatch<E> head;
    private AckBatch<E> tail;
    private int size;

    /**
     * Adds {@code batch} at the end of this list.
     * <p>
     * The batch must not be a member of any list; {@link #pop()} unlinks it.
     * Only a batch with a successor, or the tail of this list, is detected
     * here: the tail of another list is not, and appending it corrupts that
     * list.
     *
     * @throws IllegalStateException if the batch is visibly linked
     */
    public void append(final AckBatch<E> batch) {
        if (batch.next != null || batch == tail) {
            throw new IllegalStateException("batch is already linked into a list");
        }
        if (head == null) {
            head = batch;
        } else {
            tail.next = batch;
        }
        tail = batch;
        size++;
    }

    /**
     * Moves every batch of {@code other} to the end of this list; {@code other}
     * is left empty.
     */
    public void concat(final BatchList<E> other) {
        if (other == this) {
            throw new IllegalArgumentException("cannot concat a list onto itself");
        }
        if (other.head == null) return;

        if (head == null) {
            head = other.head;
        } else {
            tail.next = other.head;
        }
        tail = other.tail;
        size += other.size;

        other.head = null;
        other.tail = null;
        other.size = 0;
    }

    /**
     * @return the oldest batch without removing it, or {@code null} when empty
     */
    public AckBatch<E> front() {
        return head;
    }

    /**
     * Removes and returns the oldest batch, or {@code null} when empty.
     */
    public AckBatch<E> pop() {
        final AckBatch<E> batch = head;
        if (batch == null) return null;

        head = batch.next;
        if (head == null) {
            tail = null;
        }
        batch.next = null;
        size--;
        return batch;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public int size() {
        return size;
    }

    /** Reverses the list in place. */
    public void reverse() {
        AckBatch<E> prev = null;
        AckBatch<E> current = head;
        tail = head;
        while (current != null) {
            final AckBatch<E> following = current.next;
            current.next = prev;
            prev = current;
            current = following;
        }
        head = prev;
    }

    /**
     * @return total number of entries across all batches
     */
    public long eventCount() {
        long total = 0;
        for (AckBatch<E> b = head; b != null; b = b.next) {
            total += b.count();
        }
        return total;
    }

    @Override
    public Iterator<AckBatch<E>> iterator() {
        return new Iterator<>() {
            private AckBatch<E> cursor = head;

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public AckBatch<E> next() {
                if (cursor == null) throw new NoSuchElementException();
                final AckBatch<E> current = cursor;
                cursor = current.next;
                return current;
            }
        };
    }
}
