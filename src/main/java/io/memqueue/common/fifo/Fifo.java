package io.memqueue.common.fifo;

/**
 * Unsynchronized singly linked FIFO.
 * <p>
 * Intended for state owned by a single thread. {@link #concat(Fifo)} moves
 * the other queue's nodes in O(1) and leaves it empty.
 *
 * @param <T> element type
 */
public final class Fifo<T> {

    private Node<T> first;
    private Node<T> last;
    private int size;

    public void add(final T value) {
        final Node<T> node = new Node<>(value);
        if (first == null) {
            first = node;
        } else {
            last.next = node;
        }
        last = node;
        size++;
    }

    public boolean isEmpty() {
        return first == null;
    }

    public int size() {
        return size;
    }

    /**
     * @return the oldest value without removing it, or {@code null} when empty
     */
    public T first() {
        return first == null ? null : first.value;
    }

    /**
     * Removes and returns the oldest value, or {@code null} when empty.
     */
    public T consumeFirst() {
        final T result = first();
        remove();
        return result;
    }

    /** Drops the oldest value. No-op when empty. */
    public void remove() {
        if (first == null) return;

        final Node<T> removed = first;
        first = removed.next;
        removed.next = null;
        if (first == null) {
            last = null;
        }
        size--;
    }

    /**
     * Appends every node of {@code other}, taking ownership of them.
     */
    public void concat(final Fifo<T> other) {
        if (other == this) {
            throw new IllegalArgumentException("cannot concat a FIFO onto itself");
        }
        if (other.isEmpty()) return;

        if (isEmpty()) {
            first = other.first;
        } else {
            last.next = other.first;
        }
        last = other.last;
        size += other.size;

        other.first = null;
        other.last = null;
        other.size = 0;
    }

    public void clear() {
        while (first != null) {
            remove();
        }
    }

    private static final class Node<T> {
        private final T value;
        private Node<T> next;

        private Node(final T value) {
            this.value = value;
        }
    }
}
