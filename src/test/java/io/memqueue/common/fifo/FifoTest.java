package io.memqueue.common.fifo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FifoTest {

    @Test
    void emptyFifoReturnsNullAndRemoveIsNoOp() {
        final Fifo<String> fifo = new Fifo<>();

        assertTrue(fifo.isEmpty());
        assertNull(fifo.first());
        assertNull(fifo.consumeFirst());
        fifo.remove();
        assertEquals(0, fifo.size());
    }

    @Test
    void consumesInInsertionOrder() {
        final Fifo<Integer> fifo = new Fifo<>();
        fifo.add(1);
        fifo.add(2);
        fifo.add(3);

        assertEquals(3, fifo.size());
        assertEquals(1, fifo.first());
        assertEquals(1, fifo.consumeFirst());
        assertEquals(2, fifo.consumeFirst());
        assertEquals(3, fifo.consumeFirst());
        assertTrue(fifo.isEmpty());
    }

    @Test
    void concatTakesOwnershipOfOtherNodes() {
        final Fifo<Integer> fifo = new Fifo<>();
        fifo.add(1);
        final Fifo<Integer> other = new Fifo<>();
        other.add(2);
        other.add(3);

        fifo.concat(other);

        assertTrue(other.isEmpty());
        assertEquals(0, other.size());
        assertEquals(3, fifo.size());

        // the tail must follow the moved nodes
        fifo.add(4);
        for (int expected = 1; expected <= 4; expected++) {
            assertEquals(expected, fifo.consumeFirst());
        }
    }

    @Test
    void concatOntoEmptyAndFromEmpty() {
        final Fifo<String> empty = new Fifo<>();
        final Fifo<String> other = new Fifo<>();
        other.add("a");

        empty.concat(new Fifo<>());
        assertTrue(empty.isEmpty());

        empty.concat(other);
        assertEquals("a", empty.first());
        empty.add("b");
        assertEquals("a", empty.consumeFirst());
        assertEquals("b", empty.consumeFirst());
        assertTrue(empty.isEmpty());
    }

    @Test
    void clearEmptiesAndAllowsReuse() {
        final Fifo<String> fifo = new Fifo<>();
        fifo.add("x");
        fifo.add("y");

        fifo.clear();
        assertTrue(fifo.isEmpty());

        fifo.add("z");
        assertEquals("z", fifo.consumeFirst());
    }
}
