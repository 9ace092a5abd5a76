package ringbuffer.guarded;

import org.junit.jupiter.api.Test;
import ringbuffer.RingBufferEmptyException;
import ringbuffer.RingBufferFullException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JUnit 5 tests for {@link GuardedRingBuffer}.
 */
class GuardedRingBufferTest {

    @Test
    void capacityNeedNotBePowerOfTwo() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(10);
        assertEquals(10, rb.capacity());
        assertTrue(rb.isEmpty());
        assertEquals(0, rb.size());

        assertThrows(IllegalArgumentException.class, () -> new GuardedRingBuffer<>(0));
        assertThrows(IllegalArgumentException.class, () -> new GuardedRingBuffer<>(-3));
    }

    @Test
    void offerPollFifo() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(5);
        for (int i = 1; i <= 5; i++) assertTrue(rb.offer(i));
        assertTrue(rb.isFull());
        assertFalse(rb.offer(6));
        assertThrows(RingBufferFullException.class, () -> rb.add(6));

        for (int i = 1; i <= 5; i++) assertEquals(i, rb.poll());
        assertTrue(rb.isEmpty());
        assertNull(rb.poll());
        assertThrows(RingBufferEmptyException.class, rb::remove);
    }

    @Test
    void peekDoesNotRemove() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(5);
        assertNull(rb.peek());
        for (int i = 1; i <= 3; i++) rb.add(i);

        assertEquals(1, rb.peek());
        assertEquals(3, rb.size());
        rb.poll();
        assertEquals(2, rb.peek());
    }

    @Test
    void isFullTracksCount() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(2);
        assertFalse(rb.isFull());
        rb.add(1);
        assertFalse(rb.isEmpty());
        assertFalse(rb.isFull());
        rb.add(2);
        assertTrue(rb.isFull());
        rb.poll();
        assertFalse(rb.isFull());
    }

    @Test
    void toListAndLastN() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(5);
        assertEquals(List.of(), rb.toList());
        assertEquals(List.of(), rb.lastN(3));

        for (int i = 1; i <= 5; i++) rb.add(i);
        assertEquals(List.of(1, 2, 3, 4, 5), rb.toList());
        assertEquals(List.of(3, 4, 5), rb.lastN(3));
        assertEquals(List.of(1, 2, 3, 4, 5), rb.lastN(10));
        assertEquals(List.of(), rb.lastN(0));
    }

    @Test
    void wrapAround() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(3);
        rb.add(1);
        rb.add(2);
        rb.add(3);
        rb.poll();
        rb.poll();
        rb.add(4);
        rb.add(5);

        assertEquals(List.of(3, 4, 5), rb.toList());
        assertEquals(List.of(4, 5), rb.lastN(2));
        assertEquals(3, rb.get(0));
        assertEquals(5, rb.get(2));
        assertThrows(IndexOutOfBoundsException.class, () -> rb.get(3));
        assertEquals("GuardedRingBuffer[3, 4, 5]", rb.toString());
    }

    @Test
    void resetEmptiesBuffer() {
        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(10);
        for (int i = 1; i <= 3; i++) rb.add(i);

        rb.reset();
        assertEquals(0, rb.size());
        assertTrue(rb.isEmpty());

        rb.add(10);
        assertEquals(10, rb.remove());
    }

    @Test
    void worksWithArbitraryElementTypes() {
        record Person(int id, String name) {
        }

        GuardedRingBuffer<Person> rb = new GuardedRingBuffer<>(3);
        rb.add(new Person(1, "Alice"));
        rb.add(new Person(2, "Bob"));
        assertEquals(new Person(1, "Alice"), rb.remove());
        assertThrows(IllegalArgumentException.class, () -> rb.offer(null));
    }

    @Test
    void concurrentProducersAndConsumers() throws InterruptedException {
        final int producers = 5;
        final int consumers = 5;
        final int itemsPerProducer = 1000;
        final int total = producers * itemsPerProducer;

        GuardedRingBuffer<Integer> rb = new GuardedRingBuffer<>(50);
        Set<Integer> removed = ConcurrentHashMap.newKeySet();
        AtomicInteger consumed = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();

        List<Thread> threads = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            final int base = p * itemsPerProducer;
            threads.add(new Thread(() -> {
                for (int i = 0; i < itemsPerProducer; i++) {
                    while (!rb.offer(base + i)) {
                        Thread.onSpinWait();
                    }
                }
            }));
        }
        for (int c = 0; c < consumers; c++) {
            threads.add(new Thread(() -> {
                while (consumed.get() < total) {
                    Integer v = rb.poll();
                    if (v == null) {
                        Thread.onSpinWait();
                        continue;
                    }
                    if (!removed.add(v)) duplicates.incrementAndGet();
                    consumed.incrementAndGet();
                }
            }));
        }

        for (Thread t : threads) t.start();
        for (Thread t : threads) t.join();

        assertEquals(0, duplicates.get());
        assertEquals(total, removed.size());
        assertTrue(rb.isEmpty());
    }
}
