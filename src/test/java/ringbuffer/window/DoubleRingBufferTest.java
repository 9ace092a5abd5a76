package ringbuffer.window;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JUnit 5 tests for {@link DoubleRingBuffer}.
 */
class DoubleRingBufferTest {

    private static final double PI = 3.1415926;

    @Test
    void rollsOverAtCapacity() {
        DoubleRingBuffer rb = new DoubleRingBuffer(100);
        for (int i = 0; i <= 300; i++) {
            rb.add(i + PI);
        }

        assertEquals(100, rb.size());
        assertEquals(100, rb.capacity());
        assertTrue(rb.isFull());

        double[] all = rb.values();
        assertEquals(100, all.length);
        assertEquals(201 + PI, all[0], 1e-9);
        assertEquals(300 + PI, all[99], 1e-9);

        double[] last = rb.last(10);
        assertEquals(10, last.length);
        assertEquals(291 + PI, last[0], 1e-9);
        assertEquals(300 + PI, last[9], 1e-9);
    }

    @Test
    void sliceIsHalfOpenPositionIsInclusive() {
        DoubleRingBuffer rb = new DoubleRingBuffer(8);
        for (int i = 0; i < 8; i++) rb.add(i);

        assertArrayEquals(new double[] {1, 2, 3}, rb.slice(1, 4));
        assertArrayEquals(new double[] {1, 2, 3, 4}, rb.position(1, 4));
        assertArrayEquals(new double[] {6, 7}, rb.slice(6, 100));
        assertArrayEquals(new double[0], rb.slice(5, 5));
        assertArrayEquals(new double[0], rb.last(0));
    }

    @Test
    void averageOfWindow() {
        DoubleRingBuffer rb = new DoubleRingBuffer(3);
        assertTrue(Double.isNaN(rb.average()));
        rb.add(1);
        rb.add(2);
        rb.add(3);
        assertEquals(2.0, rb.average(), 1e-12);
        rb.add(10);   // evicts 1
        assertEquals(5.0, rb.average(), 1e-12);
    }

    @Test
    void resetClearsSamples() {
        DoubleRingBuffer rb = new DoubleRingBuffer(4);
        rb.add(1.5);
        rb.add(2.5);
        rb.reset();

        assertEquals(0, rb.size());
        assertFalse(rb.isFull());
        assertArrayEquals(new double[0], rb.values());
        rb.add(9);
        assertArrayEquals(new double[] {9}, rb.values());
        assertEquals("DoubleRingBuffer[9.0]", rb.toString());
    }

    @Test
    void concurrentWritersNeverExceedCapacity() throws InterruptedException {
        DoubleRingBuffer rb = new DoubleRingBuffer(64);
        Thread[] writers = new Thread[4];
        for (int w = 0; w < writers.length; w++) {
            writers[w] = new Thread(() -> {
                for (int i = 0; i < 10_000; i++) rb.add(1.0);
            });
        }
        for (Thread t : writers) t.start();
        for (Thread t : writers) t.join();

        assertEquals(64, rb.size());
        assertEquals(1.0, rb.average(), 1e-12);
    }
}
