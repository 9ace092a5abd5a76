package ringbuffer.lockfree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ringbuffer.RingBuffer;
import ringbuffer.guarded.GuardedRingBuffer;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Standalone demo that verifies {@link LockFreeRingBuffer} correctness with several
 * producers and consumers, then benchmarks its throughput against {@link GuardedRingBuffer}
 * and the JDK's {@link ArrayBlockingQueue}. Run via:
 * <pre>
 *   mvn exec:java -Dexec.mainClass="ringbuffer.lockfree.LockFreeRingBufferDemo" \
 *       -Dexec.args="[capacity] [producers] [consumers] [itemsPerProducer]"
 * </pre>
 */
public class LockFreeRingBufferDemo {

    private static final Logger log = LoggerFactory.getLogger(LockFreeRingBufferDemo.class);

    private static final long BENCH_DURATION_MS = 3_000;

    public static void main(String[] args) throws InterruptedException {
        int capacity = positiveArg(args, 0, "capacity", 1024);
        int producers = positiveArg(args, 1, "producers", 4);
        int consumers = positiveArg(args, 2, "consumers", 4);
        int itemsPerProducer = positiveArg(args, 3, "itemsPerProducer", 250_000);

        if (!correctnessTest(capacity, producers, consumers, itemsPerProducer)) {
            System.exit(1);
        }
        performanceComparison(capacity, producers, consumers);
    }

    /**
     * Reads positional argument {@code index}, or {@code defaultValue} if absent. Only positive
     * values are accepted.
     */
    static int positiveArg(String[] args, int index, String name, int defaultValue) {
        if (args.length <= index) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + args[index], e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    // ── Correctness Test ────────────────────────────────────────────────

    static boolean correctnessTest(int capacity, int producers, int consumers, int itemsPerProducer)
            throws InterruptedException {
        log.info("=== MPMC correctness: capacity {}, {} producers x {} items, {} consumers ===",
                capacity, producers, itemsPerProducer, consumers);

        final long total = (long) producers * itemsPerProducer;
        LockFreeRingBuffer<Long> ring = new LockFreeRingBuffer<>(capacity);
        ConcurrentHashMap<Long, Boolean> seen = new ConcurrentHashMap<>();
        AtomicLong consumed = new AtomicLong();
        AtomicLong duplicates = new AtomicLong();

        Thread[] threads = new Thread[producers + consumers];
        for (int p = 0; p < producers; p++) {
            final long base = (long) p * itemsPerProducer;
            threads[p] = new Thread(() -> {
                for (long i = 0; i < itemsPerProducer; i++) {
                    while (!ring.offer(base + i)) {
                        Thread.onSpinWait();
                    }
                }
            }, "producer-" + p);
        }
        for (int c = 0; c < consumers; c++) {
            threads[producers + c] = new Thread(() -> {
                while (consumed.get() < total) {
                    Long val = ring.poll();
                    if (val == null) {
                        Thread.onSpinWait();
                        continue;
                    }
                    if (seen.putIfAbsent(val, Boolean.TRUE) != null) {
                        duplicates.incrementAndGet();
                    }
                    consumed.incrementAndGet();
                }
            }, "consumer-" + c);
        }

        for (Thread t : threads) t.start();
        for (Thread t : threads) t.join();

        log.info("  Items sent:     {}", total);
        log.info("  Items received: {}", consumed.get());
        log.info("  Distinct:       {}", seen.size());
        log.info("  Duplicates:     {}", duplicates.get());

        if (duplicates.get() > 0 || seen.size() != total) {
            log.error("  FAILED");
            return false;
        }
        log.info("  PASSED");
        return true;
    }

    // ── Performance Comparison ──────────────────────────────────────────

    static void performanceComparison(int capacity, int producers, int consumers)
            throws InterruptedException {
        log.info("=== MPMC throughput: {} ms each, {} producers + {} consumers ===",
                BENCH_DURATION_MS, producers, consumers);

        long lockFreeOps = benchmark("LockFreeRingBuffer", producers, consumers,
                new LockFreeRingBuffer<>(capacity));
        long guardedOps = benchmark("GuardedRingBuffer", producers, consumers,
                new GuardedRingBuffer<>(capacity));

        ArrayBlockingQueue<Long> abq = new ArrayBlockingQueue<>(capacity);
        long abqOps = benchmark("ArrayBlockingQueue (JDK)", producers, consumers, abq::offer, abq::poll);

        if (log.isInfoEnabled()) {
            log.info(String.format("  LockFreeRingBuffer vs GuardedRingBuffer:  %.2fx", (double) lockFreeOps / guardedOps));
            log.info(String.format("  LockFreeRingBuffer vs ArrayBlockingQueue: %.2fx", (double) lockFreeOps / abqOps));
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    @FunctionalInterface
    interface ProducerOp {
        boolean offer(Long value);
    }

    @FunctionalInterface
    interface ConsumerOp {
        Long poll();
    }

    private static long benchmark(String label, int producers, int consumers, RingBuffer<Long> buffer)
            throws InterruptedException {
        return benchmark(label, producers, consumers, buffer::offer, buffer::poll);
    }

    /**
     * Runs producers and consumers for {@link #BENCH_DURATION_MS} and returns successful
     * operations per second (offers that inserted plus polls that returned an element).
     */
    private static long benchmark(String label, int producers, int consumers,
                                  ProducerOp produce, ConsumerOp consume) throws InterruptedException {
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicLong ops = new AtomicLong();
        Thread[] threads = new Thread[producers + consumers];

        for (int p = 0; p < producers; p++) {
            threads[p] = new Thread(() -> {
                long local = 0;
                long val = 0;
                while (running.get()) {
                    if (produce.offer(val)) {
                        val++;
                        local++;
                    } else {
                        Thread.onSpinWait();
                    }
                }
                ops.addAndGet(local);
            }, "bench-producer-" + p);
        }
        for (int c = 0; c < consumers; c++) {
            threads[producers + c] = new Thread(() -> {
                long local = 0;
                while (running.get()) {
                    if (consume.poll() != null) {
                        local++;
                    } else {
                        Thread.onSpinWait();
                    }
                }
                ops.addAndGet(local);
            }, "bench-consumer-" + c);
        }

        for (Thread t : threads) t.start();
        Thread.sleep(BENCH_DURATION_MS);
        running.set(false);
        for (Thread t : threads) t.join();

        long opsPerSec = (long) (ops.get() / (BENCH_DURATION_MS / 1000.0));
        if (log.isInfoEnabled()) {
            log.info(String.format("  %-38s %,12d ops/sec", label, opsPerSec));
        }
        return opsPerSec;
    }
}
