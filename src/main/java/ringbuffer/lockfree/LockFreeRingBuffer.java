package ringbuffer.lockfree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ringbuffer.RingBuffer;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A bounded, lock-free, multi-producer / multi-consumer (MPMC) ring buffer.
 *
 * <h2>Algorithm Overview</h2>
 * <p>The buffer is a fixed-size array addressed by {@code ticket & mask}, where
 * {@code mask = capacity - 1} (capacity must be a power of two). Four monotonically
 * increasing counters coordinate access:
 * <ul>
 *   <li>{@code writePointer}: next write ticket a producer may claim.</li>
 *   <li>{@code writeReserve}: every write below it is published (visible to consumers).</li>
 *   <li>{@code readPointer}: next read ticket a consumer may claim.</li>
 *   <li>{@code readReserve}: every read below it is published (slot handed back to producers).</li>
 * </ul>
 * <p>At all times {@code readReserve <= readPointer <= writeReserve <= writePointer}, and the
 * logical size is {@code writeReserve - readReserve}. Only the physical index wraps; the
 * counters themselves never do.
 *
 * <h2>Offer (any producer)</h2>
 * <ol>
 *   <li>Snapshot {@code wp = writePointer}, then {@code rp = readReserve}.</li>
 *   <li>If {@code wp - rp >= capacity}, return {@code false} (full).</li>
 *   <li><b>Claim:</b> CAS {@code writePointer} from {@code wp} to {@code wp + 1}. On failure
 *       another producer took the ticket; start over from step 1.</li>
 *   <li>Store the element into {@code buffer[wp & mask]}. The slot is exclusively ours.</li>
 *   <li><b>Publish:</b> spin on CAS {@code writeReserve} from {@code wp} to {@code wp + 1}.
 *       This succeeds only once every earlier ticket has published. This is the <b>linearization
 *       point</b>.</li>
 * </ol>
 *
 * <h2>Poll (any consumer)</h2>
 * <p>The mirror image: claim on {@code readPointer} against {@code writeReserve}, read and
 * null out the slot, then publish on {@code readReserve}, which is what producers test
 * fullness against.
 *
 * <h2>Publish Order and the Stall Hazard</h2>
 * <p>Publication is strictly in ticket order, so consumers see elements in exactly the order
 * producers claimed them, regardless of the order in which the slot stores complete. The
 * price is a liveness hazard: the publish step is an unbounded spin. If the holder of an
 * earlier ticket is descheduled between claim and publish, every later ticket-holder on the
 * same side spins until it resumes; if it dies, they spin forever. There is no timeout: a
 * claimed ticket that is never published is a hole that no later ticket can publish past.
 * A publish that has spun for {@link #STALL_WARN_SPINS} iterations logs one warning and keeps
 * spinning; {@link #stallWarnings()} counts those warnings.
 *
 * <p>{@link #offer} and {@link #poll} never wait for space or data: a full or empty buffer is
 * reported immediately.
 *
 * <h2>Memory Ordering</h2>
 * <p>All counter updates go through {@link VarHandle#compareAndSet}, which has volatile
 * read+write semantics. The plain slot store in {@code offer} happens-before the CAS that
 * publishes {@code writeReserve}, and a consumer reads the slot only after a volatile load of
 * {@code writeReserve} has observed that publication. The same edge runs the other way for
 * {@code readReserve}, so a producer never overwrites a slot a consumer is still reading.
 *
 * <h2>Snapshot Queries</h2>
 * <p>{@link #size()}, {@link #isEmpty()}, {@link #isFull()}, {@link #peek()} and
 * {@link #get(int)} read the counters independently. The answers are consistent with some
 * recent state but may be stale by the time the caller acts on them; {@code get} may even
 * return an element that has since been removed. Callers must retry rather than rely on a
 * single query.
 *
 * <h2>Reset</h2>
 * <p>{@link #reset()} is <b>not</b> thread-safe. It must not run concurrently with any other
 * operation on the same buffer; doing so can lose updates and break the counter ordering for
 * good.
 *
 * @param <T> the element type; {@code null} elements are not permitted
 */
public class LockFreeRingBuffer<T> implements RingBuffer<T> {

    private static final Logger log = LoggerFactory.getLogger(LockFreeRingBuffer.class);

    /** Spin iterations after which a publish that is still waiting logs a warning. */
    static final long STALL_WARN_SPINS = 1L << 24;

    /** Spins before a waiting publish logs its warning. */
    private final long stallWarnSpins;

    /** Number of publishes that hit {@link #stallWarnSpins}. Touched only on the stall path. */
    private final AtomicLong stallWarnings = new AtomicLong();

    /** Backing array. Indexed by {@code ticket & mask}. */
    private final T[] buffer;

    /** Buffer capacity (always a power of two). */
    private final int capacity;

    /** Bitmask for fast modulo: {@code ticket & mask == ticket % capacity}. */
    private final int mask;

    // ── Producer counters ───────────────────────────────────────────────
    @SuppressWarnings("unused") private long p00, p01, p02, p03, p04, p05, p06, p07;

    /** Next write ticket to claim. Advanced by CAS in {@link #offer}. */
    private volatile long writePointer;

    @SuppressWarnings("unused") private long p10, p11, p12, p13, p14, p15, p16, p17;

    /** Writes below this ticket are visible to consumers. Advanced in ticket order. */
    private volatile long writeReserve;

    // ── Consumer counters ───────────────────────────────────────────────
    @SuppressWarnings("unused") private long p20, p21, p22, p23, p24, p25, p26, p27;

    /** Next read ticket to claim. Advanced by CAS in {@link #poll}. */
    private volatile long readPointer;

    @SuppressWarnings("unused") private long p30, p31, p32, p33, p34, p35, p36, p37;

    /** Reads below this ticket have released their slot to producers. Advanced in ticket order. */
    private volatile long readReserve;

    @SuppressWarnings("unused") private long p40, p41, p42, p43, p44, p45, p46, p47;

    private static final VarHandle WRITE_POINTER;
    private static final VarHandle WRITE_RESERVE;
    private static final VarHandle READ_POINTER;
    private static final VarHandle READ_RESERVE;

    static {
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            WRITE_POINTER = lookup.findVarHandle(LockFreeRingBuffer.class, "writePointer", long.class);
            WRITE_RESERVE = lookup.findVarHandle(LockFreeRingBuffer.class, "writeReserve", long.class);
            READ_POINTER = lookup.findVarHandle(LockFreeRingBuffer.class, "readPointer", long.class);
            READ_RESERVE = lookup.findVarHandle(LockFreeRingBuffer.class, "readReserve", long.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    /**
     * Creates an empty buffer with all four counters at zero.
     *
     * @param capacity the fixed capacity; must be a positive power of two (at most
     *                 {@code 1 << 30}). It is never rounded.
     * @throws IllegalArgumentException if {@code capacity} is not a positive power of two
     */
    public LockFreeRingBuffer(int capacity) {
        this(capacity, STALL_WARN_SPINS);
    }

    /** Creates a buffer whose stalled publishes warn after {@code stallWarnSpins} spins. */
    @SuppressWarnings("unchecked")
    LockFreeRingBuffer(int capacity, long stallWarnSpins) {
        if (capacity <= 0 || (capacity & (capacity - 1)) != 0) {
            throw new IllegalArgumentException(
                    "capacity must be a positive power of two, got: " + capacity);
        }
        if (stallWarnSpins <= 0) {
            throw new IllegalArgumentException("stallWarnSpins must be positive, got: " + stallWarnSpins);
        }
        this.stallWarnSpins = stallWarnSpins;
        this.capacity = capacity;
        this.mask = capacity - 1;
        this.buffer = (T[]) new Object[capacity];
    }

    /**
     * Inserts an element at the tail of the buffer. Safe to call from any number of threads.
     *
     * <p>Returns {@code false} straight away if the buffer is full. Otherwise claims a ticket,
     * stores the element and spins until all earlier tickets have published (see the class
     * documentation for the stall hazard).
     *
     * @param value the element to insert; must not be {@code null}
     * @return {@code true} if the element was added, {@code false} if the buffer is full
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    @Override
    public boolean offer(T value) {
        if (value == null) {
            throw new IllegalArgumentException("null elements are not permitted");
        }

        long ticket;
        while (true) {
            ticket = writePointer;
            long released = readReserve;
            if (ticket - released >= capacity) {
                return false;               // full
            }
            if (WRITE_POINTER.compareAndSet(this, ticket, ticket + 1)) {
                break;
            }
            // Another producer claimed this ticket; re-check from scratch.
        }

        buffer[(int) (ticket & mask)] = value;

        // ─── LINEARIZATION POINT ────────────────────────────────────────
        // Succeeds only once writeReserve == ticket, i.e. every earlier
        // producer has published. The CAS releases the slot store above.
        // ─────────────────────────────────────────────────────────────────
        publish(WRITE_RESERVE, ticket);
        return true;
    }

    /**
     * Removes and returns the element at the head of the buffer. Safe to call from any number
     * of threads.
     *
     * <p>Returns {@code null} straight away if the buffer is empty. Otherwise claims a ticket,
     * takes the element, clears the slot and spins until all earlier read tickets have
     * published.
     *
     * @return the head element, or {@code null} if the buffer is empty
     */
    @Override
    public T poll() {
        long ticket;
        while (true) {
            ticket = readPointer;
            long available = writeReserve;
            if (ticket >= available) {
                return null;                // empty
            }
            if (READ_POINTER.compareAndSet(this, ticket, ticket + 1)) {
                break;
            }
        }

        int slot = (int) (ticket & mask);
        T value = buffer[slot];
        buffer[slot] = null;                // null out for GC

        // ─── LINEARIZATION POINT ────────────────────────────────────────
        // Hands the slot back to producers, in ticket order.
        // ─────────────────────────────────────────────────────────────────
        publish(READ_RESERVE, ticket);
        return value;
    }

    /**
     * Advances {@code reserve} from {@code ticket} to {@code ticket + 1}, spinning until every
     * earlier ticket has done the same.
     */
    private void publish(VarHandle reserve, long ticket) {
        long spins = 0;
        while (!reserve.compareAndSet(this, ticket, ticket + 1)) {
            if (++spins == stallWarnSpins) {
                stallWarnings.incrementAndGet();
                log.warn("publish of ticket {} has spun {} times waiting for ticket {} to publish",
                        ticket, spins, (long) reserve.getVolatile(this));
            }
            Thread.onSpinWait();
        }
    }

    /**
     * Returns the head element without removing it.
     *
     * <p>Reads the first <em>unclaimed</em> ticket, so removals that are claimed but not yet
     * published are skipped. <b>Non-linearizable</b> snapshot: a consumer that claims this
     * ticket between the bounds check and the array read can make it return {@code null}
     * although other elements remain, and by the time this method returns the element may
     * have been removed.
     *
     * @return the head element, or {@code null} if the buffer appears empty
     */
    @Override
    public T peek() {
        long head = readPointer;
        long tail = writeReserve;
        if (head >= tail) {
            return null;
        }
        return buffer[(int) (head & mask)];
    }

    /**
     * Returns the element {@code offset} positions after the oldest published element.
     *
     * <p><b>Best-effort, non-linearizable</b>: the bounds check and the array read are not
     * atomic together. Under concurrent removal the returned value may be stale, or
     * {@code null} if the slot was cleared in between.
     *
     * @param offset position relative to the oldest element
     * @return the element at that position
     * @throws IndexOutOfBoundsException if {@code offset} is negative or not below the size
     *                                   observed by this call
     */
    @Override
    public T get(int offset) {
        long head = readReserve;
        long tail = writeReserve;
        long size = tail - head;
        if (offset < 0 || offset >= size) {
            throw new IndexOutOfBoundsException("offset " + offset + " out of range, size " + Math.max(size, 0));
        }
        return buffer[(int) ((head + offset) & mask)];
    }

    /**
     * Returns the number of published elements: {@code writeReserve - readReserve}.
     *
     * <p>Point-in-time snapshot, clamped to {@code [0, capacity]}.
     *
     * @return approximate element count
     */
    @Override
    public int size() {
        long head = readReserve;
        long tail = writeReserve;
        return (int) Math.max(0, Math.min(tail - head, capacity));
    }

    /**
     * Returns how many publishes have spun long enough to log a stall warning since
     * construction. A non-zero value means some claimer was delayed between claim and publish.
     *
     * @return the number of stall warnings logged by this buffer
     */
    public long stallWarnings() {
        return stallWarnings.get();
    }

    /**
     * Returns the fixed capacity of the buffer.
     *
     * @return the capacity (always a power of two)
     */
    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Returns {@code true} if a {@link #poll()} issued now would find nothing to claim.
     *
     * <p>Point-in-time snapshot; may be stale by the time the caller acts on it.
     *
     * @return {@code true} if the buffer appears empty
     */
    @Override
    public boolean isEmpty() {
        long head = readPointer;
        return head >= writeReserve;
    }

    /**
     * Returns {@code true} if an {@link #offer} issued now would be rejected.
     *
     * <p>Point-in-time snapshot; may be stale by the time the caller acts on it.
     *
     * @return {@code true} if the buffer appears full
     */
    @Override
    public boolean isFull() {
        long tail = writePointer;
        return tail - readReserve >= capacity;
    }

    /**
     * Rewinds all four counters to zero and clears every slot.
     *
     * <p><b>Not thread-safe.</b> The caller must guarantee that no {@code offer}, {@code poll}
     * or query is in flight on this buffer; violating that is undefined behaviour.
     */
    @Override
    public void reset() {
        READ_RESERVE.setVolatile(this, 0L);
        READ_POINTER.setVolatile(this, 0L);
        WRITE_RESERVE.setVolatile(this, 0L);
        WRITE_POINTER.setVolatile(this, 0L);
        Arrays.fill(buffer, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LockFreeRingBuffer[");
        long h = readReserve;
        long t = writeReserve;
        boolean first = true;
        int limit = 20;
        for (long i = h; i < t && limit-- > 0; i++) {
            if (!first) sb.append(", ");
            sb.append(buffer[(int) (i & mask)]);
            first = false;
        }
        if (t - h > 20) sb.append(", ...");
        sb.append(']');
        return sb.toString();
    }
}
