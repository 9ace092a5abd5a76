package ringbuffer;

/**
 * A fixed-capacity FIFO ring buffer.
 *
 * <p>Two families of insert/remove are offered, mirroring {@link java.util.Queue}:
 * <ul>
 *   <li>{@link #offer} / {@link #poll} report a full or empty buffer through their
 *       return value ({@code false} / {@code null}) and never throw for it.</li>
 *   <li>{@link #add} / {@link #remove} throw {@link RingBufferFullException} /
 *       {@link RingBufferEmptyException} instead.</li>
 * </ul>
 *
 * <p>{@code null} elements are not permitted, since {@code null} is the "empty" answer of
 * {@link #poll()} and {@link #peek()}.
 *
 * <p>Whether the query methods are linearizable depends on the implementation; see the
 * implementing class.
 *
 * @param <T> the element type
 */
public interface RingBuffer<T> {

    /**
     * Inserts an element at the tail if there is room.
     *
     * @param value the element; must not be {@code null}
     * @return {@code true} if inserted, {@code false} if the buffer is full
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    boolean offer(T value);

    /**
     * Removes and returns the oldest element.
     *
     * @return the oldest element, or {@code null} if the buffer is empty
     */
    T poll();

    /**
     * Returns the oldest element without removing it.
     *
     * @return the oldest element, or {@code null} if the buffer is empty
     */
    T peek();

    /**
     * Returns the element {@code offset} positions after the oldest one, without removing it.
     * Offset {@code 0} is the oldest element.
     *
     * @param offset position relative to the oldest element
     * @return the element at that position
     * @throws IndexOutOfBoundsException if {@code offset} is negative or not below {@link #size()}
     */
    T get(int offset);

    /** @return the number of elements currently held */
    int size();

    /** @return the fixed capacity */
    int capacity();

    /** @return {@code true} if the buffer holds no elements */
    boolean isEmpty();

    /** @return {@code true} if the buffer holds {@link #capacity()} elements */
    boolean isFull();

    /**
     * Discards all elements and rewinds the buffer to its freshly constructed state.
     */
    void reset();

    /**
     * Inserts an element at the tail, failing loudly if there is no room.
     *
     * @param value the element; must not be {@code null}
     * @throws RingBufferFullException if the buffer is full
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    default void add(T value) {
        if (!offer(value)) {
            throw new RingBufferFullException(capacity());
        }
    }

    /**
     * Removes and returns the oldest element, failing loudly if there is none.
     *
     * @return the oldest element
     * @throws RingBufferEmptyException if the buffer is empty
     */
    default T remove() {
        T value = poll();
        if (value == null) {
            throw new RingBufferEmptyException();
        }
        return value;
    }
}
