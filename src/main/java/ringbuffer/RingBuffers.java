package ringbuffer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Linearized views over any {@link RingBuffer}, built from {@link RingBuffer#size()} and
 * {@link RingBuffer#get(int)} without removing anything.
 *
 * <p>Each view takes one size snapshot and then reads positions one by one, and every
 * {@code get} re-reads where the oldest element is. On a lock-free buffer the result is
 * exact only while no consumer runs concurrently. A removal racing with the view can
 * shift later positions, so elements may be skipped or appear twice, can leave
 * {@code null} entries for slots cleared mid-read, and can make {@code get} throw
 * {@link IndexOutOfBoundsException} once the buffer has shrunk below a requested position.
 */
public final class RingBuffers {

    private RingBuffers() {
    }

    /**
     * @return every element, oldest first
     */
    public static <T> List<T> values(RingBuffer<T> buffer) {
        return copy(buffer, 0, buffer.size());
    }

    /**
     * @param n how many of the newest elements to return; clamped to {@code [0, size]}
     * @return the newest {@code n} elements, oldest first
     */
    public static <T> List<T> lastN(RingBuffer<T> buffer, int n) {
        int size = buffer.size();
        if (n > size) n = size;
        if (n <= 0) return Collections.emptyList();
        return copy(buffer, size - n, size);
    }

    /**
     * @param from first position (inclusive), clamped to {@code >= 0}
     * @param to   last position (exclusive), clamped to {@code <= size}
     * @return the elements in {@code [from, to)}, or an empty list if the range is empty
     */
    public static <T> List<T> slice(RingBuffer<T> buffer, int from, int to) {
        int size = buffer.size();
        if (from < 0) from = 0;
        if (to > size) to = size;
        if (from >= to) return Collections.emptyList();
        return copy(buffer, from, to);
    }

    private static <T> List<T> copy(RingBuffer<T> buffer, int from, int to) {
        List<T> result = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            result.add(buffer.get(i));
        }
        return result;
    }
}
