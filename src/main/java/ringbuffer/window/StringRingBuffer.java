package ringbuffer.window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A rolling window of the most recent strings, typically log lines of one level.
 *
 * <pre>
 *   StringRingBuffer warnings = new StringRingBuffer(100);
 *   warnings.add("WARN: Application has bad references");
 *   List&lt;String&gt; recent = warnings.last(10);
 * </pre>
 *
 * <p>All methods are thread-safe.
 */
public class StringRingBuffer extends AbstractRollingWindow {

    private final String[] values;

    /**
     * @param capacity number of strings retained; must be positive
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public StringRingBuffer(int capacity) {
        super(capacity);
        this.values = new String[capacity];
    }

    /**
     * Appends a string, evicting the oldest one if the window is full.
     *
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    public synchronized void add(String value) {
        if (value == null) {
            throw new IllegalArgumentException("null elements are not permitted");
        }
        values[nextSlot()] = value;
    }

    /** @return the newest {@code n} strings, oldest first; empty if {@code n <= 0} */
    public synchronized List<String> last(int n) {
        return copy(lastFrom(n), size());
    }

    /** @return every string held, oldest first */
    public synchronized List<String> values() {
        return copy(0, size());
    }

    /** @return the strings at positions {@code [from, to)}, clamped to the window */
    public synchronized List<String> slice(int from, int to) {
        return copy(clampFrom(from), clampTo(from, to));
    }

    /** @return the strings at positions {@code [from, to]}, both ends included, clamped to the window */
    public synchronized List<String> position(int from, int to) {
        return slice(from, to == Integer.MAX_VALUE ? to : to + 1);
    }

    /** Drops every string. */
    public synchronized void reset() {
        Arrays.fill(values, null);
        clearIndices();
    }

    private List<String> copy(int from, int to) {
        List<String> result = new ArrayList<>(Math.max(0, to - from));
        for (int i = from; i < to; i++) {
            result.add(values[slotOf(i)]);
        }
        return result;
    }

    @Override
    public synchronized String toString() {
        return "StringRingBuffer" + values();
    }
}
