package ringbuffer.window;

import java.util.Arrays;

/**
 * A rolling window of the most recent {@code double} samples, stored unboxed.
 *
 * <p>All methods are thread-safe.
 */
public class DoubleRingBuffer extends AbstractRollingWindow {

    private final double[] values;

    /**
     * @param capacity number of samples retained; must be positive
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public DoubleRingBuffer(int capacity) {
        super(capacity);
        this.values = new double[capacity];
    }

    /** Appends a sample, evicting the oldest one if the window is full. */
    public synchronized void add(double value) {
        values[nextSlot()] = value;
    }

    /** @return the newest {@code n} samples, oldest first; empty if {@code n <= 0} */
    public synchronized double[] last(int n) {
        return copy(lastFrom(n), size());
    }

    /** @return every sample held, oldest first */
    public synchronized double[] values() {
        return copy(0, size());
    }

    /** @return the samples at positions {@code [from, to)}, clamped to the window */
    public synchronized double[] slice(int from, int to) {
        return copy(clampFrom(from), clampTo(from, to));
    }

    /** @return the samples at positions {@code [from, to]}, both ends included, clamped to the window */
    public synchronized double[] position(int from, int to) {
        return slice(from, to == Integer.MAX_VALUE ? to : to + 1);
    }

    /** @return the mean of the samples held, or {@code NaN} if there are none */
    public synchronized double average() {
        int n = size();
        if (n == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[slotOf(i)];
        }
        return sum / n;
    }

    /** Drops every sample. */
    public synchronized void reset() {
        Arrays.fill(values, 0d);
        clearIndices();
    }

    private double[] copy(int from, int to) {
        double[] result = new double[Math.max(0, to - from)];
        for (int i = from; i < to; i++) {
            result[i - from] = values[slotOf(i)];
        }
        return result;
    }

    @Override
    public synchronized String toString() {
        return "DoubleRingBuffer" + Arrays.toString(values());
    }
}
