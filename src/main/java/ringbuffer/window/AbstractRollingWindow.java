package ringbuffer.window;

/**
 * Index bookkeeping shared by the fixed-window rolling buffers.
 *
 * <p>A rolling window never rejects a value: once it holds {@link #capacity()} values, each
 * new one evicts the oldest. Positions used by the public views are <em>logical</em>:
 * position {@code 0} is the oldest value still held. Subclasses own the storage array and
 * translate logical positions with {@link #slotOf(int)}.
 *
 * <p>Subclasses synchronize on {@code this}; the helpers here assume the caller holds that
 * monitor.
 */
abstract class AbstractRollingWindow {

    private final int capacity;

    /** Slot of the oldest value. */
    private int start;

    private int size;

    AbstractRollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Reserves the slot for a new value, evicting the oldest value when the window is full.
     *
     * @return the slot to store the new value in
     */
    final int nextSlot() {
        if (size < capacity) {
            return slotOf(size++);
        }
        int slot = start;
        start = (start + 1) % capacity;
        return slot;
    }

    /** Maps a logical position ({@code 0} = oldest) to a storage slot. */
    final int slotOf(int position) {
        return (start + position) % capacity;
    }

    /** Logical start of the newest {@code n} values, {@code n} clamped to {@code [0, size]}. */
    final int lastFrom(int n) {
        return size - Math.max(0, Math.min(n, size));
    }

    final int clampFrom(int from) {
        return Math.max(0, Math.min(from, size));
    }

    final int clampTo(int from, int to) {
        return Math.max(clampFrom(from), Math.min(to, size));
    }

    final void clearIndices() {
        start = 0;
        size = 0;
    }

    /** @return the number of values held */
    public synchronized int size() {
        return size;
    }

    /** @return the maximum number of values held before the oldest is evicted */
    public int capacity() {
        return capacity;
    }

    /** @return {@code true} once the window has wrapped and every new value evicts one */
    public synchronized boolean isFull() {
        return size == capacity;
    }
}
