package ringbuffer;

/**
 * Thrown by {@link RingBuffer#add} when every slot is occupied.
 *
 * <p>The condition is transient: retrying after a removal can succeed.
 */
public class RingBufferFullException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int capacity;

    public RingBufferFullException(int capacity) {
        super("ring buffer is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    /** @return the capacity of the buffer that rejected the element */
    public int getCapacity() {
        return capacity;
    }
}
