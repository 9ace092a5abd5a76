package ringbuffer;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link RingBuffer#remove} when there is nothing to remove.
 *
 * <p>The condition is transient: retrying after an insertion can succeed.
 */
public class RingBufferEmptyException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    public RingBufferEmptyException() {
        super("ring buffer is empty");
    }
}
