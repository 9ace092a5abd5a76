package ringbuffer.guarded;

import ringbuffer.RingBuffer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded ring buffer guarded by a single {@link ReentrantLock}.
 *
 * <p>Every operation holds the lock for its whole duration, so all of them, queries
 * included, are linearizable. This trades throughput under contention for simplicity and
 * strong consistency; use {@link ringbuffer.lockfree.LockFreeRingBuffer} when many threads
 * hammer the same buffer.
 *
 * <p>Unlike the lock-free variant, the capacity may be any positive number. Slots are
 * addressed by {@code head} and {@code tail} indices taken modulo the capacity, with a
 * separate {@code count} telling a full buffer ({@code head == tail, count == capacity})
 * from an empty one.
 *
 * @param <T> the element type; {@code null} elements are not permitted
 */
public class GuardedRingBuffer<T> implements RingBuffer<T> {

    private final Object[] items;

    private final int capacity;

    /** Index of the oldest element. */
    private int head;

    /** Index the next element is stored at. */
    private int tail;

    private int count;

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param capacity the fixed capacity; must be positive
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public GuardedRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.items = new Object[capacity];
    }

    @Override
    public boolean offer(T value) {
        if (value == null) {
            throw new IllegalArgumentException("null elements are not permitted");
        }
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (count == capacity) {
                return false;
            }
            items[tail] = value;
            tail = inc(tail);
            count++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (count == 0) {
                return null;
            }
            T value = itemAt(head);
            items[head] = null;
            head = inc(head);
            count--;
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T peek() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return count == 0 ? null : itemAt(head);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T get(int offset) {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (offset < 0 || offset >= count) {
                throw new IndexOutOfBoundsException("offset " + offset + " out of range, size " + count);
            }
            return itemAt((head + offset) % capacity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every element, oldest first, as one consistent snapshot.
     *
     * @return a new list; empty if the buffer is empty
     */
    public List<T> toList() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            List<T> result = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                result.add(itemAt((head + i) % capacity));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the newest {@code n} elements, oldest of them first.
     *
     * @param n how many elements; clamped to the current size
     * @return a new list; empty if {@code n <= 0} or the buffer is empty
     */
    public List<T> lastN(int n) {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (n > count) n = count;
            if (n <= 0) return Collections.emptyList();
            List<T> result = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                result.add(itemAt((tail - n + i + capacity) % capacity));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean isFull() {
        return size() == capacity;
    }

    @Override
    public void reset() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            Arrays.fill(items, null);
            head = 0;
            tail = 0;
            count = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        List<T> snapshot = toList();
        StringBuilder sb = new StringBuilder("GuardedRingBuffer[");
        int limit = Math.min(snapshot.size(), 20);
        for (int i = 0; i < limit; i++) {
            if (i > 0) sb.append(", ");
            sb.append(snapshot.get(i));
        }
        if (snapshot.size() > 20) sb.append(", ...");
        sb.append(']');
        return sb.toString();
    }

    private int inc(int i) {
        return (++i == capacity) ? 0 : i;
    }

    @SuppressWarnings("unchecked")
    private T itemAt(int i) {
        return (T) items[i];
    }
}
