package ringbuffer.lockfree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the demo's correctness check with small parameters.
 */
class LockFreeRingBufferDemoTest {

    @Test
    void correctnessRunPasses() throws InterruptedException {
        assertTrue(LockFreeRingBufferDemo.correctnessTest(64, 3, 2, 20_000));
    }

    @Test
    void rejectsNonPowerOfTwoCapacity() {
        assertThrows(IllegalArgumentException.class,
                () -> LockFreeRingBufferDemo.correctnessTest(100, 1, 1, 10));
    }

    @Test
    void argumentsMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> LockFreeRingBufferDemo.main(new String[] {"64", "4", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> LockFreeRingBufferDemo.main(new String[] {"64", "-2"}));
        assertThrows(IllegalArgumentException.class,
                () -> LockFreeRingBufferDemo.main(new String[] {"64", "4", "4", "many"}));
    }

    @Test
    void missingArgumentsFallBackToDefaults() {
        String[] args = {"128"};
        assertEquals(128, LockFreeRingBufferDemo.positiveArg(args, 0, "capacity", 1024));
        assertEquals(4, LockFreeRingBufferDemo.positiveArg(args, 1, "producers", 4));
    }
}
