package ratelimit.core.clock;

import java.util.concurrent.TimeUnit;

/**
 * Blocking primitive used while waiting for a rate window to pass.
 */
@FunctionalInterface
public interface Sleeper {

    void sleepNanos(long nanos) throws InterruptedException;

    /**
     * Sleeps the calling thread. Interruption surfaces as {@link InterruptedException}.
     */
    static Sleeper system() {
        return nanos -> {
            if (nanos > 0) {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
        };
    }
}
