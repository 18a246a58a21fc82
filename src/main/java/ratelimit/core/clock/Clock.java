package ratelimit.core.clock;

/**
 * Time source for the limiter. Injected so tests can control time.
 *
 * Implementations must be side-effect free and callable from any thread.
 */
@FunctionalInterface
public interface Clock {

    long nowNanos();

    /**
     * Monotonic clock backed by System.nanoTime(), for production use.
     */
    static Clock system() {
        return System::nanoTime;
    }
}
