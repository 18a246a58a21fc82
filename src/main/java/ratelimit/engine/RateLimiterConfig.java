package ratelimit.engine;

/**
 * Configuration for creating a RateLimitGuard.
 *
 * When both flags are set, sleeping takes precedence over raising.
 *
 * @param durationNanos Length of the rate window in nanoseconds
 * @param burstMax Maximum tokens available at once (also the initial count)
 * @param sleepOnLimit Block until admission instead of deciding immediately
 * @param raiseOnLimit Fail over-budget calls with RateLimitExceededException instead of letting them through
 */
public record RateLimiterConfig(
    long durationNanos,
    double burstMax,
    boolean sleepOnLimit,
    boolean raiseOnLimit
) {
    private static final long ONE_SECOND_NANOS = 1_000_000_000L;

    public RateLimiterConfig {
        if (durationNanos <= 0) throw new IllegalArgumentException("duration must be > 0");
        if (!(burstMax > 0) || Double.isInfinite(burstMax)) {
            throw new IllegalArgumentException("burstMax must be a finite value > 0");
        }
    }

    /**
     * One call per second, raising when over budget.
     *
     * @return Default configuration
     */
    public static RateLimiterConfig defaults() {
        return raising(ONE_SECOND_NANOS, 1);
    }

    /**
     * Creates a configuration that fails over-budget calls.
     *
     * @param durationNanos Window length in nanoseconds
     * @param burstMax Maximum burst
     * @return Configuration that raises on limit
     */
    public static RateLimiterConfig raising(long durationNanos, double burstMax) {
        return new RateLimiterConfig(durationNanos, burstMax, false, true);
    }

    /**
     * Creates a configuration that blocks over-budget calls until they can be admitted.
     *
     * @param durationNanos Window length in nanoseconds
     * @param burstMax Maximum burst
     * @return Configuration that sleeps on limit
     */
    public static RateLimiterConfig sleeping(long durationNanos, double burstMax) {
        return new RateLimiterConfig(durationNanos, burstMax, true, false);
    }

    /**
     * Creates a configuration that admits over-budget calls anyway.
     *
     * @param durationNanos Window length in nanoseconds
     * @param burstMax Maximum burst
     * @return Best-effort configuration
     */
    public static RateLimiterConfig passThrough(long durationNanos, double burstMax) {
        return new RateLimiterConfig(durationNanos, burstMax, false, false);
    }

    public double durationSeconds() {
        return durationNanos / (double) ONE_SECOND_NANOS;
    }
}
