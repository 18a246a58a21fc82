package ratelimit.engine;

/**
 * Thrown when a call is over budget and the guard is configured to raise.
 * Carries the remaining window so the caller can back off and retry.
 */
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterNanos;

    public RateLimitExceededException(long retryAfterNanos) {
        super("too many calls, retry after " + retryAfterNanos + " ns");
        this.retryAfterNanos = Math.max(0L, retryAfterNanos);
    }

    public long retryAfterNanos() {
        return retryAfterNanos;
    }

    public double retryAfterSeconds() {
        return retryAfterNanos / 1_000_000_000d;
    }
}
