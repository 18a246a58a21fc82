package ratelimit.core.model;

/**
 * Decision plus a wait duration.
 *
 * For REJECT and PASS_THROUGH the duration is the part of the rate window still
 * remaining; for DELAY it is the total time the caller spent blocked.
 */
public record RateLimitResult(
    Decision decision,
    long retryAfterNanos
) {
    public static RateLimitResult allow() {
        return new RateLimitResult(Decision.ALLOW, 0L);
    }

    public static RateLimitResult delay(long waitedNanos) {
        return new RateLimitResult(Decision.DELAY, Math.max(0L, waitedNanos));
    }

    public static RateLimitResult passThrough(long periodRemainingNanos) {
        return new RateLimitResult(Decision.PASS_THROUGH, Math.max(0L, periodRemainingNanos));
    }

    public static RateLimitResult reject(long retryAfterNanos) {
        return new RateLimitResult(Decision.REJECT, Math.max(0L, retryAfterNanos));
    }

    public boolean admitted() {
        return decision != Decision.REJECT;
    }

    public double retryAfterSeconds() {
        return retryAfterNanos / 1_000_000_000d;
    }
}
