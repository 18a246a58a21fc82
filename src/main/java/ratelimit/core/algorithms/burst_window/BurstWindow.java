package ratelimit.core.algorithms.burst_window;

import ratelimit.core.clock.Clock;
import ratelimit.core.model.RateLimitResult;
import ratelimit.core.model.RateLimiter;

/**
 * Burst Window:
 * - duration: length of the rate window
 * - burstMax: tokens available at once (also the initial count)
 *
 * Every elapsed duration adds one token, independent of burstMax. A call is over
 * budget only while the window since the last admitted call is still open and
 * fewer than one whole token is available.
 *
 * Thread-safety: none. RateLimitGuard serializes access with its lock.
 */
public final class BurstWindow implements RateLimiter {
    private final Clock clock;
    private final long durationNanos;
    private final double burstMax;

    private double burst;
    private long lastResetNanos;

    public BurstWindow(Clock clock, long durationNanos, double burstMax) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (durationNanos <= 0) throw new IllegalArgumentException("duration <= 0");
        if (!(burstMax > 0) || Double.isInfinite(burstMax)) throw new IllegalArgumentException("burstMax <= 0");
        this.clock = clock;
        this.durationNanos = durationNanos;
        this.burstMax = burstMax;
        this.burst = burstMax;
        // Sentinel: one full window before construction, so the first call always finds it elapsed.
        this.lastResetNanos = clock.nowNanos() - durationNanos;
    }

    @Override
    public RateLimitResult tryAcquire() {
        long elapsed = clock.nowNanos() - lastResetNanos;
        long periodRemaining = durationNanos - elapsed;

        // One token per duration, capped at burstMax. Not scaled by burstMax.
        burst = Math.min(burstMax, burst + (double) Math.max(0L, elapsed) / durationNanos);

        if (periodRemaining > 0 && Math.floor(burst) == 0) {
            return RateLimitResult.reject(periodRemaining);
        }

        admit();
        return RateLimitResult.allow();
    }

    @Override
    public void admit() {
        burst = Math.max(0d, burst - 1);
        lastResetNanos = clock.nowNanos();
    }

    @Override
    public double tokens() {
        return burst;
    }

    public double burstMax() {
        return burstMax;
    }

    public long lastResetNanos() {
        return lastResetNanos;
    }
}
