package ratelimit.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to. Safe to share between threads, so a
 * {@link Sleeper} built from {@link #advanceNanos(long)} can be used by
 * several blocked callers at once.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void setNanos(long value) {
        now.set(value);
    }

    /**
     * Sleeper that advances this clock instead of blocking the thread.
     */
    public Sleeper sleeper() {
        return this::advanceNanos;
    }
}
