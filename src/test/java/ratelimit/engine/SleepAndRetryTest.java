package ratelimit.engine;

import org.junit.jupiter.api.Test;
import ratelimit.core.clock.ManualClock;
import ratelimit.core.clock.Sleeper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SleepAndRetryTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void retriesAfterAdvertisedWait() throws Exception {
        ManualClock clock = new ManualClock(0);
        RateLimitGuard guard = new RateLimitGuard(clock, nanos -> fail("guard should not sleep"),
            RateLimiterConfig.raising(SECOND, 1));
        SleepAndRetry retry = new SleepAndRetry(guard, clock.sleeper(), SleepAndRetry.UNBOUNDED);

        assertEquals("first", retry.call(() -> "first"));
        assertEquals("second", retry.call(() -> "second"));
        assertEquals(SECOND, clock.nowNanos());
    }

    @Test
    void givesUpAfterMaxRetries() {
        ManualClock clock = new ManualClock(0);
        RateLimitGuard guard = new RateLimitGuard(clock, clock.sleeper(), RateLimiterConfig.raising(SECOND, 1));
        List<Long> sleeps = new ArrayList<>();
        // Never advances the clock, so every retry is rejected again.
        Sleeper stuck = sleeps::add;
        SleepAndRetry retry = new SleepAndRetry(guard, stuck, 3);
        AtomicInteger invocations = new AtomicInteger();

        assertEquals(1, assertDoesNotThrow(() -> retry.call(invocations::incrementAndGet)));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
            () -> retry.call(invocations::incrementAndGet));
        assertEquals(SECOND, e.retryAfterNanos());
        assertEquals(1, invocations.get());
        assertEquals(List.of(SECOND, SECOND, SECOND), sleeps);
    }

    @Test
    void zeroRetriesRethrowsImmediately() {
        ManualClock clock = new ManualClock(0);
        RateLimitGuard guard = new RateLimitGuard(clock, clock.sleeper(), RateLimiterConfig.raising(SECOND, 1));
        SleepAndRetry retry = new SleepAndRetry(guard, nanos -> fail("should not sleep"), 0);

        assertDoesNotThrow(() -> retry.call(() -> 1));
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class, () -> retry.call(() -> 2));
        assertEquals(SECOND, e.retryAfterNanos());
    }

    @Test
    void otherFailuresAreNotRetried() {
        ManualClock clock = new ManualClock(0);
        RateLimitGuard guard = new RateLimitGuard(clock, clock.sleeper(), RateLimiterConfig.raising(SECOND, 5));
        SleepAndRetry retry = new SleepAndRetry(guard, clock.sleeper(), SleepAndRetry.UNBOUNDED);
        AtomicInteger invocations = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retry.call(() -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("remote said no");
        }));
        assertEquals(1, invocations.get());
    }

    @Test
    void wrapRetriesOnEveryInvocation() throws Exception {
        ManualClock clock = new ManualClock(0);
        RateLimitGuard guard = new RateLimitGuard(clock, clock.sleeper(), RateLimiterConfig.raising(SECOND, 1));
        AtomicInteger invocations = new AtomicInteger();
        Callable<Integer> guarded = new SleepAndRetry(guard, clock.sleeper(), SleepAndRetry.UNBOUNDED)
            .wrap(invocations::incrementAndGet);

        for (int i = 1; i <= 3; i++) {
            assertEquals(i, guarded.call());
        }
        assertEquals(2 * SECOND, clock.nowNanos());
    }

    @Test
    void rejectsInvalidArguments() {
        RateLimitGuard guard = new RateLimitGuard(RateLimiterConfig.defaults());
        assertThrows(IllegalArgumentException.class, () -> new SleepAndRetry(null));
        assertThrows(IllegalArgumentException.class, () -> new SleepAndRetry(guard, null, 1));
        assertThrows(IllegalArgumentException.class, () -> new SleepAndRetry(guard, Sleeper.system(), -2));
    }
}
