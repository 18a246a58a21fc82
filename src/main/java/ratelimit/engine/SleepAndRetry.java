package ratelimit.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratelimit.core.clock.Sleeper;

import java.util.concurrent.Callable;

/**
 * Naive retry strategy for guards that raise on limit: when a call is rejected,
 * sleep for the advertised retry-after and try again.
 *
 * Only {@link RateLimitExceededException} triggers a retry. Anything else the
 * task throws propagates on the first failure.
 */
public final class SleepAndRetry {

    private static final Logger log = LoggerFactory.getLogger(SleepAndRetry.class);

    /** Retry for as long as it takes. */
    public static final int UNBOUNDED = -1;

    private final RateLimitGuard guard;
    private final Sleeper sleeper;
    private final int maxRetries;

    /**
     * @param guard Guard the calls go through
     * @param sleeper Used to wait between attempts
     * @param maxRetries Retries after the first attempt, or {@link #UNBOUNDED}
     */
    public SleepAndRetry(RateLimitGuard guard, Sleeper sleeper, int maxRetries) {
        if (guard == null) throw new IllegalArgumentException("guard cannot be null");
        if (sleeper == null) throw new IllegalArgumentException("sleeper cannot be null");
        if (maxRetries < 0 && maxRetries != UNBOUNDED) {
            throw new IllegalArgumentException("maxRetries must be >= 0 or UNBOUNDED");
        }
        this.guard = guard;
        this.sleeper = sleeper;
        this.maxRetries = maxRetries;
    }

    public SleepAndRetry(RateLimitGuard guard) {
        this(guard, Sleeper.system(), UNBOUNDED);
    }

    /**
     * Calls the task through the guard, sleeping and retrying while it is rate limited.
     *
     * @throws RateLimitExceededException the last rejection, once maxRetries is used up
     */
    public <T> T call(Callable<T> task) throws Exception {
        int retries = 0;
        while (true) {
            try {
                return guard.call(task);
            } catch (RateLimitExceededException e) {
                if (maxRetries != UNBOUNDED && retries >= maxRetries) {
                    throw e;
                }
                retries++;
                log.debug("Rate limited, retry {} after {} ns", retries, e.retryAfterNanos());
                sleeper.sleepNanos(e.retryAfterNanos());
            }
        }
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        return () -> call(task);
    }
}
