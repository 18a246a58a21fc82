package ratelimit.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratelimit.core.algorithms.burst_window.BurstWindow;
import ratelimit.core.clock.Clock;
import ratelimit.core.clock.Sleeper;
import ratelimit.core.model.Decision;
import ratelimit.core.model.RateLimitResult;
import ratelimit.core.model.RateLimiter;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe gate in front of a rate-limited operation.
 *
 * Every invocation of the protected work passes through {@link #attempt()} first.
 * The decision and the token mutation run under one lock, so concurrent callers
 * consume tokens in a serialized order and no call is admitted twice on the same
 * token. What happens to an over-budget call depends on the configuration:
 * <ul>
 *   <li>sleepOnLimit: the lock is released, the caller sleeps for the remaining
 *       window and the whole decision is re-run</li>
 *   <li>raiseOnLimit: {@link RateLimitExceededException} with the remaining window</li>
 *   <li>neither: the call is admitted anyway</li>
 * </ul>
 *
 * Thread-safety:
 * - The lock is a non-fair ReentrantLock: admission follows lock acquisition, not arrival
 * - Sleeping happens outside the lock and blocks only the calling thread
 * - Re-entrant, so a guarded call made from inside another guarded call on the same thread is fine
 *
 * Usage example:
 * <pre>
 * RateLimitGuard guard = new RateLimitGuard(RateLimiterConfig.sleeping(15 * 60 * 1_000_000_000L, 15));
 * String body = guard.call(() -> client.fetch(url));
 * </pre>
 */
public final class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final RateLimiterConfig config;
    private final RateLimiter limiter;
    private final Sleeper sleeper;
    private final ReentrantLock lock;

    /**
     * Creates a guard on the system clock that really sleeps.
     *
     * @param config Limiter configuration
     */
    public RateLimitGuard(RateLimiterConfig config) {
        this(Clock.system(), Sleeper.system(), config);
    }

    /**
     * Creates a guard with an injected time source.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param sleeper Used to wait out the window when sleepOnLimit is set
     * @param config Limiter configuration
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateLimitGuard(Clock clock, Sleeper sleeper, RateLimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.config = config;
        this.limiter = new BurstWindow(clock, config.durationNanos(), config.burstMax());
        this.sleeper = sleeper;
        this.lock = new ReentrantLock();
    }

    /**
     * Decides whether the next call may run.
     *
     * Returns ALLOW when admitted right away, DELAY (with the total time slept) when
     * admitted after sleeping, and PASS_THROUGH when admitted over budget because
     * neither sleeping nor raising is configured.
     *
     * @return The admission outcome, never REJECT
     * @throws RateLimitExceededException if over budget and raiseOnLimit is set
     * @throws InterruptedException if interrupted while sleeping on the limit
     */
    public RateLimitResult attempt() throws InterruptedException {
        long waited = 0L;
        while (true) {
            RateLimitResult result;

            lock.lock();
            try {
                result = limiter.tryAcquire();
                if (result.decision() == Decision.ALLOW) {
                    return waited > 0 ? RateLimitResult.delay(waited) : result;
                }

                if (!config.sleepOnLimit()) {
                    if (config.raiseOnLimit()) {
                        log.debug("Rate limit exceeded, retry after {} ns", result.retryAfterNanos());
                        throw new RateLimitExceededException(result.retryAfterNanos());
                    }
                    limiter.admit();
                    log.debug("Over budget, letting call through ({} ns left in window)", result.retryAfterNanos());
                    return RateLimitResult.passThrough(result.retryAfterNanos());
                }
            } finally {
                lock.unlock();
            }

            long wait = result.retryAfterNanos();
            log.debug("Over budget, sleeping {} ns before retrying", wait);
            sleeper.sleepNanos(wait);
            waited += wait;
        }
    }

    /**
     * Runs the task once admitted and returns its result.
     *
     * @param task The rate-limited work
     * @return Whatever the task returns
     * @throws RateLimitExceededException if over budget and raiseOnLimit is set
     * @throws Exception anything the task throws, unchanged
     */
    public <T> T call(Callable<T> task) throws Exception {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        attempt();
        return task.call();
    }

    /**
     * Runs the task once admitted.
     *
     * @param task The rate-limited work
     * @throws InterruptedException if interrupted while sleeping on the limit
     */
    public void run(Runnable task) throws InterruptedException {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        attempt();
        task.run();
    }

    /**
     * Returns a callable that goes through this guard on every invocation.
     *
     * @param task The rate-limited work
     * @return Guarded callable
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return () -> call(task);
    }

    /**
     * Current token count, read under the lock.
     *
     * @return Tokens available as of the last decision
     */
    public double availableTokens() {
        lock.lock();
        try {
            return limiter.tokens();
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterConfig config() {
        return config;
    }
}
