package ratelimit.core.model;

/**
 * Pure core contract: no locks, no sleeping.
 * Callers that share an instance between threads must serialize access.
 */
public interface RateLimiter {

    /**
     * Replenishes tokens and, if budget is available or the window has passed,
     * consumes one. Returns ALLOW when a token was taken, otherwise REJECT with
     * the remaining window; a REJECT keeps the replenishment but takes nothing.
     */
    RateLimitResult tryAcquire();

    /**
     * Consumes a token (floored at zero) and restarts the window without any
     * budget check. Used to let an over-budget call through.
     */
    void admit();

    /**
     * Tokens currently available, between zero and the configured maximum.
     */
    double tokens();
}
