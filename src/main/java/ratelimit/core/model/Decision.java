package ratelimit.core.model;

/**
 * Outcome of a single admission attempt.
 */
public enum Decision {
    /** Admitted within budget. */
    ALLOW,
    /** Admitted after the caller was blocked until the window passed. */
    DELAY,
    /** Over budget but admitted anyway (neither sleeping nor raising). */
    PASS_THROUGH,
    /** Over budget and not admitted. */
    REJECT
}
