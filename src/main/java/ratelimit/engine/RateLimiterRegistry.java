package ratelimit.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratelimit.core.clock.Clock;
import ratelimit.core.clock.Sleeper;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Named guards, one per protected operation.
 *
 * An application that calls several rate-limited endpoints owns one registry and
 * looks guards up by operation name instead of sharing a process-wide default.
 * A guard is created once, on first use or explicit registration, and then lives
 * as long as the registry; guards are never evicted or rebuilt, so their token
 * state survives for the whole lifetime of the operation.
 *
 * Thread-safety: lookups and registrations are atomic per name.
 */
public final class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Clock clock;
    private final Sleeper sleeper;
    private final RateLimiterConfig defaultConfig;
    private final ConcurrentMap<String, RateLimitGuard> guards = new ConcurrentHashMap<>();

    /**
     * @param clock Clock shared by all guards
     * @param sleeper Sleeper shared by all guards
     * @param defaultConfig Configuration for names that were never registered explicitly
     */
    public RateLimiterRegistry(Clock clock, Sleeper sleeper, RateLimiterConfig defaultConfig) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        this.clock = clock;
        this.sleeper = sleeper;
        this.defaultConfig = defaultConfig;
    }

    /**
     * Returns the guard for a name, creating it from the default configuration if needed.
     *
     * @param name Operation name
     * @return Guard for the name (never null)
     */
    public RateLimitGuard guard(String name) {
        requireName(name);
        return guards.computeIfAbsent(name, n -> create(n, defaultConfig));
    }

    /**
     * Registers a guard with its own configuration.
     *
     * @param name Operation name
     * @param config Configuration for this operation
     * @return The new guard
     * @throws IllegalStateException if the name already has a guard
     */
    public RateLimitGuard register(String name, RateLimiterConfig config) {
        requireName(name);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        boolean[] created = {false};
        RateLimitGuard guard = guards.computeIfAbsent(name, n -> {
            created[0] = true;
            return create(n, config);
        });
        if (!created[0]) {
            throw new IllegalStateException("guard already registered: " + name);
        }
        return guard;
    }

    public boolean contains(String name) {
        return name != null && guards.containsKey(name);
    }

    public int size() {
        return guards.size();
    }

    /**
     * @return Registered names, sorted
     */
    public Set<String> names() {
        return new TreeSet<>(guards.keySet());
    }

    public RateLimiterConfig getDefaultConfig() {
        return defaultConfig;
    }

    private RateLimitGuard create(String name, RateLimiterConfig config) {
        log.info("Registering rate limit guard '{}': duration={}s, burstMax={}, sleepOnLimit={}, raiseOnLimit={}",
            name, config.durationSeconds(), config.burstMax(), config.sleepOnLimit(), config.raiseOnLimit());
        return new RateLimitGuard(clock, sleeper, config);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }
}
