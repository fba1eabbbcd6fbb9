package com.questrail.remotedisplay.session;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Authentication attempt tracker.
 *
 * - Counts consecutive failed attempts per username
 * - Resets on successful authentication
 * - Does not encode the retry policy (the session owns the budget)
 */
public final class AuthAttemptTracker {

    private final ConcurrentMap<String, Integer> failures = new ConcurrentHashMap<>();

    /**
     * Record a failed attempt.
     *
     * @return the updated failure count
     */
    public int recordFailure(String username) {
        return failures.merge(username, 1, Integer::sum);
    }

    /**
     * Reset the count after a successful authentication.
     */
    public void reset(String username) {
        failures.remove(username);
    }

    /**
     * Current failure count (0 if none).
     */
    public int failuresFor(String username) {
        return failures.getOrDefault(username, 0);
    }
}
