package com.dcv.validation;

/**
 * Validation status polling budget.
 *
 * <p>The total wait never exceeds the timeout and is split into checks spaced by the interval:
 * <pre>
 *     attempts = ceil(timeout / interval)
 *     wait(n)  = min(interval, timeout - (n - 1) * interval)
 * </pre>
 * <p>A timeout of 0 disables polling, the result must then be verified manually.
 * <p>Example with a 180s timeout and a 60s interval:
 * <ul>
 *     <li>Check 1 after 60s</li>
 *     <li>Check 2 after 120s</li>
 *     <li>Check 3 after 180s</li>
 * </ul>
 */
public class PollingPolicy {

    private final int timeoutSeconds;
    private final int intervalSeconds;

    /**
     * Constructs a new PollingPolicy.
     *
     * @param timeoutSeconds  Total seconds to wait, 0 to skip polling.
     * @param intervalSeconds Seconds between checks, capped at the timeout.
     */
    public PollingPolicy(int timeoutSeconds, int intervalSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative: " + timeoutSeconds);
        }
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive: " + intervalSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
        this.intervalSeconds = timeoutSeconds > 0 ? Math.min(intervalSeconds, timeoutSeconds) : intervalSeconds;
    }

    /**
     * Checks if polling is skipped.
     *
     * @return Boolean.
     */
    public boolean isDisabled() {
        return timeoutSeconds == 0;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getIntervalSeconds() {
        return intervalSeconds;
    }

    /**
     * Gets number of status checks.
     *
     * @return Attempts, 0 when disabled.
     */
    public int getMaxAttempts() {
        if (isDisabled()) {
            return 0;
        }
        return (timeoutSeconds + intervalSeconds - 1) / intervalSeconds;
    }

    /**
     * Gets seconds to wait before given attempt.
     *
     * @param attempt Attempt number starting at 1.
     * @return Seconds.
     */
    public int getWaitBefore(int attempt) {
        if (attempt < 1 || attempt > getMaxAttempts()) {
            throw new IllegalArgumentException("Attempt out of range: " + attempt);
        }
        return Math.min(intervalSeconds, timeoutSeconds - (attempt - 1) * intervalSeconds);
    }
}
