package com.dcv.validation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Semaphore;

/**
 * Admission control for concurrently running workflows.
 * <p>
 * Keeps the request rate under the certificate authority ceiling of about 100 calls per 5 seconds.
 * A run with fewer domains than the threshold stays under the ceiling at full fan-out and gets an unlimited gate.
 * Must be paired as {@link #acquire()} then {@link #release()} in a try-finally block.
 */
public class RateGate {
    private static final Logger log = LogManager.getLogger(RateGate.class);

    public static final int DEFAULT_THRESHOLD = 40;
    public static final int DEFAULT_PERMITS = 20;

    private final Semaphore semaphore;
    private final int permits;

    private RateGate(int permits) {
        this.permits = permits;
        this.semaphore = permits > 0 ? new Semaphore(permits, true) : null;
    }

    /**
     * Gets a gate that never blocks.
     *
     * @return RateGate.
     */
    public static RateGate unlimited() {
        return new RateGate(0);
    }

    /**
     * Gets a gate admitting at most given workflows at once.
     *
     * @param permits Concurrent workflows.
     * @return RateGate.
     */
    public static RateGate limited(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive: " + permits);
        }
        return new RateGate(permits);
    }

    /**
     * Gets the gate for a run of given size.
     *
     * @param domainCount Domains in the run.
     * @param threshold   Domain count from which the gate is limited.
     * @param permits     Concurrent workflows once limited.
     * @return RateGate.
     */
    public static RateGate forDomainCount(int domainCount, int threshold, int permits) {
        if (domainCount >= threshold) {
            log.info("Rate gate engaged: {} domains, at most {} concurrent validations", domainCount, permits);
            return limited(permits);
        }
        return unlimited();
    }

    /**
     * Blocks until admitted.
     *
     * @throws InterruptedException If interrupted while waiting.
     */
    public void acquire() throws InterruptedException {
        if (semaphore == null) {
            return;
        }

        if (semaphore.availablePermits() == 0) {
            log.debug("Rate gate saturated, waiting for permit (permits: {})", permits);
        }
        semaphore.acquire();
        log.trace("Acquired rate gate permit (available: {})", semaphore.availablePermits());
    }

    /**
     * Releases a permit.
     */
    public void release() {
        if (semaphore == null) {
            return;
        }

        semaphore.release();
        log.trace("Released rate gate permit (available: {})", semaphore.availablePermits());
    }

    /**
     * Checks if this gate limits concurrency.
     *
     * @return Boolean.
     */
    public boolean isLimited() {
        return semaphore != null;
    }

    /**
     * Gets configured permits.
     *
     * @return Permits, 0 when unlimited.
     */
    public int getPermits() {
        return permits;
    }

    /**
     * Gets workflows currently admitted.
     *
     * @return Count, 0 when unlimited.
     */
    public int getInFlight() {
        return semaphore != null ? permits - semaphore.availablePermits() : 0;
    }
}
