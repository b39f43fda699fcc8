package com.dcv.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class PollingPolicyTest {

    @ParameterizedTest
    @CsvSource({
            "180, 60, 3",
            "100, 60, 2",
            "60, 60, 1",
            "30, 60, 1",
            "1, 60, 1",
            "181, 60, 4"
    })
    void maxAttempts(int timeout, int interval, int attempts) {
        assertEquals(attempts, new PollingPolicy(timeout, interval).getMaxAttempts());
    }

    @Test
    void totalWaitMatchesTimeout() {
        PollingPolicy policy = new PollingPolicy(100, 60);

        assertEquals(60, policy.getWaitBefore(1));
        assertEquals(40, policy.getWaitBefore(2));
        assertThrows(IllegalArgumentException.class, () -> policy.getWaitBefore(3));
    }

    @Test
    void intervalCappedAtTimeout() {
        PollingPolicy policy = new PollingPolicy(30, 60);

        assertEquals(30, policy.getIntervalSeconds());
        assertEquals(30, policy.getWaitBefore(1));
    }

    @Test
    void zeroTimeoutDisables() {
        PollingPolicy policy = new PollingPolicy(0, 60);

        assertTrue(policy.isDisabled());
        assertEquals(0, policy.getMaxAttempts());
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PollingPolicy(-1, 60));
        assertThrows(IllegalArgumentException.class, () -> new PollingPolicy(60, 0));
    }
}
