package com.dcv.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RateGateTest {

    @Test
    void belowThresholdUnlimited() throws InterruptedException {
        RateGate gate = RateGate.forDomainCount(39, 40, 20);

        assertFalse(gate.isLimited());
        for (int i = 0; i < 100; i++) {
            gate.acquire();
        }
        assertEquals(0, gate.getInFlight());
    }

    @Test
    void atThresholdLimited() throws InterruptedException {
        RateGate gate = RateGate.forDomainCount(40, 40, 20);

        assertTrue(gate.isLimited());
        assertEquals(20, gate.getPermits());

        gate.acquire();
        gate.acquire();
        assertEquals(2, gate.getInFlight());

        gate.release();
        assertEquals(1, gate.getInFlight());
    }

    @Test
    void blocksWhenSaturated() throws InterruptedException {
        RateGate gate = RateGate.limited(1);
        gate.acquire();

        Thread waiter = new Thread(() -> {
            try {
                gate.acquire();
                gate.release();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        waiter.join(200);
        assertTrue(waiter.isAlive(), "Second acquire should block");

        gate.release();
        waiter.join(2000);
        assertFalse(waiter.isAlive());
    }

    @Test
    void invalidPermits() {
        assertThrows(IllegalArgumentException.class, () -> RateGate.limited(0));
    }
}
