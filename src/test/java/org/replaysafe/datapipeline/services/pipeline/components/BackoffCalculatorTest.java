package org.replaysafe.datapipeline.services.pipeline.components;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class BackoffCalculatorTest {

    @Test
    void withoutJitter_doublesPerAttempt() {
        BackoffCalculator backoff = new BackoffCalculator(100, 10_000, 0.0);

        assertEquals(100, backoff.calculate(1));
        assertEquals(200, backoff.calculate(2));
        assertEquals(400, backoff.calculate(3));
        assertEquals(800, backoff.calculate(4));
    }

    @Test
    void delay_isCappedAtMaximum() {
        BackoffCalculator backoff = new BackoffCalculator(100, 1_000, 0.5);

        assertEquals(1_000, backoff.calculate(10));
        assertEquals(1_000, backoff.calculate(Integer.MAX_VALUE));
    }

    @Test
    void jitter_staysWithinFactor() {
        BackoffCalculator backoff = new BackoffCalculator(100, 10_000, 0.1);

        for (int i = 0; i < 200; i++) {
            long delay = backoff.calculate(2);
            assertTrue(delay >= 200 && delay <= 220, "delay out of range: " + delay);
        }
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(0, 100, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(200, 100, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(100, 200, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new BackoffCalculator(100, 200, 0.1).calculate(0));
    }
}
