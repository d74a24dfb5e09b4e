package xyz.firestige.retry.backoff.strategy;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FlatBackoffTest {

    @Test
    void nextDelay_alwaysReturnsDelay() {
        FlatBackoff backoff = new FlatBackoff(Duration.ofSeconds(2));

        assertEquals(Duration.ofSeconds(2), backoff.nextDelay());
        assertEquals(Duration.ofSeconds(2), backoff.nextDelay());
        backoff.reset();
        assertEquals(Duration.ofSeconds(2), backoff.nextDelay());
    }

    @Test
    void defaultConstructor_zeroDelay() {
        assertEquals(Duration.ZERO, new FlatBackoff().nextDelay());
    }

    @Test
    void constructor_invalidDelay_throwsException() {
        assertThrows(IllegalArgumentException.class, () -> new FlatBackoff(null));
        assertThrows(IllegalArgumentException.class, () -> new FlatBackoff(Duration.ofSeconds(-1)));
    }
}
