package jobhub.backend.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryTest {

    private final Retry retry = new Retry(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(3));

    @Test
    void retriesTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("timeout");
            }
            return "ok";
        }, e -> e instanceof IOException);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        IOException e = assertThrows(IOException.class, () -> retry.call("down", () -> {
            calls.incrementAndGet();
            throw new IOException("timeout");
        }, t -> true));

        assertEquals("timeout", e.getMessage());
        assertEquals(3, calls.get());
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> retry.call("bad", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        }, e -> e instanceof IOException));

        assertEquals(1, calls.get());
    }

    @Test
    void backoffGrowsUpToCap() {
        assertEquals(Duration.ofMillis(1), retry.nextDelay(1));
        assertEquals(Duration.ofMillis(2), retry.nextDelay(2));
        assertNull(retry.nextDelay(3));

        Retry capped = new Retry(10, Duration.ofMillis(100), 10.0, Duration.ofMillis(500));
        assertEquals(Duration.ofMillis(500), capped.nextDelay(4));
    }

    @Test
    void invalidSettingsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Retry(0, Duration.ZERO, 1.0, null));
        assertThrows(IllegalArgumentException.class, () -> new Retry(1, Duration.ZERO, 0.5, null));
    }
}
