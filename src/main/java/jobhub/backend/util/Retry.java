package jobhub.backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Exponential backoff for transient adapter errors (timeouts, throttling, lost connections).
 * Used inside storage, vault and compute adapters only; core components never retry.
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public Retry(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts <= 0");
        if (initialDelay == null || initialDelay.isNegative()) throw new IllegalArgumentException("invalid initialDelay");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
    }

    public static Retry defaults() {
        return new Retry(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5));
    }

    public static Retry none() {
        return new Retry(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the given attempt (1-based attempt that just failed), or null when exhausted.
     */
    public Duration nextDelay(int attempt) {
        if (attempt >= maxAttempts) return null;
        double factor = Math.pow(multiplier, attempt - 1);
        long delayMillis = Math.min((long) (initialDelay.toMillis() * factor), maxDelay.toMillis());
        return Duration.ofMillis(delayMillis);
    }

    /**
     * Run the action, retrying while {@code transient} accepts the failure.
     * Non-transient failures and the last transient one are rethrown unchanged.
     */
    public <T> T call(String operation, Callable<T> action, Predicate<Throwable> isTransient) throws Exception {
        int attempt = 1;
        while (true) {
            try {
                return action.call();
            } catch (Exception e) {
                Duration delay = isTransient.test(e) ? nextDelay(attempt) : null;
                if (delay == null) {
                    throw e;
                }
                log.warn("{} failed (attempt {} of {}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                sleep(delay);
                attempt++;
            }
        }
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
