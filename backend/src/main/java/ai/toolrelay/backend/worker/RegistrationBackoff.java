package ai.toolrelay.backend.worker;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with jitter for registration attempts against a master
 * that may not be up yet. Attempts are never capped; only the delay is.
 */
public class RegistrationBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterFactor;
    private final Random random;

    public RegistrationBackoff(Duration initialDelay, Duration maxDelay, double multiplier, double jitterFactor) {
        this(initialDelay, maxDelay, multiplier, jitterFactor, new Random());
    }

    RegistrationBackoff(Duration initialDelay, Duration maxDelay, double multiplier, double jitterFactor, Random random) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * @param attempt zero-based number of failed attempts so far
     * @return how long to wait before the next attempt, never above the max delay
     */
    public Duration delayFor(int attempt) {
        double base = initialDelay.toMillis() * Math.pow(multiplier, Math.max(attempt, 0));
        double capped = Math.min(base, maxDelay.toMillis());

        if (jitterFactor > 0) {
            double jitter = capped * jitterFactor * (random.nextDouble() * 2 - 1);
            capped = Math.min(Math.max(capped + jitter, 0), maxDelay.toMillis());
        }
        return Duration.ofMillis(Math.round(capped));
    }
}
