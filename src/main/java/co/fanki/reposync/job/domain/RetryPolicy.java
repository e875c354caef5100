package co.fanki.reposync.job.domain;

import co.fanki.reposync.shared.Preconditions;

import java.time.Duration;
import java.util.Random;

/**
 * Bounded retry with capped exponential backoff and jitter.
 *
 * <p>The base delay before attempt {@code n + 1} is
 * {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}. The
 * jitter factor then takes a random share of it off, so the actual delay
 * falls in {@code [(1 - jitter) * base, base]}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitter;
    private final Random random;

    /**
     * Creates a new RetryPolicy.
     *
     * @param theMaxAttempts total sync attempts per pass, at least 1
     * @param theInitialBackoff delay after the first failure
     * @param theMaxBackoff upper bound of any delay
     * @param theJitter share of the delay that is randomized, 0 to 1
     * @param theRandom the source of jitter
     */
    public RetryPolicy(final int theMaxAttempts,
            final Duration theInitialBackoff,
            final Duration theMaxBackoff,
            final double theJitter,
            final Random theRandom) {
        this.maxAttempts = Preconditions.requirePositive(theMaxAttempts,
                "Max attempts must be positive");
        this.initialBackoff = Preconditions.requirePositive(theInitialBackoff,
                "Initial backoff must be positive");
        this.maxBackoff = Preconditions.requirePositive(theMaxBackoff,
                "Max backoff must be positive");
        Preconditions.require(theMaxBackoff.compareTo(theInitialBackoff) >= 0,
                "Max backoff must not be lower than the initial backoff");
        Preconditions.require(theJitter >= 0 && theJitter <= 1,
                "Jitter must be between 0 and 1");
        this.jitter = theJitter;
        this.random = Preconditions.requireNonNull(theRandom,
                "Random is required");
    }

    /**
     * Checks whether another attempt is allowed.
     *
     * @param attemptsMade attempts already made in the pass
     * @return true if fewer than the maximum were made
     */
    public boolean canRetry(final int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Computes the un-jittered delay after a failed attempt.
     *
     * @param failedAttempt the 1-based attempt that failed
     * @return the capped exponential delay
     */
    public Duration baseBackoff(final int failedAttempt) {
        Preconditions.requirePositive(failedAttempt,
                "Attempt numbers start at 1");
        final long cap = maxBackoff.toMillis();
        long millis = initialBackoff.toMillis();
        for (int i = 1; i < failedAttempt && millis < cap; i++) {
            millis = millis * 2;
        }
        return Duration.ofMillis(Math.min(millis, cap));
    }

    /**
     * Computes the jittered delay after a failed attempt.
     *
     * @param failedAttempt the 1-based attempt that failed
     * @return the delay to wait before the next attempt
     */
    public Duration backoff(final int failedAttempt) {
        final long base = baseBackoff(failedAttempt).toMillis();
        final double factor;
        synchronized (random) {
            factor = 1.0 - jitter * random.nextDouble();
        }
        return Duration.ofMillis(Math.round(base * factor));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

}
