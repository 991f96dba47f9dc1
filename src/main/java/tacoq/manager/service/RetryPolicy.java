package tacoq.manager.service;

import java.time.Duration;

/**
 * Backoff between attempts of a retried operation.
 */
public interface RetryPolicy {

    /**
     * @param attempt number of the attempt that just failed, starting at 1
     */
    Duration nextBackoff(long attempt);

    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }

    /** Doubles the base delay after every failed attempt */
    static RetryPolicy exponential(Duration base) {
        return attempt -> base.multipliedBy(1L << Math.min(attempt - 1, 16));
    }
}
