package lending.settlement.queue;

import java.time.Duration;

/**
 * Enqueue settings for one job.
 *
 * @param delay    how long after enqueue the job becomes due
 * @param priority lower runs first
 * @param attempts total attempts including the first run
 * @param backoff  delay between failed attempts
 */
public record JobOptions(Duration delay, int priority, int attempts, Backoff backoff) {

    public static JobOptions once(Duration delay, int priority) {
        return new JobOptions(delay, priority, 1, Backoff.NONE);
    }
}
