package lending.settlement.queue;

import lending.settlement.domain.job.BackoffType;

import java.time.Duration;

public record Backoff(BackoffType type, Duration delay) {

    public static final Backoff NONE = new Backoff(BackoffType.FIXED, Duration.ZERO);

    public static Backoff fixed(Duration delay) {
        return new Backoff(BackoffType.FIXED, delay);
    }

    public static Backoff exponential(Duration delay) {
        return new Backoff(BackoffType.EXPONENTIAL, delay);
    }

    // delay before the next run once attemptsMade attempts have failed: exponential is delay * 2^(attemptsMade - 1)
    public Duration delayAfter(int attemptsMade) {
        if (type == BackoffType.FIXED) {
            return delay;
        }
        int exponent = Math.max(0, attemptsMade - 1);
        return delay.multipliedBy(1L << Math.min(exponent, 30));
    }
}
