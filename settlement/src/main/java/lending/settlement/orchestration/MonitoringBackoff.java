package lending.settlement.orchestration;

import java.time.Duration;
import java.util.Optional;

/**
 * Reschedule plan for confirmation monitoring. Pure: the next step depends only on the
 * attempt number that just finished.
 */
public final class MonitoringBackoff {

    public static final int MAX_ATTEMPTS = 20;
    static final long BASE_DELAY_MS = 120_000L;
    static final double MULTIPLIER = 1.5;
    static final long MAX_DELAY_MS = 600_000L;

    private MonitoringBackoff() {
    }

    public record Step(int attempt, Duration delay) {}

    // min(120s * 1.5^(attempt-1), 10min)
    public static Duration delayFor(int attempt) {
        double raw = BASE_DELAY_MS * Math.pow(MULTIPLIER, Math.max(0, attempt - 1));
        return Duration.ofMillis((long) Math.min(raw, MAX_DELAY_MS));
    }

    // Still pending after this attempt. Empty once MAX_ATTEMPTS reschedules have been used.
    public static Optional<Step> afterPending(int attempt) {
        if (attempt > MAX_ATTEMPTS) {
            return Optional.empty();
        }
        return Optional.of(next(attempt));
    }

    // The status query itself failed on this attempt.
    public static Optional<Step> afterError(int attempt) {
        if (attempt >= MAX_ATTEMPTS) {
            return Optional.empty();
        }
        return Optional.of(next(attempt));
    }

    private static Step next(int attempt) {
        int nextAttempt = attempt + 1;
        return new Step(nextAttempt, delayFor(nextAttempt));
    }
}
