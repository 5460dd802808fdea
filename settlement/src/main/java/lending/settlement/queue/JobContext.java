package lending.settlement.queue;

import java.util.UUID;

public record JobContext(UUID jobId, int attempt, int maxAttempts) {

    public boolean isFinalAttempt() {
        return attempt >= maxAttempts;
    }
}
