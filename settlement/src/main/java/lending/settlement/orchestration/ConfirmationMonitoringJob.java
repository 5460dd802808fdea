package lending.settlement.orchestration;

import java.util.UUID;

// attempt starts at 1; every reschedule enqueues a new job with attempt + 1
public record ConfirmationMonitoringJob(
        UUID withdrawalId,
        String txHash,
        String blockchainKey,
        int attempt
) {
    public ConfirmationMonitoringJob next(int nextAttempt) {
        return new ConfirmationMonitoringJob(withdrawalId, txHash, blockchainKey, nextAttempt);
    }
}
