package lending.settlement.queue;

public enum JobOutcome {
    SENT,
    CONFIRMED,
    PENDING,
    SKIPPED,
    FAILED,
    TIMEOUT,
    ESCALATED
}
