package lending.settlement.escalation;

public record FailureRecord(
        FailureTag tag,
        FailureType type,
        String reason,
        String recommendedAction,
        FailurePriority priority,
        boolean refundEligible
) {
    // persisted as the withdrawal's failure reason
    public String taggedReason() {
        return tag.name() + ": " + reason;
    }
}
