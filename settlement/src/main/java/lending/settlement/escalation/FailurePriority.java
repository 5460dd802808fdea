package lending.settlement.escalation;

public enum FailurePriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
