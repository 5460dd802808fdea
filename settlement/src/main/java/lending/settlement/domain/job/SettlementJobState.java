package lending.settlement.domain.job;

public enum SettlementJobState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
