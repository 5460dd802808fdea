package lending.settlement.domain.job;

public enum BackoffType {
    FIXED,
    EXPONENTIAL
}
