package lending.settlement.escalation;

/**
 * Every failure the settlement pipeline can raise. Each tag maps onto exactly one
 * {@link FailureType}; {@code failsWithdrawal} is false where the funds may already be
 * on-chain and the withdrawal must stay as it is until someone checks by hand.
 */
public enum FailureTag {
    NETWORK_NOT_OPERATIONAL(true),
    INVALID_ADDRESS(true),
    FEE_VALIDATION_FAILED(true),
    CURRENCY_NOT_CONFIGURED(true),
    HOT_WALLET_UNAVAILABLE(true),
    HOT_WALLET_MISMATCH(true),
    HOT_WALLET_INSUFFICIENT_FUNDS(true),
    BLOCKCHAIN_EXECUTION_FAILED(true),
    MAX_RETRIES_EXCEEDED(true),
    TRANSACTION_TIMEOUT(true),
    BLOCKCHAIN_REJECTION(true),
    TRANSFER_STATE_UNKNOWN(false),
    MONITORING_FAILURE(false);

    private final boolean failsWithdrawal;

    FailureTag(boolean failsWithdrawal) {
        this.failsWithdrawal = failsWithdrawal;
    }

    public boolean failsWithdrawal() {
        return failsWithdrawal;
    }

    public FailureType failureType() {
        return switch (this) {
            case NETWORK_NOT_OPERATIONAL, FEE_VALIDATION_FAILED -> FailureType.NETWORK_ERROR;
            case INVALID_ADDRESS -> FailureType.INVALID_ADDRESS;
            case HOT_WALLET_INSUFFICIENT_FUNDS -> FailureType.INSUFFICIENT_FUNDS;
            case TRANSACTION_TIMEOUT -> FailureType.TRANSACTION_TIMEOUT;
            case BLOCKCHAIN_REJECTION -> FailureType.BLOCKCHAIN_REJECTION;
            case MONITORING_FAILURE -> FailureType.MONITORING_FAILURE;
            case CURRENCY_NOT_CONFIGURED, HOT_WALLET_UNAVAILABLE, HOT_WALLET_MISMATCH,
                 BLOCKCHAIN_EXECUTION_FAILED, MAX_RETRIES_EXCEEDED, TRANSFER_STATE_UNKNOWN -> FailureType.SYSTEM_ERROR;
        };
    }
}
