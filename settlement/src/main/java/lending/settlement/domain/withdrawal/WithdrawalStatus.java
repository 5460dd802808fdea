package lending.settlement.domain.withdrawal;

public enum WithdrawalStatus {
    REQUESTED,
    SENT,
    CONFIRMED,
    FAILED,
    // refund sub-states are written by the admin review flow, never by the settlement pipeline
    REFUND_REQUESTED,
    REFUND_APPROVED,
    REFUND_REJECTED;

    public boolean canTransitionTo(WithdrawalStatus next) {
        return switch (this) {
            case REQUESTED -> next == SENT || next == FAILED;
            case SENT -> next == CONFIRMED || next == FAILED;
            case FAILED -> next == REFUND_REQUESTED;
            case REFUND_REQUESTED -> next == REFUND_APPROVED || next == REFUND_REJECTED;
            case CONFIRMED, REFUND_APPROVED, REFUND_REJECTED -> false;
        };
    }
}
