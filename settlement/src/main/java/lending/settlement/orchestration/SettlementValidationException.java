package lending.settlement.orchestration;

import lending.settlement.escalation.FailureTag;
import lombok.Getter;

// Non-retryable: the processor escalates it once instead of handing it back to the queue.
@Getter
public class SettlementValidationException extends RuntimeException {

    private final FailureTag tag;

    public SettlementValidationException(FailureTag tag, String message) {
        super(message);
        this.tag = tag;
    }

    public SettlementValidationException(FailureTag tag, String message, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }
}
