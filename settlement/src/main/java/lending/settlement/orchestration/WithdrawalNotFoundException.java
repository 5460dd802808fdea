package lending.settlement.orchestration;

import java.util.UUID;

public class WithdrawalNotFoundException extends RuntimeException {
    public WithdrawalNotFoundException(UUID withdrawalId) {
        super("withdrawal not found: " + withdrawalId);
    }
}
