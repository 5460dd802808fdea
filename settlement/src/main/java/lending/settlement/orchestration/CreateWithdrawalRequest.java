package lending.settlement.orchestration;

import java.math.BigDecimal;
import java.util.UUID;

public record CreateWithdrawalRequest(
        UUID beneficiaryId,
        String currencyBlockchainKey,
        String currencyTokenId,
        BigDecimal amount,
        String twoFactorCode
) {}
