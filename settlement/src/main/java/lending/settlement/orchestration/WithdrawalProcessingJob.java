package lending.settlement.orchestration;

import java.math.BigDecimal;
import java.util.UUID;

public record WithdrawalProcessingJob(
        UUID withdrawalId,
        String userId,
        BigDecimal amount,
        String blockchainKey,
        String tokenId,
        String beneficiaryAddress
) {}
