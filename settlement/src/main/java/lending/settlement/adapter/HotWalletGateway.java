package lending.settlement.adapter;

import java.math.BigDecimal;
import java.util.UUID;

public interface HotWalletGateway {

    boolean supports(String blockchainKey);

    String getAddress(String blockchainKey);

    // Signs and submits; a returned hash means the node accepted the transaction, not that it is included.
    TransferResult transfer(TransferCommand command);

    record TransferCommand(
            UUID withdrawalId,
            String blockchainKey,
            String tokenId,
            String to,
            BigDecimal amount,
            int decimals
    ) {}

    record TransferResult(String txHash) {}
}
