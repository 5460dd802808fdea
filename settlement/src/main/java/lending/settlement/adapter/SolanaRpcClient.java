package lending.settlement.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SolanaRpcClient implements SolanaChainClient {

    // a finalized signature reports null confirmations; count it as fully rooted
    static final int FINALIZED_CONFIRMATIONS = 32;

    private final String blockchainKey;
    private final JsonRpcClient rpc;

    public SolanaRpcClient(String blockchainKey, JsonRpcClient rpc) {
        this.blockchainKey = blockchainKey;
        this.rpc = rpc;
    }

    @Override
    public String blockchainKey() {
        return blockchainKey;
    }

    @Override
    public long getLatestHeight() {
        return rpc.call("getSlot", List.of()).asLong();
    }

    @Override
    public List<Long> getRecentPrioritizationFees() {
        JsonNode result = rpc.call("getRecentPrioritizationFees", List.of());
        List<Long> fees = new ArrayList<>();
        for (JsonNode entry : result) {
            fees.add(entry.path("prioritizationFee").asLong(0));
        }
        return fees;
    }

    @Override
    public TransactionStatus getTransactionStatus(String signature) {
        JsonNode result = rpc.call("getSignatureStatuses",
                List.of(List.of(signature), Map.of("searchTransactionHistory", true)));
        JsonNode status = result.path("value").path(0);
        if (status.isMissingNode() || status.isNull()) {
            return TransactionStatus.pending(0);
        }
        JsonNode err = status.get("err");
        if (err != null && !err.isNull()) {
            return TransactionStatus.failed(err.toString());
        }
        String commitment = status.path("confirmationStatus").asText("");
        JsonNode confirmations = status.get("confirmations");
        if (confirmations == null || confirmations.isNull()) {
            return "finalized".equals(commitment)
                    ? TransactionStatus.confirmed(FINALIZED_CONFIRMATIONS)
                    : TransactionStatus.pending(0);
        }
        boolean confirmed = "confirmed".equals(commitment) || "finalized".equals(commitment);
        return new TransactionStatus(confirmed, confirmations.asInt(), false, null);
    }
}
