package lending.settlement.adapter;

import java.util.List;

public interface SolanaChainClient extends ChainRpcClient {

    // prioritization fees of recent slots, added to the base fee as lamports
    List<Long> getRecentPrioritizationFees();
}
