package lending.settlement.fee;

import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;

import java.math.BigDecimal;

// One implementation per chain family. Must always produce an estimate; the last tier is static.
public interface FeeEstimator {

    ChainFamily family();

    NetworkFeeEstimate estimate(BlockchainNetworkProfile profile, String tokenId, FeePriority priority, BigDecimal amount);
}
