package lending.settlement.adapter;

import java.math.BigDecimal;

public interface BitcoinChainClient extends ChainRpcClient {

    // mempool.space style tiers
    BitcoinFeeTiers getRecommendedFeeRates();

    // Blockstream block-target estimates mapped onto the same tiers
    BitcoinFeeTiers getBlockTargetFeeRates();

    // sat/vB
    record BitcoinFeeTiers(BigDecimal fastest, BigDecimal halfHour, BigDecimal hour, BigDecimal economy) {
    }
}
