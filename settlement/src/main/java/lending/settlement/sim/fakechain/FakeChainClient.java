package lending.settlement.sim.fakechain;

import lending.settlement.adapter.BitcoinChainClient;
import lending.settlement.adapter.EvmChainClient;
import lending.settlement.adapter.SolanaChainClient;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.List;

// One instance per network; implements every family view so fee estimators resolve it by type.
@RequiredArgsConstructor
public class FakeChainClient implements EvmChainClient, BitcoinChainClient, SolanaChainClient {

    private final String blockchainKey;
    private final FakeChain fakeChain;

    @Override
    public String blockchainKey() {
        return blockchainKey;
    }

    @Override
    public long getLatestHeight() {
        return fakeChain.height(blockchainKey);
    }

    @Override
    public TransactionStatus getTransactionStatus(String txHash) {
        return fakeChain.status(blockchainKey, txHash);
    }

    @Override
    public BigInteger getGasPrice() {
        return fakeChain.gasPrice(blockchainKey);
    }

    @Override
    public FeeHistory getFeeHistory(int blockCount, List<Double> rewardPercentiles) {
        return fakeChain.feeHistory(blockchainKey, blockCount, rewardPercentiles.size());
    }

    @Override
    public BitcoinFeeTiers getRecommendedFeeRates() {
        return fakeChain.bitcoinFeeTiers(blockchainKey);
    }

    @Override
    public BitcoinFeeTiers getBlockTargetFeeRates() {
        return fakeChain.bitcoinFeeTiers(blockchainKey);
    }

    @Override
    public List<Long> getRecentPrioritizationFees() {
        return fakeChain.prioritizationFees(blockchainKey);
    }
}
