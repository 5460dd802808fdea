package lending.settlement.adapter;

import java.math.BigInteger;
import java.util.List;

public interface EvmChainClient extends ChainRpcClient {

    BigInteger getGasPrice();

    FeeHistory getFeeHistory(int blockCount, List<Double> rewardPercentiles);

    // baseFeePerGas and reward are wei values, oldest block first
    record FeeHistory(List<BigInteger> baseFeePerGas, List<List<BigInteger>> reward) {
    }
}
