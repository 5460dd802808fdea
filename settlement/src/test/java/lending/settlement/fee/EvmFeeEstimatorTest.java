package lending.settlement.fee;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.network.BlockchainKeys;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lending.settlement.sim.fakechain.FakeChain;
import lending.settlement.sim.fakechain.FakeChainClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvmFeeEstimatorTest {

    private static final BlockchainNetworkProfile ETHEREUM = new BlockchainNetworkProfile(
            BlockchainKeys.ETHEREUM_MAINNET, ChainFamily.EVM, "Ethereum Mainnet", "ETH", 12, Duration.ofMinutes(5),
            true, BigDecimal.valueOf(25), null, "5-10 minutes", "2-5 minutes", "1-2 minutes");
    private static final BlockchainNetworkProfile BSC = new BlockchainNetworkProfile(
            BlockchainKeys.BSC_MAINNET, ChainFamily.EVM, "BNB Smart Chain", "BNB", 12, Duration.ofSeconds(30),
            false, BigDecimal.valueOf(5), null, "1-2 minutes", "30-60 seconds", "15-30 seconds");

    private FakeChain fakeChain;
    private EvmFeeEstimator estimator;

    @BeforeEach
    void setUp() {
        fakeChain = new FakeChain();
        fakeChain.register(BlockchainKeys.ETHEREUM_MAINNET);
        fakeChain.register(BlockchainKeys.BSC_MAINNET);
        estimator = new EvmFeeEstimator(new ChainClientRouter(List.of(
                new FakeChainClient(BlockchainKeys.ETHEREUM_MAINNET, fakeChain),
                new FakeChainClient(BlockchainKeys.BSC_MAINNET, fakeChain)
        )));
    }

    @Test
    void eip1559_usesLatestBaseFeePlusScaledMedianReward() {
        // base fee 18 gwei, median reward 2 gwei
        NetworkFeeEstimate standard = estimator.estimate(ETHEREUM, "slip44:60", FeePriority.STANDARD, BigDecimal.ONE);
        NetworkFeeEstimate fast = estimator.estimate(ETHEREUM, "slip44:60", FeePriority.FAST, BigDecimal.ONE);

        assertThat(standard.gasPriceGwei()).isEqualByComparingTo("20");
        assertThat(standard.gasLimit()).isEqualTo(21_000L);
        assertThat(standard.fee()).isEqualByComparingTo("0.00042");
        assertThat(standard.feeUnit()).isEqualTo("ETH");
        assertThat(standard.estimatedConfirmationTime()).isEqualTo("2-5 minutes");
        assertThat(fast.gasPriceGwei()).isEqualByComparingTo("21");
        assertThat(fast.fee()).isEqualByComparingTo("0.000441");
    }

    @Test
    void tokenTransfer_usesTokenGasLimit() {
        NetworkFeeEstimate estimate = estimator.estimate(
                ETHEREUM, "erc20:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", FeePriority.STANDARD, BigDecimal.TEN);

        assertThat(estimate.gasLimit()).isEqualTo(65_000L);
        assertThat(estimate.fee()).isEqualByComparingTo("0.0013");
    }

    @Test
    void legacyNetwork_scalesNodeGasPrice() {
        fakeChain.setGasPrice(BlockchainKeys.BSC_MAINNET, BigInteger.valueOf(5_000_000_000L));

        NetworkFeeEstimate estimate = estimator.estimate(BSC, "slip44:714", FeePriority.FAST, BigDecimal.ONE);

        assertThat(estimate.gasPriceGwei()).isEqualByComparingTo("7.5");
        assertThat(estimate.fee()).isEqualByComparingTo("0.0001575");
        assertThat(estimate.feeUnit()).isEqualTo("BNB");
    }

    @Test
    void unreachableEip1559Node_fallsBackToStaticBasePlusScaledStatic() {
        fakeChain.setNetworkDown(BlockchainKeys.ETHEREUM_MAINNET, true);

        NetworkFeeEstimate estimate = estimator.estimate(ETHEREUM, "slip44:60", FeePriority.STANDARD, BigDecimal.ONE);

        assertThat(estimate.gasPriceGwei()).isEqualByComparingTo("50");
        assertThat(estimate.fee()).isEqualByComparingTo("0.00105");
    }

    @Test
    void unreachableLegacyNode_fallsBackToScaledStaticPrice() {
        fakeChain.setNetworkDown(BlockchainKeys.BSC_MAINNET, true);

        NetworkFeeEstimate estimate = estimator.estimate(BSC, "slip44:714", FeePriority.SLOW, BigDecimal.ONE);

        assertThat(estimate.gasPriceGwei()).isEqualByComparingTo("4");
        assertThat(estimate.fee()).isEqualByComparingTo("0.000084");
    }
}
