package lending.settlement.fee;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.adapter.EvmChainClient;
import lending.settlement.adapter.EvmHotWalletGateway;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class EvmFeeEstimator implements FeeEstimator {

    static final long NATIVE_GAS_LIMIT = 21_000L;
    static final long TOKEN_GAS_LIMIT = 65_000L;
    static final int FEE_HISTORY_BLOCKS = 10;
    static final List<Double> REWARD_PERCENTILES = List.of(25.0, 50.0, 75.0);
    static final BigDecimal DEFAULT_PRIORITY_FEE_GWEI = BigDecimal.valueOf(2);
    static final BigDecimal DEFAULT_STATIC_GAS_PRICE_GWEI = BigDecimal.valueOf(20);

    private final ChainClientRouter chainClients;

    @Override
    public ChainFamily family() {
        return ChainFamily.EVM;
    }

    @Override
    public NetworkFeeEstimate estimate(BlockchainNetworkProfile profile, String tokenId, FeePriority priority, BigDecimal amount) {
        long gasLimit = EvmHotWalletGateway.isTokenTransfer(tokenId) ? TOKEN_GAS_LIMIT : NATIVE_GAS_LIMIT;

        Optional<EvmChainClient> client = client(profile);
        Optional<BigInteger> gasPriceWei = client.flatMap(c -> fetchGasPrice(c, profile));

        BigDecimal gasPriceGwei;
        if (gasPriceWei.isEmpty()) {
            gasPriceGwei = staticGasPrice(profile, priority);
        } else if (profile.eip1559()) {
            gasPriceGwei = feeHistoryGasPrice(client.get(), profile, priority)
                    .orElseGet(() -> legacyGasPrice(gasPriceWei.get(), priority));
        } else {
            gasPriceGwei = legacyGasPrice(gasPriceWei.get(), priority);
        }

        BigDecimal fee = Convert.fromWei(
                Convert.toWei(gasPriceGwei.multiply(BigDecimal.valueOf(gasLimit)), Convert.Unit.GWEI),
                Convert.Unit.ETHER
        ).stripTrailingZeros();

        return new NetworkFeeEstimate(
                fee,
                profile.nativeUnit(),
                profile.confirmationTime(priority),
                gasPriceGwei.stripTrailingZeros(),
                gasLimit
        );
    }

    private Optional<EvmChainClient> client(BlockchainNetworkProfile profile) {
        try {
            return Optional.of(chainClients.resolve(profile.blockchainKey(), EvmChainClient.class));
        } catch (IllegalArgumentException e) {
            log.warn("event=fee_oracle.evm.client_unavailable blockchainKey={} reason={}", profile.blockchainKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BigInteger> fetchGasPrice(EvmChainClient client, BlockchainNetworkProfile profile) {
        try {
            return Optional.of(client.getGasPrice());
        } catch (RuntimeException e) {
            log.warn(
                    "event=fee_oracle.evm.gas_price.failed blockchainKey={} fallback=static reason={}",
                    profile.blockchainKey(),
                    e.getMessage()
            );
            return Optional.empty();
        }
    }

    // base fee of the newest block + median priority reward, scaled by priority
    private Optional<BigDecimal> feeHistoryGasPrice(EvmChainClient client, BlockchainNetworkProfile profile, FeePriority priority) {
        EvmChainClient.FeeHistory history;
        try {
            history = client.getFeeHistory(FEE_HISTORY_BLOCKS, REWARD_PERCENTILES);
        } catch (RuntimeException e) {
            log.warn(
                    "event=fee_oracle.evm.fee_history.failed blockchainKey={} fallback=legacy reason={}",
                    profile.blockchainKey(),
                    e.getMessage()
            );
            return Optional.empty();
        }
        if (history == null || history.baseFeePerGas() == null || history.baseFeePerGas().isEmpty()) {
            log.warn("event=fee_oracle.evm.fee_history.empty blockchainKey={} fallback=legacy", profile.blockchainKey());
            return Optional.empty();
        }

        List<BigInteger> baseFees = history.baseFeePerGas();
        BigDecimal baseFeeGwei = toGwei(baseFees.get(baseFees.size() - 1));
        BigDecimal priorityFeeGwei = medianReward(history.reward())
                .map(EvmFeeEstimator::toGwei)
                .orElse(DEFAULT_PRIORITY_FEE_GWEI);

        return Optional.of(baseFeeGwei.add(priorityFeeGwei.multiply(priority.multiplier())));
    }

    private BigDecimal legacyGasPrice(BigInteger gasPriceWei, FeePriority priority) {
        return toGwei(gasPriceWei).multiply(priority.multiplier());
    }

    // EIP-1559 networks add a priority component on top of the static base; legacy ones scale it.
    private BigDecimal staticGasPrice(BlockchainNetworkProfile profile, FeePriority priority) {
        BigDecimal staticGwei = profile.staticGasPriceGwei() != null
                ? profile.staticGasPriceGwei()
                : DEFAULT_STATIC_GAS_PRICE_GWEI;
        BigDecimal scaled = staticGwei.multiply(priority.multiplier());
        BigDecimal gasPrice = profile.eip1559() ? staticGwei.add(scaled) : scaled;
        log.info(
                "event=fee_oracle.evm.static_fallback blockchainKey={} priority={} gasPriceGwei={}",
                profile.blockchainKey(),
                priority,
                gasPrice
        );
        return gasPrice;
    }

    private static Optional<BigInteger> medianReward(List<List<BigInteger>> rewards) {
        if (rewards == null || rewards.isEmpty()) {
            return Optional.empty();
        }
        List<BigInteger> newest = rewards.get(rewards.size() - 1);
        if (newest == null || newest.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(newest.get(newest.size() > 1 ? 1 : 0));
    }

    private static BigDecimal toGwei(BigInteger wei) {
        return Convert.fromWei(new BigDecimal(wei), Convert.Unit.GWEI);
    }
}
