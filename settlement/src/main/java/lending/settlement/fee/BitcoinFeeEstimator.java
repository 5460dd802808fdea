package lending.settlement.fee;

import lending.settlement.adapter.BitcoinChainClient;
import lending.settlement.adapter.BitcoinChainClient.BitcoinFeeTiers;
import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class BitcoinFeeEstimator implements FeeEstimator {

    static final BigDecimal STATIC_FEE_RATE_SAT_PER_VBYTE = BigDecimal.valueOf(25);
    static final BigDecimal AMOUNT_PER_INPUT = new BigDecimal("0.01");
    static final int OUTPUTS = 2;

    // P2WPKH sizes in vbytes
    private static final BigDecimal TX_OVERHEAD_VBYTES = new BigDecimal("10.5");
    private static final BigDecimal INPUT_VBYTES = BigDecimal.valueOf(68);
    private static final BigDecimal OUTPUT_VBYTES = BigDecimal.valueOf(31);
    private static final int SATOSHI_DECIMALS = 8;

    private final ChainClientRouter chainClients;

    @Override
    public ChainFamily family() {
        return ChainFamily.BITCOIN;
    }

    @Override
    public NetworkFeeEstimate estimate(BlockchainNetworkProfile profile, String tokenId, FeePriority priority, BigDecimal amount) {
        Optional<BitcoinChainClient> client = client(profile);

        BigDecimal feeRate = client.flatMap(c -> tiers(profile, "mempool", c::getRecommendedFeeRates))
                .or(() -> client.flatMap(c -> tiers(profile, "blockstream", c::getBlockTargetFeeRates)))
                .map(tiers -> select(tiers, priority))
                .orElseGet(() -> {
                    BigDecimal rate = STATIC_FEE_RATE_SAT_PER_VBYTE.multiply(priority.multiplier());
                    log.info("event=fee_oracle.bitcoin.static_fallback priority={} satPerVbyte={}", priority, rate);
                    return rate;
                });

        long vsize = estimateVirtualSize(amount);
        BigDecimal feeBtc = feeRate.multiply(BigDecimal.valueOf(vsize))
                .setScale(0, RoundingMode.CEILING)
                .movePointLeft(SATOSHI_DECIMALS)
                .stripTrailingZeros();

        return NetworkFeeEstimate.of(feeBtc, profile.nativeUnit(), profile.confirmationTime(priority));
    }

    static long estimateVirtualSize(BigDecimal amount) {
        return TX_OVERHEAD_VBYTES
                .add(INPUT_VBYTES.multiply(BigDecimal.valueOf(estimateInputs(amount))))
                .add(OUTPUT_VBYTES.multiply(BigDecimal.valueOf(OUTPUTS)))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    // assume one UTXO per ~0.01 BTC being moved
    static long estimateInputs(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return 1;
        }
        long inputs = amount.divide(AMOUNT_PER_INPUT, 0, RoundingMode.CEILING).longValue();
        return Math.max(1, inputs);
    }

    private static BigDecimal select(BitcoinFeeTiers tiers, FeePriority priority) {
        return switch (priority) {
            case FAST -> tiers.fastest();
            case STANDARD -> tiers.halfHour();
            case SLOW -> tiers.hour();
        };
    }

    private Optional<BitcoinChainClient> client(BlockchainNetworkProfile profile) {
        try {
            return Optional.of(chainClients.resolve(profile.blockchainKey(), BitcoinChainClient.class));
        } catch (IllegalArgumentException e) {
            log.warn("event=fee_oracle.bitcoin.client_unavailable blockchainKey={} reason={}", profile.blockchainKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<BitcoinFeeTiers> tiers(BlockchainNetworkProfile profile, String source, Supplier<BitcoinFeeTiers> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (RuntimeException e) {
            log.warn(
                    "event=fee_oracle.bitcoin.source_failed blockchainKey={} source={} reason={}",
                    profile.blockchainKey(),
                    source,
                    e.getMessage()
            );
            return Optional.empty();
        }
    }
}
