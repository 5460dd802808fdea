package lending.settlement.fee;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.adapter.SolanaChainClient;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class SolanaFeeEstimator implements FeeEstimator {

    static final BigDecimal BASE_FEE_LAMPORTS = BigDecimal.valueOf(5_000);
    private static final int LAMPORT_DECIMALS = 9;

    private final ChainClientRouter chainClients;

    @Override
    public ChainFamily family() {
        return ChainFamily.SOLANA;
    }

    @Override
    public NetworkFeeEstimate estimate(BlockchainNetworkProfile profile, String tokenId, FeePriority priority, BigDecimal amount) {
        BigDecimal lamports;
        try {
            List<Long> fees = chainClients.resolve(profile.blockchainKey(), SolanaChainClient.class)
                    .getRecentPrioritizationFees();
            lamports = BASE_FEE_LAMPORTS.add(priorityFee(average(fees), priority));
        } catch (RuntimeException e) {
            lamports = priority == FeePriority.FAST
                    ? BASE_FEE_LAMPORTS.add(BASE_FEE_LAMPORTS.multiply(BigDecimal.valueOf(2)))
                    : BASE_FEE_LAMPORTS;
            log.warn(
                    "event=fee_oracle.solana.rpc_failed blockchainKey={} fallback=base_fee lamports={} reason={}",
                    profile.blockchainKey(),
                    lamports,
                    e.getMessage()
            );
        }

        BigDecimal fee = lamports.movePointLeft(LAMPORT_DECIMALS).stripTrailingZeros();
        return NetworkFeeEstimate.of(fee, profile.nativeUnit(), profile.confirmationTime(priority));
    }

    private static BigDecimal priorityFee(BigDecimal averageFee, FeePriority priority) {
        if (averageFee.signum() == 0) {
            return priority == FeePriority.FAST ? BASE_FEE_LAMPORTS : BigDecimal.ZERO;
        }
        return averageFee.multiply(factor(priority));
    }

    private static BigDecimal factor(FeePriority priority) {
        return switch (priority) {
            case SLOW -> new BigDecimal("0.5");
            case STANDARD -> BigDecimal.ONE;
            case FAST -> BigDecimal.valueOf(2);
        };
    }

    private static BigDecimal average(List<Long> fees) {
        if (fees == null || fees.isEmpty()) {
            return BigDecimal.ZERO;
        }
        long sum = fees.stream().mapToLong(Long::longValue).sum();
        return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(fees.size()), MathContext.DECIMAL64);
    }
}
