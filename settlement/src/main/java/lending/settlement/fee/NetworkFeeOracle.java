package lending.settlement.fee;

import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lending.settlement.network.NetworkProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-network fee estimation. Never throws: every failure degrades to a cheaper
 * source and ultimately to a static default.
 */
@Service
@Slf4j
public class NetworkFeeOracle {

    static final BigDecimal UNKNOWN_NETWORK_FEE = new BigDecimal("0.001");
    static final String UNKNOWN_FEE_UNIT = "UNKNOWN";
    static final String UNKNOWN_CONFIRMATION_TIME = "10-30 minutes";

    private final NetworkProfileRegistry profiles;
    private final Map<ChainFamily, FeeEstimator> estimatorsByFamily;

    public NetworkFeeOracle(NetworkProfileRegistry profiles, List<FeeEstimator> estimators) {
        this.profiles = profiles;
        this.estimatorsByFamily = estimators.stream()
                .collect(Collectors.toUnmodifiableMap(
                        FeeEstimator::family,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple fee estimators found for family: " + left.family());
                        }
                ));
    }

    public NetworkFeeEstimate estimate(String blockchainKey, String tokenId, FeePriority priority) {
        return estimate(blockchainKey, tokenId, priority, null);
    }

    // amount only matters for UTXO chains, where it drives the input count
    public NetworkFeeEstimate estimate(String blockchainKey, String tokenId, FeePriority priority, BigDecimal amount) {
        FeePriority effectivePriority = priority == null ? FeePriority.STANDARD : priority;
        Optional<BlockchainNetworkProfile> profile = profiles.find(blockchainKey);
        if (profile.isEmpty()) {
            log.warn("event=fee_oracle.unknown_network blockchainKey={} fee={}", blockchainKey, UNKNOWN_NETWORK_FEE);
            return unknownNetworkEstimate();
        }

        FeeEstimator estimator = estimatorsByFamily.get(profile.get().family());
        if (estimator == null) {
            log.warn("event=fee_oracle.no_estimator blockchainKey={} family={}", blockchainKey, profile.get().family());
            return unknownNetworkEstimate();
        }

        try {
            NetworkFeeEstimate estimate = estimator.estimate(profile.get(), tokenId, effectivePriority, amount);
            log.info(
                    "event=fee_oracle.estimate.done blockchainKey={} tokenId={} priority={} fee={} unit={}",
                    blockchainKey,
                    tokenId,
                    effectivePriority,
                    estimate.fee(),
                    estimate.feeUnit()
            );
            return estimate;
        } catch (RuntimeException e) {
            log.error("event=fee_oracle.estimate.failed blockchainKey={} priority={} reason={}", blockchainKey, effectivePriority, e.getMessage(), e);
            return unknownNetworkEstimate();
        }
    }

    private static NetworkFeeEstimate unknownNetworkEstimate() {
        return NetworkFeeEstimate.of(UNKNOWN_NETWORK_FEE, UNKNOWN_FEE_UNIT, UNKNOWN_CONFIRMATION_TIME);
    }
}
