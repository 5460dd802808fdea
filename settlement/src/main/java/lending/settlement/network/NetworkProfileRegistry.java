package lending.settlement.network;

import lending.settlement.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@Slf4j
public class NetworkProfileRegistry {

    private final Map<String, BlockchainNetworkProfile> profilesByKey;

    @Autowired
    public NetworkProfileRegistry(SettlementProperties properties) {
        this(properties.getNetworks().stream()
                .map(NetworkProfileRegistry::toProfile)
                .toList());
    }

    // Built once at startup; two profiles for the same key is a configuration error.
    public NetworkProfileRegistry(List<BlockchainNetworkProfile> profiles) {
        this.profilesByKey = profiles.stream()
                .collect(Collectors.toUnmodifiableMap(
                        BlockchainNetworkProfile::blockchainKey,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Duplicate network profile for key: " + left.blockchainKey());
                        }
                ));
        log.info("event=network_profiles.loaded keys={}", profilesByKey.keySet());
    }

    public Optional<BlockchainNetworkProfile> find(String blockchainKey) {
        return Optional.ofNullable(profilesByKey.get(blockchainKey));
    }

    public BlockchainNetworkProfile profileOrDefault(String blockchainKey) {
        return find(blockchainKey).orElseGet(() -> {
            log.warn("event=network_profiles.unknown_key blockchainKey={} fallback=default", blockchainKey);
            return BlockchainNetworkProfile.defaultFor(blockchainKey);
        });
    }

    private static BlockchainNetworkProfile toProfile(SettlementProperties.Network network) {
        if (network.getKey() == null || network.getKey().isBlank()) {
            throw new IllegalStateException("settlement.networks[].key must be configured");
        }
        ChainFamily family = network.getFamily() != null
                ? network.getFamily()
                : ChainFamily.fromBlockchainKey(network.getKey());
        SettlementProperties.ConfirmationTimes times = network.getConfirmationTimes();
        return new BlockchainNetworkProfile(
                network.getKey(),
                family,
                network.getName() == null ? network.getKey() : network.getName(),
                network.getNativeUnit() == null ? "UNKNOWN" : network.getNativeUnit(),
                network.getRequiredConfirmations(),
                network.getInitialMonitoringDelay(),
                network.isEip1559(),
                network.getStaticGasPriceGwei(),
                network.getHotWalletAddress(),
                times.getSlow(),
                times.getStandard(),
                times.getFast()
        );
    }
}
