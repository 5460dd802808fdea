package lending.settlement.adapter;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ChainClientRouter {

    private final Map<String, ChainRpcClient> clientsByKey;

    // Build an immutable routing table once at startup and fail fast if two clients claim the same network.
    public ChainClientRouter(List<ChainRpcClient> clients) {
        this.clientsByKey = clients.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ChainRpcClient::blockchainKey,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple chain clients found for network: " + left.blockchainKey());
                        }
                ));
    }

    public ChainRpcClient resolve(String blockchainKey) {
        return Optional.ofNullable(clientsByKey.get(blockchainKey))
                .orElseThrow(() -> new IllegalArgumentException("No chain client for network: " + blockchainKey));
    }

    public <T extends ChainRpcClient> T resolve(String blockchainKey, Class<T> type) {
        ChainRpcClient client = resolve(blockchainKey);
        if (!type.isInstance(client)) {
            throw new IllegalArgumentException("Chain client for " + blockchainKey + " is not a " + type.getSimpleName());
        }
        return type.cast(client);
    }
}
