package lending.settlement.adapter;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class HotWalletRouter {

    private final List<HotWalletGateway> gateways;

    public HotWalletRouter(List<HotWalletGateway> gateways) {
        this.gateways = List.copyOf(gateways);
    }

    public Optional<HotWalletGateway> find(String blockchainKey) {
        return gateways.stream()
                .filter(gateway -> gateway.supports(blockchainKey))
                .findFirst();
    }
}
