package lending.settlement.sim.fakechain;

import lending.settlement.network.BlockchainKeys;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.NetworkProfileRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

// Mock mode: every network is served by the in-memory FakeChain. Default when settlement.chain.mode is unset.
@Configuration
@ConditionalOnProperty(prefix = "settlement.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class SimChainConfig {

    static final List<String> SIMULATED_NETWORKS = List.of(
            BlockchainKeys.ETHEREUM_MAINNET,
            BlockchainKeys.BSC_MAINNET,
            BlockchainKeys.BITCOIN_MAINNET,
            BlockchainKeys.SOLANA_MAINNET
    );

    @Bean
    public FakeChain fakeChain(NetworkProfileRegistry profiles) {
        FakeChain fakeChain = new FakeChain();
        for (String key : SIMULATED_NETWORKS) {
            fakeChain.register(key);
            profiles.find(key)
                    .filter(BlockchainNetworkProfile::hasHotWalletAddress)
                    .ifPresent(profile -> fakeChain.setHotWalletAddress(key, profile.hotWalletAddress()));
        }
        log.info("event=sim_chain.started networks={}", SIMULATED_NETWORKS);
        return fakeChain;
    }

    @Bean
    public FakeChainClient ethereumFakeClient(FakeChain fakeChain) {
        return new FakeChainClient(BlockchainKeys.ETHEREUM_MAINNET, fakeChain);
    }

    @Bean
    public FakeChainClient bscFakeClient(FakeChain fakeChain) {
        return new FakeChainClient(BlockchainKeys.BSC_MAINNET, fakeChain);
    }

    @Bean
    public FakeChainClient bitcoinFakeClient(FakeChain fakeChain) {
        return new FakeChainClient(BlockchainKeys.BITCOIN_MAINNET, fakeChain);
    }

    @Bean
    public FakeChainClient solanaFakeClient(FakeChain fakeChain) {
        return new FakeChainClient(BlockchainKeys.SOLANA_MAINNET, fakeChain);
    }

    @Bean
    public SimulatedHotWalletGateway simulatedHotWallet(FakeChain fakeChain) {
        return new SimulatedHotWalletGateway(fakeChain);
    }

    @Bean
    public SimulatedIdentityChecks simulatedIdentityChecks(
            @Value("${settlement.sim.unverified-users:}") List<String> unverifiedUsers,
            @Value("${settlement.sim.two-factor-code:000000}") String twoFactorCode) {
        Set<String> users = new HashSet<>(unverifiedUsers);
        users.removeIf(String::isBlank);
        return new SimulatedIdentityChecks(users, twoFactorCode);
    }

    @Bean
    @ConditionalOnProperty(prefix = "settlement.sim", name = "auto-mine", havingValue = "true", matchIfMissing = true)
    public FakeBlockProducer fakeBlockProducer(FakeChain fakeChain) {
        return new FakeBlockProducer(fakeChain);
    }
}
