package lending.settlement.adapter;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "settlement.chain", name = "mode", havingValue = "rpc")
public class RpcModeStartupGuard {

    @Value("${settlement.evm.private-key:}")
    private String privateKey;

    @Value("${settlement.rpc.ethereum.url:}")
    private String ethereumRpcUrl;

    @Value("${settlement.rpc.bsc.url:}")
    private String bscRpcUrl;

    @Value("${settlement.rpc.ethereum.chain-id:1}")
    private long ethereumChainId;

    @Value("${settlement.rpc.bsc.chain-id:56}")
    private long bscChainId;

    @PostConstruct
    void validate() {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("SETTLEMENT_EVM_PRIVATE_KEY must be configured in rpc mode");
        }
        if (ethereumRpcUrl == null || ethereumRpcUrl.isBlank()) {
            throw new IllegalStateException("SETTLEMENT_RPC_ETHEREUM_URL must be configured in rpc mode");
        }
        if (bscRpcUrl == null || bscRpcUrl.isBlank()) {
            throw new IllegalStateException("SETTLEMENT_RPC_BSC_URL must be configured in rpc mode");
        }
        if (ethereumChainId == bscChainId) {
            throw new IllegalStateException("Ethereum and BSC chain ids must differ, both are " + ethereumChainId);
        }
        log.info("event=rpc_mode.startup_guard.ok ethereumChainId={} bscChainId={}", ethereumChainId, bscChainId);
    }
}
