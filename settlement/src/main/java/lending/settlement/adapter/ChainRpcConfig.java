package lending.settlement.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import lending.settlement.network.BlockchainKeys;
import lending.settlement.network.NetworkProfileRegistry;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.net.InetSocketAddress;
import java.net.Proxy;

// Real network clients; the mock-mode counterparts live in sim.fakechain.
@Configuration
@ConditionalOnProperty(prefix = "settlement.chain", name = "mode", havingValue = "rpc")
public class ChainRpcConfig {

    @Value("${settlement.rpc.proxy.enabled:false}")
    private boolean proxyEnabled;

    @Value("${settlement.rpc.proxy.host:}")
    private String proxyHost;

    @Value("${settlement.rpc.proxy.port:8080}")
    private int proxyPort;

    @Value("${settlement.rpc.proxy.username:}")
    private String proxyUsername;

    @Value("${settlement.rpc.proxy.password:}")
    private String proxyPassword;

    @Bean(destroyMethod = "shutdown")
    public Web3j ethereumWeb3j(@Value("${settlement.rpc.ethereum.url}") String rpcUrl) {
        return buildWeb3j(rpcUrl);
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j bscWeb3j(@Value("${settlement.rpc.bsc.url}") String rpcUrl) {
        return buildWeb3j(rpcUrl);
    }

    @Bean
    public EvmRpcClient ethereumRpcClient(@Qualifier("ethereumWeb3j") Web3j web3j) {
        return new EvmRpcClient(BlockchainKeys.ETHEREUM_MAINNET, web3j);
    }

    @Bean
    public EvmRpcClient bscRpcClient(@Qualifier("bscWeb3j") Web3j web3j) {
        return new EvmRpcClient(BlockchainKeys.BSC_MAINNET, web3j);
    }

    @Bean
    public BitcoinRestClient bitcoinRestClient(
            @Value("${settlement.rpc.bitcoin.blockstream-url:https://blockstream.info/api}") String blockstreamUrl,
            @Value("${settlement.rpc.bitcoin.mempool-url:https://mempool.space}") String mempoolUrl) {
        return new BitcoinRestClient(
                BlockchainKeys.BITCOIN_MAINNET,
                RestClient.builder().baseUrl(blockstreamUrl).build(),
                RestClient.builder().baseUrl(mempoolUrl).build()
        );
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(
            ObjectMapper objectMapper,
            @Value("${settlement.rpc.solana.url:https://api.mainnet-beta.solana.com}") String rpcUrl) {
        return new SolanaRpcClient(
                BlockchainKeys.SOLANA_MAINNET,
                new JsonRpcClient(RestClient.builder().build(), objectMapper, rpcUrl)
        );
    }

    @Bean
    public EvmHotWalletGateway ethereumHotWallet(
            @Qualifier("ethereumWeb3j") Web3j web3j,
            @Value("${settlement.rpc.ethereum.chain-id:1}") long chainId,
            NetworkProfileRegistry profiles,
            Signer signer) {
        boolean eip1559 = profiles.profileOrDefault(BlockchainKeys.ETHEREUM_MAINNET).eip1559();
        return new EvmHotWalletGateway(BlockchainKeys.ETHEREUM_MAINNET, web3j, chainId, eip1559, signer);
    }

    @Bean
    public EvmHotWalletGateway bscHotWallet(
            @Qualifier("bscWeb3j") Web3j web3j,
            @Value("${settlement.rpc.bsc.chain-id:56}") long chainId,
            NetworkProfileRegistry profiles,
            Signer signer) {
        boolean eip1559 = profiles.profileOrDefault(BlockchainKeys.BSC_MAINNET).eip1559();
        return new EvmHotWalletGateway(BlockchainKeys.BSC_MAINNET, web3j, chainId, eip1559, signer);
    }

    private Web3j buildWeb3j(String rpcUrl) {
        if (!proxyEnabled) {
            return Web3j.build(new HttpService(rpcUrl));
        }

        if (proxyHost == null || proxyHost.isBlank()) {
            throw new IllegalStateException("settlement.rpc.proxy.host must be configured when settlement.rpc.proxy.enabled=true");
        }

        Proxy proxy = new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort));
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder().proxy(proxy);

        if (proxyUsername != null && !proxyUsername.isBlank()) {
            clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
                Request request = response.request();
                return request.newBuilder()
                        .header("Proxy-Authorization", credential)
                        .build();
            });
        }

        return Web3j.build(new HttpService(rpcUrl, clientBuilder.build(), false));
    }
}
