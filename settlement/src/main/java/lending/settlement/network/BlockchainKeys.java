package lending.settlement.network;

public final class BlockchainKeys {

    public static final String ETHEREUM_MAINNET = "eip155:1";
    public static final String BSC_MAINNET = "eip155:56";
    public static final String BITCOIN_MAINNET = "bip122:000000000019d6689c085ae165831e93";
    public static final String SOLANA_MAINNET = "solana:5eykt4UsFv8P8NJdTREpY1vzqKqZKvdp";

    private BlockchainKeys() {
    }
}
