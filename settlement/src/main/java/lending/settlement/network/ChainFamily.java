package lending.settlement.network;

public enum ChainFamily {
    EVM("eip155:"),
    BITCOIN("bip122:"),
    SOLANA("solana:"),
    UNKNOWN("");

    private final String keyPrefix;

    ChainFamily(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    // CAIP-2 namespace decides the family; anything unrecognised is UNKNOWN.
    public static ChainFamily fromBlockchainKey(String blockchainKey) {
        if (blockchainKey == null || blockchainKey.isBlank()) {
            return UNKNOWN;
        }
        for (ChainFamily family : values()) {
            if (family != UNKNOWN && blockchainKey.startsWith(family.keyPrefix)) {
                return family;
            }
        }
        return UNKNOWN;
    }
}
