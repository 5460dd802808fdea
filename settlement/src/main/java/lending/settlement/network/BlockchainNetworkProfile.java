package lending.settlement.network;

import lending.settlement.fee.FeePriority;

import java.math.BigDecimal;
import java.time.Duration;

public record BlockchainNetworkProfile(
        String blockchainKey,
        ChainFamily family,
        String name,
        String nativeUnit,
        int requiredConfirmations,
        Duration initialMonitoringDelay,
        boolean eip1559,
        BigDecimal staticGasPriceGwei,
        String hotWalletAddress,
        String slowConfirmationTime,
        String standardConfirmationTime,
        String fastConfirmationTime
) {

    public static final int DEFAULT_REQUIRED_CONFIRMATIONS = 12;
    public static final Duration DEFAULT_INITIAL_MONITORING_DELAY = Duration.ofMinutes(2);

    public static BlockchainNetworkProfile defaultFor(String blockchainKey) {
        return new BlockchainNetworkProfile(
                blockchainKey,
                ChainFamily.fromBlockchainKey(blockchainKey),
                blockchainKey,
                "UNKNOWN",
                DEFAULT_REQUIRED_CONFIRMATIONS,
                DEFAULT_INITIAL_MONITORING_DELAY,
                false,
                null,
                null,
                "10-30 minutes",
                "10-30 minutes",
                "10-30 minutes"
        );
    }

    public String confirmationTime(FeePriority priority) {
        return switch (priority) {
            case SLOW -> slowConfirmationTime;
            case STANDARD -> standardConfirmationTime;
            case FAST -> fastConfirmationTime;
        };
    }

    public boolean hasHotWalletAddress() {
        return hotWalletAddress != null && !hotWalletAddress.isBlank();
    }
}
