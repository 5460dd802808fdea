package lending.settlement.adapter;

/**
 * Read-only view of one blockchain network. One instance per blockchain key.
 * Family-specific fee queries live on the sub-interfaces.
 */
public interface ChainRpcClient {

    String blockchainKey();

    long getLatestHeight();

    TransactionStatus getTransactionStatus(String txHash);

    record TransactionStatus(
            boolean confirmed,
            int confirmations,
            boolean failed,
            String failureReason
    ) {
        public static TransactionStatus pending(int confirmations) {
            return new TransactionStatus(false, confirmations, false, null);
        }

        public static TransactionStatus confirmed(int confirmations) {
            return new TransactionStatus(true, confirmations, false, null);
        }

        public static TransactionStatus failed(String reason) {
            return new TransactionStatus(false, 0, true, reason);
        }
    }
}
