package lending.settlement.sim.fakechain;

import lending.settlement.adapter.BitcoinChainClient.BitcoinFeeTiers;
import lending.settlement.adapter.ChainRpcClient.TransactionStatus;
import lending.settlement.adapter.EvmChainClient.FeeHistory;
import lending.settlement.network.ChainFamily;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory stand-in for every configured network. Heights, fees and transfer results can be
 * scripted so local runs and tests reproduce settlement scenarios deterministically.
 */
@Slf4j
public class FakeChain {

    public enum NextOutcome {
        SUCCESS,
        REJECTED,
        INSUFFICIENT_FUNDS
    }

    static final long GENESIS_HEIGHT = 1_000L;
    static final BigInteger DEFAULT_GAS_PRICE_WEI = BigInteger.valueOf(20_000_000_000L);
    static final BigInteger DEFAULT_BASE_FEE_WEI = BigInteger.valueOf(18_000_000_000L);
    static final BigInteger DEFAULT_PRIORITY_FEE_WEI = BigInteger.valueOf(2_000_000_000L);
    static final BitcoinFeeTiers DEFAULT_BITCOIN_TIERS = new BitcoinFeeTiers(
            BigDecimal.valueOf(50), BigDecimal.valueOf(20), BigDecimal.valueOf(10), BigDecimal.valueOf(5));
    static final List<Long> DEFAULT_PRIORITIZATION_FEES = List.of(1_000L, 2_000L, 3_000L);

    private record SentTransaction(String blockchainKey, long includedAt, String failureReason) {}

    private final Map<String, AtomicLong> heights = new ConcurrentHashMap<>();
    private final Set<String> downNetworks = ConcurrentHashMap.newKeySet();
    private final Map<String, BigInteger> gasPrices = new ConcurrentHashMap<>();
    private final Map<String, BitcoinFeeTiers> bitcoinTiers = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> prioritizationFees = new ConcurrentHashMap<>();
    private final Map<String, String> hotWalletAddresses = new ConcurrentHashMap<>();
    // withdrawalId -> result of its next transfer
    private final Map<UUID, NextOutcome> nextOutcomeByWithdrawal = new ConcurrentHashMap<>();
    private final Map<String, SentTransaction> transactions = new ConcurrentHashMap<>();

    public void register(String blockchainKey) {
        heights.putIfAbsent(blockchainKey, new AtomicLong(GENESIS_HEIGHT));
    }

    public Set<String> networks() {
        return Set.copyOf(heights.keySet());
    }

    public long height(String blockchainKey) {
        ensureUp(blockchainKey);
        return counter(blockchainKey).get();
    }

    public long mine(String blockchainKey, int blocks) {
        return counter(blockchainKey).addAndGet(blocks);
    }

    public void setNetworkDown(String blockchainKey, boolean down) {
        if (down) {
            downNetworks.add(blockchainKey);
        } else {
            downNetworks.remove(blockchainKey);
        }
        log.info("event=fake_chain.network_toggled blockchainKey={} down={}", blockchainKey, down);
    }

    public boolean isDown(String blockchainKey) {
        return downNetworks.contains(blockchainKey);
    }

    public void setNextOutcome(UUID withdrawalId, NextOutcome outcome) {
        nextOutcomeByWithdrawal.put(withdrawalId, outcome);
    }

    public NextOutcome consumeOutcome(UUID withdrawalId) {
        NextOutcome outcome = nextOutcomeByWithdrawal.remove(withdrawalId);
        return outcome == null ? NextOutcome.SUCCESS : outcome;
    }

    // Records a transaction included in the next block.
    public String submit(String blockchainKey, UUID withdrawalId) {
        ensureUp(blockchainKey);
        String txHash = newTxHash(blockchainKey, withdrawalId);
        transactions.put(txHash, new SentTransaction(blockchainKey, counter(blockchainKey).get() + 1, null));
        return txHash;
    }

    // Marks an already submitted transaction as reverted or dropped.
    public void failTransaction(String txHash, String reason) {
        SentTransaction tx = transactions.get(txHash);
        if (tx == null) {
            throw new IllegalArgumentException("Unknown transaction: " + txHash);
        }
        transactions.put(txHash, new SentTransaction(tx.blockchainKey(), tx.includedAt(), reason));
    }

    public TransactionStatus status(String blockchainKey, String txHash) {
        ensureUp(blockchainKey);
        SentTransaction tx = transactions.get(txHash);
        if (tx == null || !tx.blockchainKey().equals(blockchainKey)) {
            return TransactionStatus.pending(0);
        }
        if (tx.failureReason() != null) {
            return TransactionStatus.failed(tx.failureReason());
        }
        long confirmations = counter(blockchainKey).get() - tx.includedAt() + 1;
        if (confirmations <= 0) {
            return TransactionStatus.pending(0);
        }
        return TransactionStatus.confirmed((int) confirmations);
    }

    public BigInteger gasPrice(String blockchainKey) {
        ensureUp(blockchainKey);
        return gasPrices.getOrDefault(blockchainKey, DEFAULT_GAS_PRICE_WEI);
    }

    public void setGasPrice(String blockchainKey, BigInteger wei) {
        gasPrices.put(blockchainKey, wei);
    }

    public FeeHistory feeHistory(String blockchainKey, int blockCount, int percentiles) {
        ensureUp(blockchainKey);
        BigInteger baseFee = gasPrices.containsKey(blockchainKey)
                ? gasPrices.get(blockchainKey).subtract(DEFAULT_PRIORITY_FEE_WEI).max(BigInteger.ZERO)
                : DEFAULT_BASE_FEE_WEI;
        List<BigInteger> rewards = Collections.nCopies(percentiles, DEFAULT_PRIORITY_FEE_WEI);
        return new FeeHistory(
                Collections.nCopies(blockCount + 1, baseFee),
                Collections.nCopies(blockCount, rewards)
        );
    }

    public BitcoinFeeTiers bitcoinFeeTiers(String blockchainKey) {
        ensureUp(blockchainKey);
        return bitcoinTiers.getOrDefault(blockchainKey, DEFAULT_BITCOIN_TIERS);
    }

    public void setBitcoinFeeTiers(String blockchainKey, BitcoinFeeTiers tiers) {
        bitcoinTiers.put(blockchainKey, tiers);
    }

    public List<Long> prioritizationFees(String blockchainKey) {
        ensureUp(blockchainKey);
        return prioritizationFees.getOrDefault(blockchainKey, DEFAULT_PRIORITIZATION_FEES);
    }

    public void setPrioritizationFees(String blockchainKey, List<Long> fees) {
        prioritizationFees.put(blockchainKey, List.copyOf(fees));
    }

    public String hotWalletAddress(String blockchainKey) {
        return hotWalletAddresses.computeIfAbsent(blockchainKey, FakeChain::defaultHotWalletAddress);
    }

    public void setHotWalletAddress(String blockchainKey, String address) {
        hotWalletAddresses.put(blockchainKey, address);
    }

    // fake hash in the family's format
    public String newTxHash(String blockchainKey, UUID withdrawalId) {
        String hex = (withdrawalId.toString() + UUID.randomUUID()).replace("-", "");
        return ChainFamily.fromBlockchainKey(blockchainKey) == ChainFamily.EVM ? "0x" + hex : hex;
    }

    private AtomicLong counter(String blockchainKey) {
        AtomicLong height = heights.get(blockchainKey);
        if (height == null) {
            throw new IllegalArgumentException("Unknown fake network: " + blockchainKey);
        }
        return height;
    }

    private void ensureUp(String blockchainKey) {
        if (downNetworks.contains(blockchainKey)) {
            throw new IllegalStateException("Fake network " + blockchainKey + " is down");
        }
    }

    private static String defaultHotWalletAddress(String blockchainKey) {
        return switch (ChainFamily.fromBlockchainKey(blockchainKey)) {
            case EVM -> "0x0000000000000000000000000000000000000001";
            case BITCOIN -> "bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq";
            case SOLANA -> "11111111111111111111111111111111";
            case UNKNOWN -> "fake-hot-wallet";
        };
    }
}
