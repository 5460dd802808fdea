package lending.settlement.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.RoundingMode;

// Bitcoin via public REST indexers: Blockstream for chain state, mempool.space for fee tiers.
@Slf4j
public class BitcoinRestClient implements BitcoinChainClient {

    private static final BigDecimal DEFAULT_FASTEST = BigDecimal.valueOf(50);
    private static final BigDecimal DEFAULT_HALF_HOUR = BigDecimal.valueOf(20);
    private static final BigDecimal DEFAULT_HOUR = BigDecimal.valueOf(10);
    private static final BigDecimal DEFAULT_ECONOMY = BigDecimal.valueOf(5);

    private final String blockchainKey;
    private final RestClient blockstream;
    private final RestClient mempool;

    public BitcoinRestClient(String blockchainKey, RestClient blockstream, RestClient mempool) {
        this.blockchainKey = blockchainKey;
        this.blockstream = blockstream;
        this.mempool = mempool;
    }

    @Override
    public String blockchainKey() {
        return blockchainKey;
    }

    @Override
    public long getLatestHeight() {
        String body = blockstream.get().uri("/blocks/tip/height").retrieve().body(String.class);
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Empty tip height response from Blockstream");
        }
        return Long.parseLong(body.trim());
    }

    @Override
    public TransactionStatus getTransactionStatus(String txHash) {
        JsonNode status;
        try {
            status = blockstream.get().uri("/tx/{hash}/status", txHash).retrieve().body(JsonNode.class);
        } catch (HttpClientErrorException.NotFound e) {
            // not yet seen by the indexer
            return TransactionStatus.pending(0);
        }
        if (status == null || !status.path("confirmed").asBoolean(false)) {
            return TransactionStatus.pending(0);
        }
        long blockHeight = status.path("block_height").asLong();
        long confirmations = Math.max(0, getLatestHeight() - blockHeight + 1);
        return TransactionStatus.confirmed((int) Math.min(confirmations, Integer.MAX_VALUE));
    }

    @Override
    public BitcoinFeeTiers getRecommendedFeeRates() {
        JsonNode fees = mempool.get().uri("/api/v1/fees/recommended").retrieve().body(JsonNode.class);
        if (fees == null) {
            throw new IllegalStateException("Empty response from mempool.space fee API");
        }
        return new BitcoinFeeTiers(
                rate(fees, "fastestFee", DEFAULT_FASTEST),
                rate(fees, "halfHourFee", DEFAULT_HALF_HOUR),
                rate(fees, "hourFee", DEFAULT_HOUR),
                rate(fees, "economyFee", DEFAULT_ECONOMY)
        );
    }

    // Block targets 1/3/6/144 rounded up to whole sat/vB.
    @Override
    public BitcoinFeeTiers getBlockTargetFeeRates() {
        JsonNode estimates = blockstream.get().uri("/fee-estimates").retrieve().body(JsonNode.class);
        if (estimates == null) {
            throw new IllegalStateException("Empty response from Blockstream fee-estimates");
        }
        return new BitcoinFeeTiers(
                ceil(rate(estimates, "1", DEFAULT_FASTEST)),
                ceil(rate(estimates, "3", DEFAULT_HALF_HOUR)),
                ceil(rate(estimates, "6", DEFAULT_HOUR)),
                ceil(rate(estimates, "144", DEFAULT_ECONOMY))
        );
    }

    private BigDecimal rate(JsonNode node, String field, BigDecimal fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            log.debug("event=bitcoin_rest.fee_field_missing field={} fallback={}", field, fallback);
            return fallback;
        }
        return value.decimalValue();
    }

    private static BigDecimal ceil(BigDecimal value) {
        return value.setScale(0, RoundingMode.CEILING);
    }
}
