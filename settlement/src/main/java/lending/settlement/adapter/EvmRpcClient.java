package lending.settlement.adapter;

import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthFeeHistory;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

// web3j-backed client for one EVM network (Ethereum, BSC, ...).
@Slf4j
public class EvmRpcClient implements EvmChainClient {

    private final String blockchainKey;
    private final Web3j web3j;

    public EvmRpcClient(String blockchainKey, Web3j web3j) {
        this.blockchainKey = blockchainKey;
        this.web3j = web3j;
    }

    @Override
    public String blockchainKey() {
        return blockchainKey;
    }

    @Override
    public long getLatestHeight() {
        return latestBlockNumber().longValueExact();
    }

    @Override
    public BigInteger getGasPrice() {
        try {
            return checked(web3j.ethGasPrice().send(), "eth_gasPrice").getGasPrice();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to fetch gas price from " + blockchainKey, e);
        }
    }

    @Override
    public FeeHistory getFeeHistory(int blockCount, List<Double> rewardPercentiles) {
        try {
            EthFeeHistory response = checked(
                    web3j.ethFeeHistory(blockCount, DefaultBlockParameterName.LATEST, rewardPercentiles).send(),
                    "eth_feeHistory");
            EthFeeHistory.FeeHistory history = response.getFeeHistory();
            if (history == null) {
                throw new IllegalStateException("eth_feeHistory returned no result on " + blockchainKey);
            }
            return new FeeHistory(history.getBaseFeePerGas(), history.getReward());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to fetch fee history from " + blockchainKey, e);
        }
    }

    // confirmations = latest - inclusion block + 1; a receipt with status 0x0 is a reverted transaction
    @Override
    public TransactionStatus getTransactionStatus(String txHash) {
        Optional<TransactionReceipt> receipt = getReceipt(txHash);
        if (receipt.isEmpty()) {
            return TransactionStatus.pending(0);
        }
        TransactionReceipt r = receipt.get();
        if (!r.isStatusOK()) {
            return TransactionStatus.failed("Transaction reverted (status=" + r.getStatus() + ")");
        }
        BigInteger latest = latestBlockNumber();
        int confirmations = latest.subtract(r.getBlockNumber()).add(BigInteger.ONE).max(BigInteger.ZERO).intValue();
        log.debug("event=evm_rpc.tx_status blockchainKey={} txHash={} confirmations={}", blockchainKey, txHash, confirmations);
        return TransactionStatus.confirmed(confirmations);
    }

    public Optional<TransactionReceipt> getReceipt(String txHash) {
        try {
            return checked(web3j.ethGetTransactionReceipt(txHash).send(), "eth_getTransactionReceipt")
                    .getTransactionReceipt();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to fetch receipt", e);
        }
    }

    private BigInteger latestBlockNumber() {
        try {
            return checked(web3j.ethBlockNumber().send(), "eth_blockNumber").getBlockNumber();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to fetch latest block from " + blockchainKey, e);
        }
    }

    private <T extends Response<?>> T checked(T response, String method) {
        if (response.hasError()) {
            throw new IllegalStateException(method + " failed on " + blockchainKey + ": " + response.getError().getMessage());
        }
        return response;
    }
}
