package lending.settlement.adapter;

import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.WalletUtils;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;

@Slf4j
public class EvmHotWalletGateway implements HotWalletGateway {

    public static final String ERC20_TOKEN_PREFIX = "erc20:";

    private static final BigInteger NATIVE_GAS_LIMIT = BigInteger.valueOf(21_000);
    private static final BigInteger TOKEN_GAS_LIMIT = BigInteger.valueOf(65_000);
    private static final BigInteger DEFAULT_MAX_PRIORITY_FEE_PER_GAS = BigInteger.valueOf(2_000_000_000L);

    private final String blockchainKey;
    private final Web3j web3j;
    private final long chainId;
    private final boolean eip1559;
    private final Signer signer;

    public EvmHotWalletGateway(String blockchainKey, Web3j web3j, long chainId, boolean eip1559, Signer signer) {
        this.blockchainKey = blockchainKey;
        this.web3j = web3j;
        this.chainId = chainId;
        this.eip1559 = eip1559;
        this.signer = signer;
    }

    @Override
    public boolean supports(String key) {
        return blockchainKey.equals(key);
    }

    @Override
    public String getAddress(String key) {
        return signer.getAddress();
    }

    @Override
    public TransferResult transfer(TransferCommand command) {
        if (!WalletUtils.isValidAddress(command.to())) {
            throw new IllegalArgumentException("Invalid EVM to-address: " + command.to());
        }
        ensureConnectedChainIdMatchesConfigured();

        try {
            BigInteger nonce = getPendingNonce(signer.getAddress());
            BigInteger gasPrice = getGasPrice();
            BigInteger units = toBaseUnits(command.amount(), command.decimals());

            RawTransaction rawTransaction = isTokenTransfer(command.tokenId())
                    ? tokenTransfer(nonce, gasPrice, tokenContract(command.tokenId()), command.to(), units)
                    : nativeTransfer(nonce, gasPrice, command.to(), units);

            String signedTxHex = signer.sign(rawTransaction, chainId);
            EthSendTransaction sent = web3j.ethSendRawTransaction(signedTxHex).send();
            if (sent.hasError()) {
                throw new TransferRejectedException("EVM RPC rejected transaction: " + sent.getError().getMessage());
            }

            String txHash = sent.getTransactionHash();
            if (txHash == null || txHash.isBlank()) {
                throw new IllegalStateException("RPC returned an empty tx hash");
            }
            log.info(
                    "event=evm_hot_wallet.transfer.sent blockchainKey={} withdrawalId={} nonce={} txHash={}",
                    blockchainKey,
                    command.withdrawalId(),
                    nonce,
                    txHash
            );
            return new TransferResult(txHash);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to execute EVM RPC request", e);
        }
    }

    public static boolean isTokenTransfer(String tokenId) {
        return tokenId != null && tokenId.startsWith(ERC20_TOKEN_PREFIX);
    }

    private RawTransaction nativeTransfer(BigInteger nonce, BigInteger gasPrice, String to, BigInteger valueWei) {
        if (eip1559) {
            return RawTransaction.createEtherTransaction(
                    chainId, nonce, NATIVE_GAS_LIMIT, to, valueWei,
                    DEFAULT_MAX_PRIORITY_FEE_PER_GAS, maxFeePerGas(gasPrice));
        }
        return RawTransaction.createEtherTransaction(nonce, gasPrice, NATIVE_GAS_LIMIT, to, valueWei);
    }

    private RawTransaction tokenTransfer(BigInteger nonce, BigInteger gasPrice, String contract, String to, BigInteger units) {
        String data = FunctionEncoder.encode(new Function(
                "transfer",
                List.of(new Address(to), new Uint256(units)),
                List.of()
        ));
        if (eip1559) {
            return RawTransaction.createTransaction(
                    chainId, nonce, TOKEN_GAS_LIMIT, contract, BigInteger.ZERO, data,
                    DEFAULT_MAX_PRIORITY_FEE_PER_GAS, maxFeePerGas(gasPrice));
        }
        return RawTransaction.createTransaction(nonce, gasPrice, TOKEN_GAS_LIMIT, contract, data);
    }

    // Leaves headroom for one base-fee doubling between signing and inclusion.
    private static BigInteger maxFeePerGas(BigInteger gasPrice) {
        return gasPrice.multiply(BigInteger.TWO).add(DEFAULT_MAX_PRIORITY_FEE_PER_GAS);
    }

    private static String tokenContract(String tokenId) {
        String contract = tokenId.substring(ERC20_TOKEN_PREFIX.length());
        if (!WalletUtils.isValidAddress(contract)) {
            throw new IllegalArgumentException("Invalid ERC-20 contract in token id: " + tokenId);
        }
        return contract;
    }

    private static BigInteger toBaseUnits(BigDecimal amount, int decimals) {
        return amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    // Avoid sending to the wrong chain when the configured endpoint and chain id disagree.
    private void ensureConnectedChainIdMatchesConfigured() {
        try {
            EthChainId chainIdResponse = web3j.ethChainId().send();
            if (chainIdResponse.hasError()) {
                throw new IllegalStateException("Failed to verify chain id from RPC: " + chainIdResponse.getError().getMessage());
            }
            long remoteChainId = chainIdResponse.getChainId().longValue();
            if (remoteChainId != chainId) {
                throw new IllegalStateException("Connected RPC chain id mismatch. expected=" + chainId + ", actual=" + remoteChainId);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to verify chain id from RPC", e);
        }
    }

    // pending (not latest) so back-to-back transfers account for in-flight transactions
    private BigInteger getPendingNonce(String address) throws IOException {
        EthGetTransactionCount txCountResponse = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
        if (txCountResponse.hasError()) {
            throw new IllegalStateException("Failed to fetch nonce from RPC: " + txCountResponse.getError().getMessage());
        }
        return txCountResponse.getTransactionCount();
    }

    private BigInteger getGasPrice() throws IOException {
        EthGasPrice response = web3j.ethGasPrice().send();
        if (response.hasError()) {
            throw new IllegalStateException("Failed to fetch gas price from RPC: " + response.getError().getMessage());
        }
        return response.getGasPrice();
    }
}
