package lending.settlement.orchestration;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.adapter.HotWalletRouter;
import lending.settlement.address.AddressValidator;
import lending.settlement.domain.currency.CurrencyLimits;
import lending.settlement.domain.currency.CurrencyLimitsRepository;
import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.escalation.FailureEscalator;
import lending.settlement.escalation.FailureTag;
import lending.settlement.fee.FeePriority;
import lending.settlement.fee.NetworkFeeEstimate;
import lending.settlement.fee.NetworkFeeOracle;
import lending.settlement.network.BlockchainKeys;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.ChainFamily;
import lending.settlement.network.NetworkProfileRegistry;
import lending.settlement.notification.Notification;
import lending.settlement.notification.SettlementNotifier;
import lending.settlement.queue.JobContext;
import lending.settlement.queue.JobOptions;
import lending.settlement.queue.JobOutcome;
import lending.settlement.queue.JobResult;
import lending.settlement.queue.SettlementQueue;
import lending.settlement.sim.fakechain.FakeChain;
import lending.settlement.sim.fakechain.FakeChainClient;
import lending.settlement.sim.fakechain.SimulatedHotWalletGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WithdrawalProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String USDC = "erc20:0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String EVM_BENEFICIARY = "0x742d35cc6634c0532925a3b844bc454e4438f44e";
    private static final BlockchainNetworkProfile ETHEREUM = new BlockchainNetworkProfile(
            BlockchainKeys.ETHEREUM_MAINNET, ChainFamily.EVM, "Ethereum Mainnet", "ETH", 12, Duration.ofMinutes(5),
            true, BigDecimal.valueOf(25), null, "5-10 minutes", "2-5 minutes", "1-2 minutes");
    private static final BlockchainNetworkProfile BSC = new BlockchainNetworkProfile(
            BlockchainKeys.BSC_MAINNET, ChainFamily.EVM, "BNB Smart Chain", "BNB", 12, Duration.ofSeconds(30),
            false, BigDecimal.valueOf(5), "0x0000000000000000000000000000000000000002",
            "1-2 minutes", "30-60 seconds", "15-30 seconds");
    private static final BlockchainNetworkProfile BITCOIN = new BlockchainNetworkProfile(
            BlockchainKeys.BITCOIN_MAINNET, ChainFamily.BITCOIN, "Bitcoin Mainnet", "BTC", 3, Duration.ofMinutes(10),
            false, null, null, "60+ minutes", "30-60 minutes", "10-20 minutes");

    @Mock WithdrawalLedger ledger;
    @Mock NetworkFeeOracle feeOracle;
    @Mock CurrencyLimitsRepository currencyLimitsRepository;
    @Mock SettlementQueue queue;
    @Mock FailureEscalator escalator;
    @Mock SettlementNotifier notifier;

    FakeChain fakeChain;
    WithdrawalProcessor processor;

    @BeforeEach
    void setUp() {
        fakeChain = new FakeChain();
        List.of(BlockchainKeys.ETHEREUM_MAINNET, BlockchainKeys.BSC_MAINNET, BlockchainKeys.BITCOIN_MAINNET)
                .forEach(fakeChain::register);
        ChainClientRouter chainClients = new ChainClientRouter(List.of(
                new FakeChainClient(BlockchainKeys.ETHEREUM_MAINNET, fakeChain),
                new FakeChainClient(BlockchainKeys.BSC_MAINNET, fakeChain),
                new FakeChainClient(BlockchainKeys.BITCOIN_MAINNET, fakeChain)
        ));
        processor = new WithdrawalProcessor(
                ledger,
                chainClients,
                feeOracle,
                new AddressValidator(),
                new HotWalletRouter(List.of(new SimulatedHotWalletGateway(fakeChain))),
                new HotWalletTransferLock(),
                new NetworkProfileRegistry(List.of(ETHEREUM, BSC, BITCOIN)),
                currencyLimitsRepository,
                queue,
                escalator,
                notifier,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void ethereumTokenWithdrawal_isSentAndHandedToMonitoring() {
        // 1000 USDC requested, 1 USDC platform fee, fee estimate 5 at request time and now
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.SENT);
        ArgumentCaptor<String> txHash = ArgumentCaptor.forClass(String.class);
        verify(ledger).markTransferStarted(withdrawal.getId(), NOW);
        verify(ledger).markSent(eq(withdrawal.getId()), txHash.capture(),
                eq(new BigDecimal("994")), eq(new BigDecimal("5")), eq(NOW));
        assertThat(txHash.getValue()).startsWith("0x").hasSize(66);
        assertThat(result.detail()).isEqualTo(txHash.getValue());

        ArgumentCaptor<ConfirmationMonitoringJob> monitoring = ArgumentCaptor.forClass(ConfirmationMonitoringJob.class);
        verify(queue).enqueue(eq(ConfirmationMonitor.JOB_NAME), monitoring.capture(),
                eq(JobOptions.once(Duration.ofMinutes(5), WithdrawalProcessor.MONITORING_JOB_PRIORITY)));
        assertThat(monitoring.getValue().attempt()).isEqualTo(1);
        assertThat(monitoring.getValue().txHash()).isEqualTo(txHash.getValue());
        verify(notifier).notifyUser(eq(Notification.WITHDRAWAL_SENT), eq("user-1"), eq(withdrawal.getId()), anyMap());
        verify(escalator, never()).escalate(any(), any(), anyString());
    }

    @Test
    void bitcoinWithdrawalToEvmAddress_failsAddressValidation() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.BITCOIN_MAINNET, "slip44:0", EVM_BENEFICIARY, "0.5", "0.0005", "0.00003");
        givenLedgerHolds(withdrawal);
        givenFee("0.00003");

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(withdrawal.getId(), FailureTag.INVALID_ADDRESS,
                "Invalid beneficiary address: Invalid Bitcoin address format");
        verify(ledger, never()).markTransferStarted(any(), any());
    }

    @Test
    void networkDown_isEscalatedWithoutCallingTheWallet() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, "slip44:60", EVM_BENEFICIARY, "1", "0.001", "0.0004");
        givenLedgerHolds(withdrawal);
        fakeChain.setNetworkDown(BlockchainKeys.ETHEREUM_MAINNET, true);

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.NETWORK_NOT_OPERATIONAL), anyString());
        verify(ledger, never()).markTransferStarted(any(), any());
    }

    @Test
    void feeVariance_isInclusiveAtFiftyPercent() {
        assertThat(WithdrawalProcessor.exceedsVariance(new BigDecimal("100"), new BigDecimal("149"))).isFalse();
        assertThat(WithdrawalProcessor.exceedsVariance(new BigDecimal("100"), new BigDecimal("150"))).isFalse();
        assertThat(WithdrawalProcessor.exceedsVariance(new BigDecimal("100"), new BigDecimal("151"))).isTrue();
        assertThat(WithdrawalProcessor.exceedsVariance(new BigDecimal("100"), new BigDecimal("49"))).isTrue();
        assertThat(WithdrawalProcessor.exceedsVariance(BigDecimal.ZERO, BigDecimal.ZERO)).isFalse();
    }

    @Test
    void feeSpike_failsFeeValidation() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("8");

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.FEE_VALIDATION_FAILED), anyString());
        verify(ledger, never()).markTransferStarted(any(), any());
    }

    @Test
    void hotWalletOutOfFunds_isClassifiedSeparately() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);
        fakeChain.setNextOutcome(withdrawal.getId(), FakeChain.NextOutcome.INSUFFICIENT_FUNDS);

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.HOT_WALLET_INSUFFICIENT_FUNDS), anyString());
        verify(ledger, never()).markSent(any(), any(), any(), any(), any());
    }

    @Test
    void hotWalletAddressMismatch_isEscalated() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.BSC_MAINNET, "slip44:714", EVM_BENEFICIARY, "1", "0.001", "0.0001");
        givenLedgerHolds(withdrawal);
        givenFee("0.0001");

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.HOT_WALLET_MISMATCH), anyString());
    }

    @Test
    void unconfiguredCurrency_isEscalatedBeforeTransfer() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        when(currencyLimitsRepository.findByBlockchainKeyAndTokenId(BlockchainKeys.ETHEREUM_MAINNET, USDC))
                .thenReturn(Optional.empty());

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.CURRENCY_NOT_CONFIGURED), anyString());
        verify(ledger, never()).markTransferStarted(any(), any());
    }

    @Test
    void alreadySentWithdrawal_isSkipped() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        withdrawal.markSent("0xabc", new BigDecimal("994"), new BigDecimal("5"), NOW);
        givenLedgerHolds(withdrawal);

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 2, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.SKIPPED);
        verify(escalator, never()).escalate(any(), any(), anyString());
    }

    @Test
    void jobForAnotherUser_isSkipped() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        WithdrawalProcessingJob job = new WithdrawalProcessingJob(withdrawal.getId(), "user-2", withdrawal.getAmount(),
                withdrawal.getCurrencyBlockchainKey(), withdrawal.getCurrencyTokenId(), withdrawal.getBeneficiaryAddress());

        assertThat(processor.handle(job, new JobContext(UUID.randomUUID(), 1, 5)).outcome()).isEqualTo(JobOutcome.SKIPPED);
    }

    @Test
    void retryAfterTransferStarted_neverResends() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        withdrawal.markTransferStarted(NOW.minusSeconds(30));
        givenLedgerHolds(withdrawal);

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 2, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.FAILED);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.TRANSFER_STATE_UNKNOWN), anyString());
        verify(ledger, never()).markSent(any(), any(), any(), any(), any());
    }

    @Test
    void unexpectedError_isRethrownForRetryWithoutEscalation() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);
        when(ledger.markTransferStarted(any(), any())).thenThrow(new IllegalStateException("database unavailable"));

        assertThatThrownBy(() -> processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 2, 5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("database unavailable");
        verify(escalator, never()).escalate(any(), any(), anyString());
    }

    @Test
    void unexpectedErrorOnFinalAttempt_escalatesMaxRetries() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);
        when(ledger.markTransferStarted(any(), any())).thenThrow(new IllegalStateException("database unavailable"));

        assertThatThrownBy(() -> processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 5, 5)))
                .isInstanceOf(IllegalStateException.class);
        verify(escalator).escalate(withdrawal.getId(), FailureTag.MAX_RETRIES_EXCEEDED,
                "Processing failed after 5 attempts: database unavailable");
    }

    @Test
    void failureAfterBroadcastOnFinalAttempt_isNotMarkedFailed() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);
        when(ledger.markTransferStarted(any(), any())).thenAnswer(invocation -> {
            withdrawal.markTransferStarted(invocation.getArgument(1));
            return withdrawal;
        });
        when(ledger.markSent(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("optimistic lock"));

        assertThatThrownBy(() -> processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 5, 5)))
                .isInstanceOf(IllegalStateException.class);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.TRANSFER_STATE_UNKNOWN), anyString());
        verify(escalator, never()).escalate(any(), eq(FailureTag.MAX_RETRIES_EXCEEDED), anyString());
    }

    @Test
    void monitoringEnqueueFailure_keepsWithdrawalSent() {
        Withdrawal withdrawal = withdrawal(BlockchainKeys.ETHEREUM_MAINNET, USDC, EVM_BENEFICIARY, "1000", "1", "5");
        givenLedgerHolds(withdrawal);
        givenFee("5");
        givenDecimals(BlockchainKeys.ETHEREUM_MAINNET, USDC, 6);
        when(queue.enqueue(eq(ConfirmationMonitor.JOB_NAME), any(), any())).thenThrow(new IllegalStateException("queue down"));

        JobResult result = processor.handle(job(withdrawal), new JobContext(UUID.randomUUID(), 1, 5));

        assertThat(result.outcome()).isEqualTo(JobOutcome.SENT);
        verify(escalator).escalate(eq(withdrawal.getId()), eq(FailureTag.MONITORING_FAILURE), anyString());
    }

    private Withdrawal withdrawal(String key, String tokenId, String address, String request, String platformFee, String networkFee) {
        Withdrawal withdrawal = Withdrawal.requested(
                "idem-" + UUID.randomUUID(), "user-1", UUID.randomUUID(), address, key, tokenId,
                new BigDecimal(request), new BigDecimal(platformFee), new BigDecimal(networkFee), NOW.minusSeconds(60));
        ReflectionTestUtils.setField(withdrawal, "id", UUID.randomUUID());
        return withdrawal;
    }

    private WithdrawalProcessingJob job(Withdrawal withdrawal) {
        return new WithdrawalProcessingJob(
                withdrawal.getId(),
                withdrawal.getUserId(),
                withdrawal.getAmount(),
                withdrawal.getCurrencyBlockchainKey(),
                withdrawal.getCurrencyTokenId(),
                withdrawal.getBeneficiaryAddress()
        );
    }

    private void givenLedgerHolds(Withdrawal withdrawal) {
        when(ledger.find(withdrawal.getId())).thenReturn(Optional.of(withdrawal));
    }

    private void givenFee(String fee) {
        when(feeOracle.estimate(anyString(), anyString(), eq(FeePriority.STANDARD), any()))
                .thenReturn(NetworkFeeEstimate.of(new BigDecimal(fee), "ETH", "2-5 minutes"));
    }

    private void givenDecimals(String key, String tokenId, int decimals) {
        when(currencyLimitsRepository.findByBlockchainKeyAndTokenId(key, tokenId)).thenReturn(Optional.of(
                CurrencyLimits.builder()
                        .blockchainKey(key)
                        .tokenId(tokenId)
                        .decimals(decimals)
                        .withdrawalFeeRate(new BigDecimal("0.001"))
                        .minWithdrawalAmount(BigDecimal.ONE)
                        .build()));
    }
}
