package lending.settlement.orchestration;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.adapter.HotWalletGateway;
import lending.settlement.adapter.HotWalletGateway.TransferCommand;
import lending.settlement.adapter.HotWalletGateway.TransferResult;
import lending.settlement.adapter.HotWalletRouter;
import lending.settlement.address.AddressValidation;
import lending.settlement.address.AddressValidator;
import lending.settlement.domain.currency.CurrencyLimits;
import lending.settlement.domain.currency.CurrencyLimitsRepository;
import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.domain.withdrawal.WithdrawalStatus;
import lending.settlement.escalation.FailureEscalator;
import lending.settlement.escalation.FailureTag;
import lending.settlement.fee.FeePriority;
import lending.settlement.fee.NetworkFeeEstimate;
import lending.settlement.fee.NetworkFeeOracle;
import lending.settlement.network.BlockchainNetworkProfile;
import lending.settlement.network.NetworkProfileRegistry;
import lending.settlement.notification.Notification;
import lending.settlement.notification.SettlementNotifier;
import lending.settlement.queue.JobContext;
import lending.settlement.queue.JobHandler;
import lending.settlement.queue.JobOptions;
import lending.settlement.queue.JobOutcome;
import lending.settlement.queue.JobResult;
import lending.settlement.queue.SettlementQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Handles {@code process-withdrawal}: re-validates a REQUESTED withdrawal, sends it from the
 * hot wallet and hands it over to confirmation monitoring.
 *
 * <p>Validation failures are terminal and escalated on first occurrence. Any other exception
 * is rethrown so the queue retries it; the last attempt escalates {@code MAX_RETRIES_EXCEEDED}
 * before rethrowing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WithdrawalProcessor implements JobHandler<WithdrawalProcessingJob> {

    public static final String JOB_NAME = "process-withdrawal";
    static final BigDecimal MAX_FEE_VARIANCE = new BigDecimal("0.5");
    static final int MONITORING_JOB_PRIORITY = 6;

    private final WithdrawalLedger ledger;
    private final ChainClientRouter chainClients;
    private final NetworkFeeOracle feeOracle;
    private final AddressValidator addressValidator;
    private final HotWalletRouter hotWallets;
    private final HotWalletTransferLock transferLock;
    private final NetworkProfileRegistry profiles;
    private final CurrencyLimitsRepository currencyLimitsRepository;
    private final SettlementQueue queue;
    private final FailureEscalator escalator;
    private final SettlementNotifier notifier;
    private final Clock clock;

    @Override
    public String jobName() {
        return JOB_NAME;
    }

    @Override
    public Class<WithdrawalProcessingJob> payloadType() {
        return WithdrawalProcessingJob.class;
    }

    @Override
    public JobResult handle(WithdrawalProcessingJob job, JobContext context) {
        MDC.put("withdrawalId", String.valueOf(job.withdrawalId()));
        try {
            log.info(
                    "event=withdrawal_processor.start withdrawalId={} blockchainKey={} tokenId={} attempt={}/{}",
                    job.withdrawalId(),
                    job.blockchainKey(),
                    job.tokenId(),
                    context.attempt(),
                    context.maxAttempts()
            );
            return process(job);
        } catch (SettlementValidationException e) {
            log.warn(
                    "event=withdrawal_processor.validation_failed withdrawalId={} tag={} reason={}",
                    job.withdrawalId(),
                    e.getTag(),
                    e.getMessage()
            );
            escalator.escalate(job.withdrawalId(), e.getTag(), e.getMessage());
            return JobResult.of(JobOutcome.FAILED, e.getTag() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error(
                    "event=withdrawal_processor.error withdrawalId={} attempt={}/{} error={}",
                    job.withdrawalId(),
                    context.attempt(),
                    context.maxAttempts(),
                    e.getMessage(),
                    e
            );
            if (context.isFinalAttempt()) {
                // once the hot wallet was called the funds may be on-chain, so never fail it outright
                boolean transferStarted = ledger.find(job.withdrawalId())
                        .map(Withdrawal::isTransferStarted)
                        .orElse(false);
                FailureTag tag = transferStarted ? FailureTag.TRANSFER_STATE_UNKNOWN : FailureTag.MAX_RETRIES_EXCEEDED;
                escalator.escalate(job.withdrawalId(), tag,
                        "Processing failed after " + context.attempt() + " attempts: " + e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove("withdrawalId");
        }
    }

    private JobResult process(WithdrawalProcessingJob job) {
        Optional<Withdrawal> current = ledger.find(job.withdrawalId());
        Optional<String> skipReason = skipReason(job, current);
        if (skipReason.isPresent()) {
            log.info("event=withdrawal_processor.skipped withdrawalId={} reason={}", job.withdrawalId(), skipReason.get());
            return JobResult.skipped(skipReason.get());
        }
        Withdrawal withdrawal = current.get();
        if (withdrawal.isTransferStarted()) {
            // a previous attempt reached the hot wallet but never recorded the result
            throw new SettlementValidationException(FailureTag.TRANSFER_STATE_UNKNOWN,
                    "Transfer started at " + withdrawal.getTransferStartedAt()
                            + " without a recorded result, manual reconciliation required");
        }

        String blockchainKey = withdrawal.getCurrencyBlockchainKey();
        BlockchainNetworkProfile profile = profiles.profileOrDefault(blockchainKey);

        ensureNetworkOperational(blockchainKey);

        NetworkFeeEstimate estimate = feeOracle.estimate(
                blockchainKey, withdrawal.getCurrencyTokenId(), FeePriority.STANDARD, withdrawal.getAmount());
        log.info(
                "event=withdrawal_processor.fee_estimated withdrawalId={} fee={} unit={}",
                withdrawal.getId(),
                estimate.fee(),
                estimate.feeUnit()
        );

        AddressValidation address = addressValidator.validate(withdrawal.getBeneficiaryAddress(), blockchainKey);
        if (!address.valid()) {
            throw new SettlementValidationException(FailureTag.INVALID_ADDRESS,
                    "Invalid beneficiary address: " + address.reason());
        }

        BigDecimal actualFee = revalidateFee(withdrawal);

        TransferResult transfer = executeTransfer(withdrawal, profile, actualFee);
        BigDecimal sendAmount = withdrawal.getAmount().subtract(actualFee);

        ledger.markSent(withdrawal.getId(), transfer.txHash(), sendAmount, actualFee, clock.instant());
        scheduleMonitoring(withdrawal, transfer.txHash(), profile);

        notifier.notifyUser(Notification.WITHDRAWAL_SENT, withdrawal.getUserId(), withdrawal.getId(), Map.of(
                "name", "Withdrawal Sent",
                "transactionHash", transfer.txHash(),
                "amount", sendAmount.toPlainString(),
                "estimatedConfirmationTime", estimate.estimatedConfirmationTime()
        ));
        log.info(
                "event=withdrawal_processor.sent withdrawalId={} txHash={} sendAmount={} networkFee={}",
                withdrawal.getId(),
                transfer.txHash(),
                sendAmount,
                actualFee
        );
        return JobResult.of(JobOutcome.SENT, transfer.txHash());
    }

    private Optional<String> skipReason(WithdrawalProcessingJob job, Optional<Withdrawal> withdrawal) {
        if (withdrawal.isEmpty()) {
            return Optional.of("Withdrawal not found");
        }
        if (!withdrawal.get().getUserId().equals(job.userId())) {
            return Optional.of("Withdrawal does not belong to user " + job.userId());
        }
        if (withdrawal.get().getStatus() != WithdrawalStatus.REQUESTED) {
            return Optional.of("Withdrawal is " + withdrawal.get().getStatus() + ", expected REQUESTED");
        }
        return Optional.empty();
    }

    private void ensureNetworkOperational(String blockchainKey) {
        long height;
        try {
            height = chainClients.resolve(blockchainKey).getLatestHeight();
        } catch (RuntimeException e) {
            throw new SettlementValidationException(FailureTag.NETWORK_NOT_OPERATIONAL,
                    "Network " + blockchainKey + " is not operational: " + e.getMessage(), e);
        }
        if (height <= 0) {
            throw new SettlementValidationException(FailureTag.NETWORK_NOT_OPERATIONAL,
                    "Network " + blockchainKey + " reported height " + height);
        }
    }

    // Returns the fee to deduct. Rejects when it drifted more than 50% from the estimate stored at request time.
    private BigDecimal revalidateFee(Withdrawal withdrawal) {
        BigDecimal storedFee = withdrawal.getEstimatedNetworkFee();
        BigDecimal currentFee = feeOracle.estimate(
                withdrawal.getCurrencyBlockchainKey(),
                withdrawal.getCurrencyTokenId(),
                FeePriority.STANDARD,
                withdrawal.getAmount()
        ).fee();

        if (exceedsVariance(storedFee, currentFee)) {
            throw new SettlementValidationException(FailureTag.FEE_VALIDATION_FAILED,
                    "Network fee moved from " + storedFee.toPlainString() + " to " + currentFee.toPlainString()
                            + ", more than " + MAX_FEE_VARIANCE.movePointRight(2).stripTrailingZeros().toPlainString() + "%");
        }
        if (withdrawal.getAmount().compareTo(currentFee) <= 0) {
            throw new SettlementValidationException(FailureTag.FEE_VALIDATION_FAILED,
                    "Amount " + withdrawal.getAmount().toPlainString() + " does not cover network fee " + currentFee.toPlainString());
        }
        return currentFee;
    }

    static boolean exceedsVariance(BigDecimal storedFee, BigDecimal currentFee) {
        if (storedFee.signum() == 0) {
            return currentFee.signum() != 0;
        }
        BigDecimal variance = currentFee.subtract(storedFee).abs().divide(storedFee, MathContext.DECIMAL64);
        return variance.compareTo(MAX_FEE_VARIANCE) > 0;
    }

    private TransferResult executeTransfer(Withdrawal withdrawal, BlockchainNetworkProfile profile, BigDecimal actualFee) {
        String blockchainKey = withdrawal.getCurrencyBlockchainKey();
        HotWalletGateway gateway = hotWallets.find(blockchainKey)
                .orElseThrow(() -> new SettlementValidationException(FailureTag.HOT_WALLET_UNAVAILABLE,
                        "No hot wallet configured for " + blockchainKey));
        String hotWalletAddress = gateway.getAddress(blockchainKey);
        if (profile.hasHotWalletAddress() && !profile.hotWalletAddress().equalsIgnoreCase(hotWalletAddress)) {
            throw new SettlementValidationException(FailureTag.HOT_WALLET_MISMATCH,
                    "Hot wallet " + hotWalletAddress + " does not match configured " + profile.hotWalletAddress());
        }
        int decimals = currencyLimitsRepository
                .findByBlockchainKeyAndTokenId(blockchainKey, withdrawal.getCurrencyTokenId())
                .map(CurrencyLimits::getDecimals)
                .orElseThrow(() -> new SettlementValidationException(FailureTag.CURRENCY_NOT_CONFIGURED,
                        "No currency configuration for " + blockchainKey + "/" + withdrawal.getCurrencyTokenId()));

        TransferCommand command = new TransferCommand(
                withdrawal.getId(),
                blockchainKey,
                withdrawal.getCurrencyTokenId(),
                withdrawal.getBeneficiaryAddress(),
                withdrawal.getAmount().subtract(actualFee),
                decimals
        );

        ledger.markTransferStarted(withdrawal.getId(), clock.instant());
        try {
            return transferLock.withLock(blockchainKey, hotWalletAddress, () -> gateway.transfer(command));
        } catch (RuntimeException e) {
            FailureTag tag = isInsufficientFunds(e) ? FailureTag.HOT_WALLET_INSUFFICIENT_FUNDS : FailureTag.BLOCKCHAIN_EXECUTION_FAILED;
            throw new SettlementValidationException(tag, "Blockchain transfer failed: " + e.getMessage(), e);
        }
    }

    private static boolean isInsufficientFunds(RuntimeException e) {
        return e.getMessage() != null && e.getMessage().toLowerCase(Locale.ROOT).contains("insufficient funds");
    }

    // The transaction is already on its way; a lost monitoring job must not turn into a resend.
    private void scheduleMonitoring(Withdrawal withdrawal, String txHash, BlockchainNetworkProfile profile) {
        try {
            queue.enqueue(
                    ConfirmationMonitor.JOB_NAME,
                    new ConfirmationMonitoringJob(withdrawal.getId(), txHash, withdrawal.getCurrencyBlockchainKey(), 1),
                    JobOptions.once(profile.initialMonitoringDelay(), MONITORING_JOB_PRIORITY)
            );
        } catch (RuntimeException e) {
            log.error(
                    "event=withdrawal_processor.monitoring_enqueue_failed withdrawalId={} txHash={} error={}",
                    withdrawal.getId(),
                    txHash,
                    e.getMessage(),
                    e
            );
            escalator.escalate(withdrawal.getId(), FailureTag.MONITORING_FAILURE,
                    "Confirmation monitoring could not be scheduled for " + txHash + ": " + e.getMessage());
        }
    }
}
