package lending.settlement.orchestration;

import lending.settlement.adapter.ChainClientRouter;
import lending.settlement.adapter.ChainRpcClient.TransactionStatus;
import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.domain.withdrawal.WithdrawalStatus;
import lending.settlement.escalation.FailureEscalator;
import lending.settlement.escalation.FailureTag;
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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

// Handles monitor-confirmation. Rescheduling is a new delayed job, never a retry of this one.
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationMonitor implements JobHandler<ConfirmationMonitoringJob> {

    public static final String JOB_NAME = "monitor-confirmation";
    static final Duration CONFIRMATION_TIMEOUT = Duration.ofHours(24);

    private final WithdrawalLedger ledger;
    private final ChainClientRouter chainClients;
    private final NetworkProfileRegistry profiles;
    private final SettlementQueue queue;
    private final FailureEscalator escalator;
    private final SettlementNotifier notifier;
    private final Clock clock;

    @Override
    public String jobName() {
        return JOB_NAME;
    }

    @Override
    public Class<ConfirmationMonitoringJob> payloadType() {
        return ConfirmationMonitoringJob.class;
    }

    @Override
    public JobResult handle(ConfirmationMonitoringJob job, JobContext context) {
        MDC.put("withdrawalId", String.valueOf(job.withdrawalId()));
        try {
            return monitor(job);
        } finally {
            MDC.remove("withdrawalId");
        }
    }

    private JobResult monitor(ConfirmationMonitoringJob job) {
        log.info(
                "event=confirmation_monitor.check withdrawalId={} txHash={} blockchainKey={} attempt={}",
                job.withdrawalId(),
                job.txHash(),
                job.blockchainKey(),
                job.attempt()
        );

        Optional<Withdrawal> current = ledger.find(job.withdrawalId());
        if (current.isEmpty() || current.get().getStatus() != WithdrawalStatus.SENT) {
            String status = current.map(w -> w.getStatus().name()).orElse("MISSING");
            log.info("event=confirmation_monitor.skipped withdrawalId={} status={}", job.withdrawalId(), status);
            return JobResult.skipped("Withdrawal is " + status + ", expected SENT");
        }
        Withdrawal withdrawal = current.get();

        Instant now = clock.instant();
        if (withdrawal.getSentDate() != null && withdrawal.getSentDate().plus(CONFIRMATION_TIMEOUT).isBefore(now)) {
            escalator.escalate(withdrawal.getId(), FailureTag.TRANSACTION_TIMEOUT,
                    "Transaction timeout - no confirmation received within 24 hours (txHash=" + job.txHash() + ")");
            return JobResult.of(JobOutcome.TIMEOUT, job.txHash());
        }

        BlockchainNetworkProfile profile = profiles.profileOrDefault(job.blockchainKey());

        TransactionStatus status;
        try {
            status = chainClients.resolve(job.blockchainKey()).getTransactionStatus(job.txHash());
        } catch (RuntimeException e) {
            return onStatusQueryError(job, e);
        }

        if (status.confirmed() && status.confirmations() >= profile.requiredConfirmations()) {
            return onConfirmed(withdrawal, job, status);
        }
        if (status.failed()) {
            escalator.escalate(withdrawal.getId(), FailureTag.BLOCKCHAIN_REJECTION,
                    "Transaction failed: " + status.failureReason());
            return JobResult.of(JobOutcome.FAILED, status.failureReason());
        }
        return onPending(job, status, profile);
    }

    private JobResult onConfirmed(Withdrawal withdrawal, ConfirmationMonitoringJob job, TransactionStatus status) {
        if (!ledger.markConfirmed(withdrawal.getId(), clock.instant())) {
            return JobResult.skipped("Withdrawal left SENT before confirmation was recorded");
        }
        notifier.notifyUser(Notification.WITHDRAWAL_CONFIRMED, withdrawal.getUserId(), withdrawal.getId(), Map.of(
                "name", "Withdrawal Confirmed",
                "transactionHash", job.txHash(),
                "confirmations", status.confirmations()
        ));
        log.info(
                "event=confirmation_monitor.confirmed withdrawalId={} txHash={} confirmations={}",
                withdrawal.getId(),
                job.txHash(),
                status.confirmations()
        );
        return JobResult.of(JobOutcome.CONFIRMED, job.txHash());
    }

    private JobResult onPending(ConfirmationMonitoringJob job, TransactionStatus status, BlockchainNetworkProfile profile) {
        Optional<MonitoringBackoff.Step> next = MonitoringBackoff.afterPending(job.attempt());
        if (next.isEmpty()) {
            escalator.escalate(job.withdrawalId(), FailureTag.MONITORING_FAILURE,
                    "Transaction " + job.txHash() + " still unconfirmed after " + job.attempt() + " checks");
            return JobResult.of(JobOutcome.ESCALATED, job.txHash());
        }
        reschedule(job, next.get());
        log.info(
                "event=confirmation_monitor.pending withdrawalId={} confirmations={}/{} nextAttempt={} delayMs={}",
                job.withdrawalId(),
                status.confirmations(),
                profile.requiredConfirmations(),
                next.get().attempt(),
                next.get().delay().toMillis()
        );
        return JobResult.of(JobOutcome.PENDING, status.confirmations() + "/" + profile.requiredConfirmations());
    }

    // An unreachable node says nothing about the transaction; keep the withdrawal SENT.
    private JobResult onStatusQueryError(ConfirmationMonitoringJob job, RuntimeException e) {
        log.warn(
                "event=confirmation_monitor.status_error withdrawalId={} txHash={} attempt={} error={}",
                job.withdrawalId(),
                job.txHash(),
                job.attempt(),
                e.getMessage()
        );
        Optional<MonitoringBackoff.Step> next = MonitoringBackoff.afterError(job.attempt());
        if (next.isEmpty()) {
            escalator.escalate(job.withdrawalId(), FailureTag.MONITORING_FAILURE,
                    "Status query for " + job.txHash() + " failed on attempt " + job.attempt() + ": " + e.getMessage());
            return JobResult.of(JobOutcome.ESCALATED, e.getMessage());
        }
        reschedule(job, next.get());
        return JobResult.of(JobOutcome.PENDING, "status query failed: " + e.getMessage());
    }

    private void reschedule(ConfirmationMonitoringJob job, MonitoringBackoff.Step step) {
        queue.enqueue(JOB_NAME, job.next(step.attempt()),
                JobOptions.once(step.delay(), WithdrawalProcessor.MONITORING_JOB_PRIORITY));
    }
}
