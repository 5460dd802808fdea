package lending.settlement.orchestration;

import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.domain.withdrawal.WithdrawalRepository;
import lending.settlement.domain.withdrawal.WithdrawalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * All withdrawal state writes made by the settlement pipeline. Every method reloads the
 * row and checks the persisted state before writing, and the entity's version column
 * rejects a concurrent writer, so a stale job can never move a withdrawal backwards or
 * overwrite a refund decision taken elsewhere.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalLedger {

    private final WithdrawalRepository withdrawalRepository;

    @Transactional(readOnly = true)
    public Optional<Withdrawal> find(UUID withdrawalId) {
        return withdrawalRepository.findById(withdrawalId);
    }

    @Transactional
    public Withdrawal save(Withdrawal withdrawal) {
        return withdrawalRepository.save(withdrawal);
    }

    @Transactional
    public Withdrawal markTransferStarted(UUID withdrawalId, Instant at) {
        Withdrawal withdrawal = load(withdrawalId);
        withdrawal.markTransferStarted(at);
        log.info("event=withdrawal_ledger.transfer_started withdrawalId={}", withdrawalId);
        return withdrawalRepository.save(withdrawal);
    }

    @Transactional
    public Withdrawal markSent(UUID withdrawalId, String txHash, BigDecimal sentAmount, BigDecimal actualFee, Instant at) {
        Withdrawal withdrawal = load(withdrawalId);
        if (withdrawal.getStatus() != WithdrawalStatus.REQUESTED) {
            throw new IllegalStateException("Withdrawal send update failed: withdrawal " + withdrawalId
                    + " is " + withdrawal.getStatus() + " but transaction " + txHash + " was broadcast");
        }
        withdrawal.markSent(txHash, sentAmount, actualFee, at);
        log.info("event=withdrawal_ledger.sent withdrawalId={} txHash={} sentAmount={}", withdrawalId, txHash, sentAmount);
        return withdrawalRepository.save(withdrawal);
    }

    // false when the withdrawal already left SENT (confirmed by an earlier job, or failed)
    @Transactional
    public boolean markConfirmed(UUID withdrawalId, Instant at) {
        Withdrawal withdrawal = load(withdrawalId);
        if (withdrawal.getStatus() != WithdrawalStatus.SENT) {
            log.info("event=withdrawal_ledger.confirm_skipped withdrawalId={} status={}", withdrawalId, withdrawal.getStatus());
            return false;
        }
        withdrawal.markConfirmed(at);
        withdrawalRepository.save(withdrawal);
        log.info("event=withdrawal_ledger.confirmed withdrawalId={}", withdrawalId);
        return true;
    }

    // Only REQUESTED and SENT can fail; anything later belongs to another flow and is left alone.
    @Transactional
    public boolean markFailed(UUID withdrawalId, Instant at, String reason) {
        Withdrawal withdrawal = load(withdrawalId);
        if (!withdrawal.getStatus().canTransitionTo(WithdrawalStatus.FAILED)) {
            log.warn(
                    "event=withdrawal_ledger.fail_skipped withdrawalId={} status={} reason={}",
                    withdrawalId,
                    withdrawal.getStatus(),
                    reason
            );
            return false;
        }
        withdrawal.markFailed(at, reason);
        withdrawalRepository.save(withdrawal);
        log.info("event=withdrawal_ledger.failed withdrawalId={} reason={}", withdrawalId, reason);
        return true;
    }

    @Transactional
    public void requestAutoRefund(UUID withdrawalId) {
        Withdrawal withdrawal = load(withdrawalId);
        withdrawal.requestAutoRefund();
        withdrawalRepository.save(withdrawal);
        log.info("event=withdrawal_ledger.auto_refund_requested withdrawalId={}", withdrawalId);
    }

    private Withdrawal load(UUID withdrawalId) {
        return withdrawalRepository.findById(withdrawalId)
                .orElseThrow(() -> new WithdrawalNotFoundException(withdrawalId));
    }
}
