package lending.settlement.escalation;

import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.notification.Notification;
import lending.settlement.notification.SettlementNotifier;
import lending.settlement.orchestration.WithdrawalLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class FailureEscalator {

    static final String REVIEW_LINK_PREFIX = "/admin/withdrawals/failed/";
    static final String USER_FAILURE_REASON = "Technical issue occurred during processing";
    static final String USER_NEXT_STEPS = "Our team has been notified. You can request a refund or contact support.";
    static final String USER_TIMEOUT_MESSAGE = "Your withdrawal is taking longer than expected. Our team is investigating.";

    private final WithdrawalLedger ledger;
    private final SettlementNotifier notifier;
    private final Clock clock;

    public FailureRecord classify(FailureTag tag, String reason) {
        FailureType type = tag.failureType();
        return new FailureRecord(tag, type, reason, type.recommendedAction(), type.priority(), type.refundEligible());
    }

    /**
     * Records a settlement failure: fails the withdrawal when the tag says so, alerts admins,
     * tells the user, and flags refund-eligible failures for automatic refund.
     * Ledger errors propagate so the calling job is retried; notification errors do not.
     */
    public FailureRecord escalate(UUID withdrawalId, FailureTag tag, String reason) {
        FailureRecord record = classify(tag, reason);
        log.error(
                "event=failure_escalator.escalate withdrawalId={} tag={} type={} priority={} reason={}",
                withdrawalId,
                tag,
                record.type(),
                record.priority(),
                reason
        );

        boolean failed = tag.failsWithdrawal() && ledger.markFailed(withdrawalId, clock.instant(), record.taggedReason());
        Optional<Withdrawal> withdrawal = ledger.find(withdrawalId);

        if (tag == FailureTag.MONITORING_FAILURE) {
            notifyMonitoringFailure(withdrawalId, withdrawal, record);
            return record;
        }

        notifier.notifyAdmin(Notification.ADMIN_WITHDRAWAL_FAILURE, withdrawalId, adminAlert(withdrawalId, record));

        if (failed) {
            String userId = withdrawal.map(Withdrawal::getUserId).orElse(null);
            notifyUser(withdrawalId, userId, tag);
        }

        if (failed && record.refundEligible()) {
            ledger.requestAutoRefund(withdrawalId);
            Map<String, Object> refund = new LinkedHashMap<>();
            refund.put("withdrawalId", withdrawalId.toString());
            refund.put("failureType", record.type().name());
            refund.put("failureReason", record.taggedReason());
            withdrawal.map(Withdrawal::getSentHash).ifPresent(hash -> refund.put("transactionHash", hash));
            notifier.notifyAdmin(Notification.WITHDRAWAL_REFUND_REQUIRED, withdrawalId, refund);
        }
        return record;
    }

    private Map<String, Object> adminAlert(UUID withdrawalId, FailureRecord record) {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("name", "Withdrawal Failure Alert");
        alert.put("failureType", record.type().name());
        alert.put("failureReason", record.taggedReason());
        alert.put("recommendedAction", record.recommendedAction());
        alert.put("priority", record.priority().name());
        alert.put("requiresAction", true);
        alert.put("reviewLink", REVIEW_LINK_PREFIX + withdrawalId);
        return alert;
    }

    private void notifyUser(UUID withdrawalId, String userId, FailureTag tag) {
        if (tag == FailureTag.TRANSACTION_TIMEOUT) {
            notifier.notifyUser(Notification.WITHDRAWAL_TIMEOUT, userId, withdrawalId, Map.of(
                    "name", "Withdrawal Processing Delayed",
                    "message", USER_TIMEOUT_MESSAGE
            ));
            return;
        }
        notifier.notifyUser(Notification.WITHDRAWAL_FAILED, userId, withdrawalId, Map.of(
                "name", "Withdrawal Failed",
                "failureReason", USER_FAILURE_REASON,
                "nextSteps", USER_NEXT_STEPS
        ));
    }

    private void notifyMonitoringFailure(UUID withdrawalId, Optional<Withdrawal> withdrawal, FailureRecord record) {
        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("name", "Confirmation Monitoring Failed");
        alert.put("failureType", record.type().name());
        alert.put("error", record.reason());
        alert.put("recommendedAction", record.recommendedAction());
        alert.put("priority", record.priority().name());
        alert.put("requiresManualCheck", true);
        alert.put("reviewLink", REVIEW_LINK_PREFIX + withdrawalId);
        withdrawal.map(Withdrawal::getSentHash).ifPresent(hash -> alert.put("transactionHash", hash));
        notifier.notifyAdmin(Notification.ADMIN_MONITORING_FAILURE, withdrawalId, alert);
    }
}
