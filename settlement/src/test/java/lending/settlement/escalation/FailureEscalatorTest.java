package lending.settlement.escalation;

import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.notification.Notification;
import lending.settlement.notification.SettlementNotifier;
import lending.settlement.orchestration.WithdrawalLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FailureEscalatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock WithdrawalLedger ledger;
    @Mock SettlementNotifier notifier;

    FailureEscalator escalator;
    Withdrawal withdrawal;
    UUID withdrawalId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        escalator = new FailureEscalator(ledger, notifier, Clock.fixed(NOW, ZoneOffset.UTC));
        withdrawal = Withdrawal.requested(
                "idem-1", "user-1", UUID.randomUUID(), "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed",
                "eip155:1", "slip44:60", new BigDecimal("1"), new BigDecimal("0.001"), new BigDecimal("0.0004"), NOW);
    }

    @Test
    void classify_carriesTypePriorityAndAction() {
        FailureRecord record = escalator.classify(FailureTag.INVALID_ADDRESS, "bad checksum");

        assertThat(record.type()).isEqualTo(FailureType.INVALID_ADDRESS);
        assertThat(record.priority()).isEqualTo(FailurePriority.MEDIUM);
        assertThat(record.refundEligible()).isFalse();
        assertThat(record.recommendedAction()).isEqualTo("Verify if address validation failed - user error likely");
        assertThat(record.taggedReason()).isEqualTo("INVALID_ADDRESS: bad checksum");
    }

    @Test
    @SuppressWarnings("unchecked")
    void validationFailure_failsWithdrawalAndAlertsAdminAndUser() {
        when(ledger.markFailed(withdrawalId, NOW, "INVALID_ADDRESS: bad checksum")).thenReturn(true);
        when(ledger.find(withdrawalId)).thenReturn(Optional.of(withdrawal));

        escalator.escalate(withdrawalId, FailureTag.INVALID_ADDRESS, "bad checksum");

        ArgumentCaptor<Map<String, Object>> alert = ArgumentCaptor.forClass(Map.class);
        verify(notifier).notifyAdmin(eq(Notification.ADMIN_WITHDRAWAL_FAILURE), eq(withdrawalId), alert.capture());
        assertThat(alert.getValue())
                .containsEntry("failureType", "INVALID_ADDRESS")
                .containsEntry("priority", "MEDIUM")
                .containsEntry("requiresAction", true)
                .containsEntry("reviewLink", "/admin/withdrawals/failed/" + withdrawalId);

        ArgumentCaptor<Map<String, Object>> userMessage = ArgumentCaptor.forClass(Map.class);
        verify(notifier).notifyUser(eq(Notification.WITHDRAWAL_FAILED), eq("user-1"), eq(withdrawalId), userMessage.capture());
        assertThat(userMessage.getValue()).containsEntry("failureReason", "Technical issue occurred during processing");
        verify(ledger, never()).requestAutoRefund(any());
    }

    @Test
    void blockchainRejection_requestsAutomaticRefund() {
        when(ledger.markFailed(eq(withdrawalId), eq(NOW), any())).thenReturn(true);
        when(ledger.find(withdrawalId)).thenReturn(Optional.of(withdrawal));

        FailureRecord record = escalator.escalate(withdrawalId, FailureTag.BLOCKCHAIN_REJECTION, "execution reverted");

        assertThat(record.refundEligible()).isTrue();
        verify(ledger).requestAutoRefund(withdrawalId);
        verify(notifier).notifyAdmin(eq(Notification.WITHDRAWAL_REFUND_REQUIRED), eq(withdrawalId), anyMap());
    }

    @Test
    void timeout_sendsDelayMessageToUser() {
        when(ledger.markFailed(eq(withdrawalId), eq(NOW), any())).thenReturn(true);
        when(ledger.find(withdrawalId)).thenReturn(Optional.of(withdrawal));

        escalator.escalate(withdrawalId, FailureTag.TRANSACTION_TIMEOUT, "no confirmation within 24 hours");

        verify(notifier).notifyUser(eq(Notification.WITHDRAWAL_TIMEOUT), eq("user-1"), eq(withdrawalId), anyMap());
        verify(notifier, never()).notifyUser(eq(Notification.WITHDRAWAL_FAILED), any(), any(), anyMap());
    }

    @Test
    void monitoringFailure_leavesWithdrawalAndOnlyAlertsAdmin() {
        when(ledger.find(withdrawalId)).thenReturn(Optional.of(withdrawal));

        escalator.escalate(withdrawalId, FailureTag.MONITORING_FAILURE, "still unconfirmed after 21 checks");

        verify(ledger, never()).markFailed(any(), any(), any());
        verify(notifier).notifyAdmin(eq(Notification.ADMIN_MONITORING_FAILURE), eq(withdrawalId), anyMap());
        verify(notifier, never()).notifyAdmin(eq(Notification.ADMIN_WITHDRAWAL_FAILURE), any(), anyMap());
        verify(notifier, never()).notifyUser(any(), any(), any(), anyMap());
    }

    @Test
    void alreadyTerminalWithdrawal_isNotReportedToUser() {
        when(ledger.markFailed(eq(withdrawalId), eq(NOW), any())).thenReturn(false);
        when(ledger.find(withdrawalId)).thenReturn(Optional.of(withdrawal));

        escalator.escalate(withdrawalId, FailureTag.BLOCKCHAIN_REJECTION, "late revert");

        verify(notifier).notifyAdmin(eq(Notification.ADMIN_WITHDRAWAL_FAILURE), eq(withdrawalId), anyMap());
        verify(notifier, never()).notifyUser(any(), any(), any(), anyMap());
        verify(ledger, never()).requestAutoRefund(any());
    }
}
