package lending.settlement.notification;

import lending.settlement.domain.notification.NotificationAudience;

import java.util.Map;
import java.util.UUID;

public record Notification(
        String type,
        NotificationAudience audience,
        String userId,
        UUID withdrawalId,
        Map<String, Object> attributes
) {
    public static final String WITHDRAWAL_REQUESTED = "WithdrawalRequested";
    public static final String WITHDRAWAL_SENT = "WithdrawalSent";
    public static final String WITHDRAWAL_CONFIRMED = "WithdrawalConfirmed";
    public static final String WITHDRAWAL_FAILED = "WithdrawalFailed";
    public static final String WITHDRAWAL_TIMEOUT = "WithdrawalTimeout";
    public static final String ADMIN_WITHDRAWAL_FAILURE = "AdminWithdrawalFailure";
    public static final String ADMIN_MONITORING_FAILURE = "AdminMonitoringFailure";
    public static final String WITHDRAWAL_REFUND_REQUIRED = "WithdrawalRefundRequired";
}
