package lending.settlement.notification;

import lending.settlement.domain.notification.NotificationAudience;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

// A failed notification write is logged and dropped; it must never fail the settlement step that triggered it.
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementNotifier {

    private final NotificationQueue notificationQueue;

    public void notifyUser(String type, String userId, UUID withdrawalId, Map<String, Object> attributes) {
        send(new Notification(type, NotificationAudience.USER, userId, withdrawalId, attributes));
    }

    public void notifyAdmin(String type, UUID withdrawalId, Map<String, Object> attributes) {
        send(new Notification(type, NotificationAudience.ADMIN, null, withdrawalId, attributes));
    }

    private void send(Notification notification) {
        try {
            notificationQueue.enqueue(notification);
            log.info(
                    "event=settlement_notifier.enqueued type={} audience={} withdrawalId={}",
                    notification.type(),
                    notification.audience(),
                    notification.withdrawalId()
            );
        } catch (RuntimeException e) {
            log.error(
                    "event=settlement_notifier.enqueue_failed type={} audience={} withdrawalId={} error={}",
                    notification.type(),
                    notification.audience(),
                    notification.withdrawalId(),
                    e.getMessage(),
                    e
            );
        }
    }
}
