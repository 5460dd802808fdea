package lending.settlement.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lending.settlement.domain.notification.NotificationOutboxEntry;
import lending.settlement.domain.notification.NotificationOutboxRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class OutboxNotificationQueue implements NotificationQueue {

    private final NotificationOutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void enqueue(Notification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification.attributes());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification " + notification.type(), e);
        }
        outboxRepository.save(NotificationOutboxEntry.of(
                notification.type(),
                notification.audience(),
                notification.userId(),
                notification.withdrawalId(),
                payload,
                clock.instant()
        ));
    }
}
