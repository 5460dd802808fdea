package lending.settlement.domain.notification;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notification_outbox", indexes = {
        @Index(name = "idx_notification_withdrawal", columnList = "withdrawalId"),
        @Index(name = "idx_notification_created", columnList = "createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class NotificationOutboxEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 64)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private NotificationAudience audience;

    @Column(length = 64)
    private String userId;

    @Column(updatable = false)
    private UUID withdrawalId;

    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static NotificationOutboxEntry of(
            String type,
            NotificationAudience audience,
            String userId,
            UUID withdrawalId,
            String payload,
            Instant createdAt) {
        return NotificationOutboxEntry.builder()
                .type(type)
                .audience(audience)
                .userId(userId)
                .withdrawalId(withdrawalId)
                .payload(payload)
                .createdAt(createdAt)
                .build();
    }
}
