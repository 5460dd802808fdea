package lending.settlement.domain.notification;

public enum NotificationAudience {
    USER,
    ADMIN
}
