package lending.settlement.notification;

// Delivery (email, push, admin console) happens downstream; the settlement core only enqueues.
public interface NotificationQueue {

    void enqueue(Notification notification);
}
