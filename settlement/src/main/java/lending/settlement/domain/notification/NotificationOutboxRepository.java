package lending.settlement.domain.notification;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface NotificationOutboxRepository extends JpaRepository<NotificationOutboxEntry, UUID> {

    List<NotificationOutboxEntry> findByWithdrawalIdOrderByCreatedAtAsc(UUID withdrawalId);
}
