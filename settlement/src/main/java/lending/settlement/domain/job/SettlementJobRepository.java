package lending.settlement.domain.job;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface SettlementJobRepository extends JpaRepository<SettlementJob, UUID> {

    @Query("""
            select j.id from SettlementJob j
            where j.state = :state and j.runAt <= :now
            order by j.priority asc, j.runAt asc
            """)
    List<UUID> findDueIds(@Param("state") SettlementJobState state, @Param("now") Instant now, Pageable pageable);

    // Conditional update: only one worker can move a WAITING row to ACTIVE.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update SettlementJob j
            set j.state = :active,
                j.attemptsMade = j.attemptsMade + 1,
                j.leasedAt = :now,
                j.version = j.version + 1
            where j.id = :id and j.state = :waiting
            """)
    int claim(
            @Param("id") UUID id,
            @Param("now") Instant now,
            @Param("waiting") SettlementJobState waiting,
            @Param("active") SettlementJobState active
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update SettlementJob j
            set j.state = :waiting,
                j.leasedAt = null,
                j.runAt = :now,
                j.version = j.version + 1
            where j.state = :active and j.leasedAt < :leaseExpiredBefore
            """)
    int releaseExpiredLeases(
            @Param("leaseExpiredBefore") Instant leaseExpiredBefore,
            @Param("now") Instant now,
            @Param("active") SettlementJobState active,
            @Param("waiting") SettlementJobState waiting
    );

    List<SettlementJob> findByJobNameOrderByCreatedAtAsc(String jobName);
}
