package lending.settlement.domain.job;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "settlement_jobs", indexes = {
        @Index(name = "idx_settlement_job_due", columnList = "state, priority, runAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class SettlementJob {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false, length = 64)
    private String jobName;

    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    // lower value runs first
    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    private Instant runAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SettlementJobState state;

    @Column(nullable = false)
    private int attemptsMade;

    @Column(nullable = false)
    private int maxAttempts;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private BackoffType backoffType;

    private Long backoffDelayMs;

    @Column(length = MAX_ERROR_LENGTH)
    private String lastError;

    private Instant leasedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant finishedAt;

    public static SettlementJob waiting(
            String jobName,
            String payload,
            int priority,
            Instant runAt,
            int maxAttempts,
            BackoffType backoffType,
            Long backoffDelayMs,
            Instant createdAt) {
        return SettlementJob.builder()
                .jobName(jobName)
                .payload(payload)
                .priority(priority)
                .runAt(runAt)
                .state(SettlementJobState.WAITING)
                .attemptsMade(0)
                .maxAttempts(Math.max(1, maxAttempts))
                .backoffType(backoffType)
                .backoffDelayMs(backoffDelayMs)
                .createdAt(createdAt)
                .build();
    }

    public boolean hasAttemptsLeft() {
        return attemptsMade < maxAttempts;
    }

    public void complete(Instant at) {
        requireActive();
        this.state = SettlementJobState.COMPLETED;
        this.leasedAt = null;
        this.finishedAt = at;
    }

    public void retryAt(Instant nextRunAt, String error) {
        requireActive();
        this.state = SettlementJobState.WAITING;
        this.runAt = nextRunAt;
        this.leasedAt = null;
        this.lastError = truncate(error);
    }

    public void fail(Instant at, String error) {
        requireActive();
        this.state = SettlementJobState.FAILED;
        this.leasedAt = null;
        this.finishedAt = at;
        this.lastError = truncate(error);
    }

    private void requireActive() {
        if (state != SettlementJobState.ACTIVE) {
            throw new IllegalStateException("job " + id + " is not active: " + state);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
