package lending.settlement.queue;

import lending.settlement.domain.job.SettlementJob;
import lending.settlement.domain.job.SettlementJobRepository;
import lending.settlement.domain.job.SettlementJobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

// Job state transitions, each in its own transaction so a worker never holds a lock while a handler runs.
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementJobService {

    private final SettlementJobRepository jobRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<UUID> findDue(int limit) {
        return jobRepository.findDueIds(SettlementJobState.WAITING, clock.instant(), PageRequest.of(0, limit));
    }

    // Empty when another worker won the claim.
    @Transactional
    public Optional<SettlementJob> claim(UUID jobId) {
        int updated = jobRepository.claim(jobId, clock.instant(), SettlementJobState.WAITING, SettlementJobState.ACTIVE);
        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Transactional
    public void complete(UUID jobId) {
        SettlementJob job = load(jobId);
        job.complete(clock.instant());
        jobRepository.save(job);
    }

    @Transactional
    public void recordFailure(UUID jobId, String error) {
        SettlementJob job = load(jobId);
        Instant now = clock.instant();
        if (job.hasAttemptsLeft()) {
            Duration delay = backoffOf(job).delayAfter(job.getAttemptsMade());
            job.retryAt(now.plus(delay), error);
            log.warn(
                    "event=settlement_job.retry_scheduled jobId={} jobName={} attemptsMade={} maxAttempts={} delayMs={}",
                    jobId,
                    job.getJobName(),
                    job.getAttemptsMade(),
                    job.getMaxAttempts(),
                    delay.toMillis()
            );
        } else {
            job.fail(now, error);
            log.error(
                    "event=settlement_job.failed jobId={} jobName={} attemptsMade={} error={}",
                    jobId,
                    job.getJobName(),
                    job.getAttemptsMade(),
                    error
            );
        }
        jobRepository.save(job);
    }

    @Transactional
    public int releaseExpiredLeases(Duration leaseTimeout) {
        Instant now = clock.instant();
        return jobRepository.releaseExpiredLeases(
                now.minus(leaseTimeout), now, SettlementJobState.ACTIVE, SettlementJobState.WAITING);
    }

    private static Backoff backoffOf(SettlementJob job) {
        if (job.getBackoffType() == null || job.getBackoffDelayMs() == null) {
            return Backoff.NONE;
        }
        return new Backoff(job.getBackoffType(), Duration.ofMillis(job.getBackoffDelayMs()));
    }

    private SettlementJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("settlement job not found: " + jobId));
    }
}
