package lending.settlement.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lending.settlement.domain.job.SettlementJob;
import lending.settlement.domain.job.SettlementJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementQueue {

    private final SettlementJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public UUID enqueue(String jobName, Object payload, JobOptions options) {
        Instant now = clock.instant();
        SettlementJob job = jobRepository.save(SettlementJob.waiting(
                jobName,
                serialize(jobName, payload),
                options.priority(),
                now.plus(options.delay()),
                options.attempts(),
                options.backoff().type(),
                options.backoff().delay().toMillis(),
                now
        ));
        log.info(
                "event=settlement_queue.enqueued jobId={} jobName={} priority={} runAt={} maxAttempts={}",
                job.getId(),
                jobName,
                job.getPriority(),
                job.getRunAt(),
                job.getMaxAttempts()
        );
        return job.getId();
    }

    private String serialize(String jobName, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payload for job " + jobName, e);
        }
    }
}
