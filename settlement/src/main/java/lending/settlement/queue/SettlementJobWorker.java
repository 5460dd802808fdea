package lending.settlement.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lending.settlement.common.CorrelationIdFilter;
import lending.settlement.config.SettlementProperties;
import lending.settlement.domain.job.SettlementJob;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "settlement.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SettlementJobWorker {

    public static final String MDC_JOB_ID_KEY = "jobId";
    public static final String MDC_JOB_NAME_KEY = "jobName";

    private final SettlementJobService jobService;
    private final ObjectMapper objectMapper;
    private final Map<String, JobHandler<?>> handlersByName;
    private final int batchSize;
    private final SettlementProperties.Worker settings;
    private final ExecutorService executor;
    // bounds in-flight jobs so the poller never claims more than the pool can run
    private final Semaphore slots;

    public SettlementJobWorker(
            SettlementJobService jobService,
            ObjectMapper objectMapper,
            List<JobHandler<?>> handlers,
            SettlementProperties properties
    ) {
        this.jobService = jobService;
        this.objectMapper = objectMapper;
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::jobName,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple handlers found for job: " + left.jobName());
                        }
                ));
        this.settings = properties.getWorker();
        this.batchSize = settings.getBatchSize();
        this.executor = Executors.newFixedThreadPool(settings.getConcurrency());
        this.slots = new Semaphore(settings.getConcurrency());
    }

    @Scheduled(fixedDelayString = "${settlement.worker.poll-interval-ms:1000}")
    public void poll() {
        int capacity = Math.min(batchSize, slots.availablePermits());
        if (capacity <= 0) {
            return;
        }
        for (UUID jobId : jobService.findDue(capacity)) {
            if (!slots.tryAcquire()) {
                return;
            }
            Optional<SettlementJob> claimed = jobService.claim(jobId);
            if (claimed.isEmpty()) {
                slots.release();
                log.debug("event=settlement_worker.claim_lost jobId={}", jobId);
                continue;
            }
            SettlementJob job = claimed.get();
            executor.submit(() -> {
                try {
                    runClaimed(job);
                } finally {
                    slots.release();
                }
            });
        }
    }

    @Scheduled(fixedDelayString = "${settlement.worker.recovery-interval-ms:60000}")
    public void recoverExpiredLeases() {
        int released = jobService.releaseExpiredLeases(settings.getLeaseTimeout());
        if (released > 0) {
            log.warn("event=settlement_worker.leases_released count={} leaseTimeout={}", released, settings.getLeaseTimeout());
        }
    }

    // The lease may have been released while the handler ran; the job row then rejects complete/recordFailure.
    void runClaimed(SettlementJob job) {
        try {
            run(job);
        } catch (RuntimeException e) {
            log.error(
                    "event=settlement_worker.job.bookkeeping_failed jobId={} jobName={} error={}",
                    job.getId(),
                    job.getJobName(),
                    e.getMessage(),
                    e
            );
        }
    }

    void run(SettlementJob job) {
        MDC.put(MDC_JOB_ID_KEY, job.getId().toString());
        MDC.put(MDC_JOB_NAME_KEY, job.getJobName());
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID_KEY, "job-" + job.getId());
        try {
            log.info(
                    "event=settlement_worker.job.start jobId={} jobName={} attempt={} maxAttempts={}",
                    job.getId(),
                    job.getJobName(),
                    job.getAttemptsMade(),
                    job.getMaxAttempts()
            );
            JobHandler<?> handler = handlersByName.get(job.getJobName());
            if (handler == null) {
                throw new IllegalStateException("No handler registered for job: " + job.getJobName());
            }
            JobResult result = dispatch(handler, job);
            jobService.complete(job.getId());
            log.info(
                    "event=settlement_worker.job.done jobId={} jobName={} outcome={} detail={}",
                    job.getId(),
                    job.getJobName(),
                    result == null ? null : result.outcome(),
                    result == null ? null : result.detail()
            );
        } catch (RuntimeException e) {
            log.error(
                    "event=settlement_worker.job.error jobId={} jobName={} attempt={} error={}",
                    job.getId(),
                    job.getJobName(),
                    job.getAttemptsMade(),
                    e.getMessage(),
                    e
            );
            jobService.recordFailure(job.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MDC.remove(MDC_JOB_ID_KEY);
            MDC.remove(MDC_JOB_NAME_KEY);
            MDC.remove(CorrelationIdFilter.MDC_CORRELATION_ID_KEY);
        }
    }

    private <T> JobResult dispatch(JobHandler<T> handler, SettlementJob job) {
        T payload;
        try {
            payload = objectMapper.readValue(job.getPayload(), handler.payloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable payload for job " + job.getId(), e);
        }
        return handler.handle(payload, new JobContext(job.getId(), job.getAttemptsMade(), job.getMaxAttempts()));
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("event=settlement_worker.shutdown.timeout");
            executor.shutdownNow();
        }
    }
}
