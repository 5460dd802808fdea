package lending.settlement.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import lending.settlement.config.SettlementProperties;
import lending.settlement.domain.job.SettlementJob;
import lending.settlement.domain.job.SettlementJobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementJobWorkerTest {

    record Ping(String value) {}

    static class PingHandler implements JobHandler<Ping> {
        final List<Ping> received = new ArrayList<>();
        final List<JobContext> contexts = new ArrayList<>();
        RuntimeException failure;

        @Override
        public String jobName() {
            return "ping";
        }

        @Override
        public Class<Ping> payloadType() {
            return Ping.class;
        }

        @Override
        public JobResult handle(Ping payload, JobContext context) {
            received.add(payload);
            contexts.add(context);
            if (failure != null) {
                throw failure;
            }
            return JobResult.of(JobOutcome.SENT, "pong");
        }
    }

    @Mock SettlementJobService jobService;

    private final PingHandler handler = new PingHandler();
    private SettlementJobWorker worker;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (worker != null) {
            worker.shutdown();
        }
    }

    @Test
    void run_dispatchesPayloadAndCompletesJob() {
        worker = newWorker(List.of(handler));
        SettlementJob job = job("ping", "{\"value\":\"hello\"}", 2, 5);

        worker.run(job);

        assertThat(handler.received).containsExactly(new Ping("hello"));
        assertThat(handler.contexts.get(0).attempt()).isEqualTo(2);
        assertThat(handler.contexts.get(0).maxAttempts()).isEqualTo(5);
        verify(jobService).complete(job.getId());
        verify(jobService, never()).recordFailure(any(), any());
    }

    @Test
    void run_recordsFailureWhenHandlerThrows() {
        handler.failure = new IllegalStateException("node unreachable");
        worker = newWorker(List.of(handler));
        SettlementJob job = job("ping", "{\"value\":\"hello\"}", 1, 5);

        worker.run(job);

        verify(jobService).recordFailure(job.getId(), "IllegalStateException: node unreachable");
        verify(jobService, never()).complete(any());
    }

    @Test
    void run_recordsFailureForUnknownJob() {
        worker = newWorker(List.of(handler));
        SettlementJob job = job("unknown", "{}", 1, 1);

        worker.run(job);

        verify(jobService).recordFailure(eq(job.getId()), startsWith("IllegalStateException: No handler registered"));
    }

    @Test
    void run_recordsFailureForUnreadablePayload() {
        worker = newWorker(List.of(handler));
        SettlementJob job = job("ping", "not-json", 1, 3);

        worker.run(job);

        assertThat(handler.received).isEmpty();
        verify(jobService).recordFailure(eq(job.getId()), startsWith("IllegalStateException: Unreadable payload"));
    }

    @Test
    void runClaimed_logsBookkeepingFailureOfReleasedLease() {
        worker = newWorker(List.of(handler));
        SettlementJob job = job("ping", "{\"value\":\"hello\"}", 1, 5);
        doThrow(new IllegalStateException("job " + job.getId() + " is not active: WAITING"))
                .when(jobService).complete(job.getId());
        doThrow(new IllegalStateException("job " + job.getId() + " is not active: WAITING"))
                .when(jobService).recordFailure(eq(job.getId()), any());

        assertThatCode(() -> worker.runClaimed(job)).doesNotThrowAnyException();

        assertThat(handler.received).containsExactly(new Ping("hello"));
        verify(jobService).complete(job.getId());
        verify(jobService).recordFailure(eq(job.getId()), startsWith("IllegalStateException: job "));
    }

    @Test
    void poll_skipsJobsClaimedByAnotherWorker() {
        worker = newWorker(List.of(handler));
        UUID jobId = UUID.randomUUID();
        when(jobService.findDue(10)).thenReturn(List.of(jobId));
        when(jobService.claim(jobId)).thenReturn(Optional.empty());

        worker.poll();

        assertThat(handler.received).isEmpty();
        verify(jobService, never()).complete(any());
    }

    @Test
    void duplicateHandlers_areRejected() {
        assertThatThrownBy(() -> newWorker(List.of(handler, new PingHandler())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Multiple handlers found for job: ping");
    }

    private SettlementJobWorker newWorker(List<JobHandler<?>> handlers) {
        return new SettlementJobWorker(jobService, new ObjectMapper(), handlers, new SettlementProperties());
    }

    private static SettlementJob job(String name, String payload, int attemptsMade, int maxAttempts) {
        return SettlementJob.builder()
                .id(UUID.randomUUID())
                .jobName(name)
                .payload(payload)
                .state(SettlementJobState.ACTIVE)
                .attemptsMade(attemptsMade)
                .maxAttempts(maxAttempts)
                .runAt(Instant.parse("2026-03-01T10:00:00Z"))
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
