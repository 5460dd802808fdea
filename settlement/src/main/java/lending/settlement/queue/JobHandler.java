package lending.settlement.queue;

// A thrown exception consumes one attempt and is retried with the job's backoff.
public interface JobHandler<T> {

    String jobName();

    Class<T> payloadType();

    JobResult handle(T payload, JobContext context);
}
