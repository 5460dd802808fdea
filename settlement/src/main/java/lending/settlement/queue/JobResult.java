package lending.settlement.queue;

public record JobResult(JobOutcome outcome, String detail) {

    public static JobResult of(JobOutcome outcome, String detail) {
        return new JobResult(outcome, detail);
    }

    public static JobResult skipped(String reason) {
        return new JobResult(JobOutcome.SKIPPED, reason);
    }
}
