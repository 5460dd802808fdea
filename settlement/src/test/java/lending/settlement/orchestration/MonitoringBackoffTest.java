package lending.settlement.orchestration;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MonitoringBackoffTest {

    @Test
    void delay_growsByHalfAndCapsAtTenMinutes() {
        assertThat(MonitoringBackoff.delayFor(1)).isEqualTo(Duration.ofMinutes(2));
        assertThat(MonitoringBackoff.delayFor(2)).isEqualTo(Duration.ofMinutes(3));
        assertThat(MonitoringBackoff.delayFor(3)).isEqualTo(Duration.ofMillis(270_000));
        assertThat(MonitoringBackoff.delayFor(5)).isEqualTo(Duration.ofMinutes(10));
        assertThat(MonitoringBackoff.delayFor(20)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void pending_reschedulesUpToAttemptTwentyOne() {
        assertThat(MonitoringBackoff.afterPending(1)).contains(new MonitoringBackoff.Step(2, Duration.ofMinutes(3)));
        assertThat(MonitoringBackoff.afterPending(20)).isPresent();
        assertThat(MonitoringBackoff.afterPending(21)).isEmpty();
    }

    @Test
    void queryError_stopsAtAttemptTwenty() {
        assertThat(MonitoringBackoff.afterError(19)).contains(new MonitoringBackoff.Step(20, Duration.ofMinutes(10)));
        assertThat(MonitoringBackoff.afterError(20)).isEmpty();
    }
}
