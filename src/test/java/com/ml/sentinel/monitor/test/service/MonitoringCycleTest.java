package com.ml.sentinel.monitor.test.service;

import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.AlertEvent;
import com.ml.sentinel.monitor.dto.RetrainDecision;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.dto.Thresholds;
import com.ml.sentinel.monitor.dto.TickReport;
import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.AlertSeverity;
import com.ml.sentinel.monitor.enums.RetrainReason;
import com.ml.sentinel.monitor.enums.RunOutcome;
import com.ml.sentinel.monitor.enums.Verdict;
import com.ml.sentinel.monitor.service.alert.AlertDispatcher;
import com.ml.sentinel.monitor.service.evaluator.DriftEvaluator;
import com.ml.sentinel.monitor.service.monitor.MonitoringCycle;
import com.ml.sentinel.monitor.service.probe.MetricProbe;
import com.ml.sentinel.monitor.service.retrain.RetrainCoordinator;
import com.ml.sentinel.monitor.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.ml.sentinel.monitor.test.support.Fixtures.T0;
import static com.ml.sentinel.monitor.test.support.Fixtures.signal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitoringCycleTest {

    private MetricProbe probe;
    private RetrainCoordinator coordinator;
    private AlertDispatcher dispatcher;
    private MonitoringCycle cycle;

    @BeforeEach
    void setUp() {
        probe = mock(MetricProbe.class);
        coordinator = mock(RetrainCoordinator.class);
        dispatcher = mock(AlertDispatcher.class);
        SentinelProperties props = new SentinelProperties();
        props.getSchedule().setFailureAlertAfter(3);
        props.getSchedule().setStatusReportEvery(2);

        when(coordinator.handle(any(), any())).thenReturn(Optional.empty());
        when(coordinator.lastDecision()).thenReturn(RetrainDecision.NO_ACTION);
        when(dispatcher.dispatch(any())).thenReturn(true);

        cycle = new MonitoringCycle(probe, new DriftEvaluator(Thresholds.DEFAULTS), coordinator, dispatcher,
                props, new MutableClock(T0));
    }

    private List<AlertEvent> dispatched(int times) {
        ArgumentCaptor<AlertEvent> captor = ArgumentCaptor.forClass(AlertEvent.class);
        verify(dispatcher, times(times)).dispatch(captor.capture());
        return captor.getAllValues();
    }

    @Test
    void probeCrashDoesNotEscapeTheTick() {
        when(probe.sample()).thenThrow(new IllegalStateException("probe bug"));

        TickReport report = cycle.runTick();

        assertThat(report.verdict()).isEqualTo(Verdict.UNKNOWN);
        assertThat(report.failed()).isTrue();
        assertThat(report.signal().apiHealthy()).isFalse();
        verify(coordinator).handle(Verdict.UNKNOWN, report.signal());
    }

    @Test
    void coordinatorCrashDoesNotEscapeTheTick() {
        when(probe.sample()).thenReturn(signal(0.6, 0.1, 50));
        when(coordinator.handle(any(), any())).thenThrow(new IllegalStateException("coordinator bug"));

        TickReport report = cycle.runTick();

        assertThat(report.verdict()).isEqualTo(Verdict.DEGRADED);
        assertThat(report.record()).isNull();
        assertThat(report.failed()).isTrue();
        assertThat(cycle.tickCount()).isEqualTo(1);
    }

    @Test
    void persistentFailureRaisesOneLowSeverityAlertAfterThreshold() {
        when(probe.sample()).thenReturn(Signal.unreachable(T0));

        cycle.runTick();
        cycle.runTick();
        verify(dispatcher, never()).dispatch(any());

        cycle.runTick();
        List<AlertEvent> events = dispatched(1);
        assertThat(events.get(0).category()).isEqualTo(AlertCategory.HEALTH);
        assertThat(events.get(0).severity()).isEqualTo(AlertSeverity.INFO);
        assertThat(events.get(0).message()).contains("Consecutive failed ticks: 3");
        assertThat(cycle.consecutiveFailures()).isEqualTo(3);
    }

    @Test
    void recoveryResetsTheFailureStreak() {
        when(probe.sample()).thenReturn(Signal.unreachable(T0), Signal.unreachable(T0),
                signal(0.95, 0.1, 50), Signal.unreachable(T0));

        for (int i = 0; i < 4; i++) {
            cycle.runTick();
        }

        assertThat(cycle.consecutiveFailures()).isEqualTo(1);
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void retrainRecordIsAnnounced() {
        RunRecord record = RunRecord.builder()
                .runId("r1")
                .triggerReason(RetrainReason.DRIFT)
                .preAccuracy(0.95)
                .postAccuracy(0.93)
                .duration(Duration.ofSeconds(4))
                .timestamp(T0)
                .outcome(RunOutcome.SUCCESS)
                .modelVersion("v2")
                .build();
        when(probe.sample()).thenReturn(signal(0.95, 0.9, 50));
        when(coordinator.handle(any(), any())).thenReturn(Optional.of(record));

        TickReport report = cycle.runTick();

        assertThat(report.verdict()).isEqualTo(Verdict.DRIFTED);
        assertThat(report.record()).isSameAs(record);
        assertThat(report.alertSent()).isTrue();
        assertThat(report.failed()).isFalse();
        AlertEvent event = dispatched(1).get(0);
        assertThat(event.category()).isEqualTo(AlertCategory.DRIFT);
        assertThat(event.message()).contains("v2");
    }

    @Test
    void failedRetrainCountsTowardsTheStreak() {
        RunRecord failed = RunRecord.builder()
                .runId("r1")
                .triggerReason(RetrainReason.DEGRADATION)
                .timestamp(T0)
                .outcome(RunOutcome.FAILED)
                .error("retrain failed [HTTP_5XX]")
                .build();
        when(probe.sample()).thenReturn(signal(0.6, 0.1, 50));
        when(coordinator.handle(any(), any())).thenReturn(Optional.of(failed));

        TickReport report = cycle.runTick();

        assertThat(report.failed()).isTrue();
        assertThat(cycle.consecutiveFailures()).isEqualTo(1);
        assertThat(dispatched(1).get(0).severity()).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    void suppressedRetrainStillNotifies() {
        when(probe.sample()).thenReturn(signal(0.6, 0.1, 50));
        when(coordinator.lastDecision()).thenReturn(RetrainDecision.suppressed(RetrainReason.DEGRADATION));

        TickReport report = cycle.runTick();

        assertThat(report.record()).isNull();
        AlertEvent event = dispatched(1).get(0);
        assertThat(event.category()).isEqualTo(AlertCategory.DEGRADATION);
        assertThat(event.severity()).isEqualTo(AlertSeverity.INFO);
        assertThat(event.message()).contains("suppressed");
    }

    @Test
    void healthyTicksProduceAPeriodicStatusReport() {
        when(probe.sample()).thenReturn(signal(0.95, 0.1, 50));

        cycle.runTick();
        verify(dispatcher, never()).dispatch(any());
        TickReport second = cycle.runTick();

        assertThat(second.verdict()).isEqualTo(Verdict.HEALTHY);
        AlertEvent event = dispatched(1).get(0);
        assertThat(event.category()).isEqualTo(AlertCategory.INFO);
        assertThat(event.message()).contains("healthy for 2 consecutive checks");
        assertThat(cycle.lastReport()).isSameAs(second);
    }

    @Test
    void dispatcherCrashIsContained() {
        when(probe.sample()).thenReturn(signal(0.6, 0.1, 50));
        when(dispatcher.dispatch(any())).thenThrow(new IllegalStateException("dispatcher bug"));

        TickReport report = cycle.runTick();

        assertThat(report.alertSent()).isFalse();
        assertThat(report.failed()).isTrue();
    }
}
