package com.ml.sentinel.monitor.service.retrain;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.common.exception.ConcurrencyConflictException;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.core.CooldownState;
import com.ml.sentinel.monitor.dto.ModelRetrainedEvent;
import com.ml.sentinel.monitor.dto.RetrainDecision;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.enums.RetrainReason;
import com.ml.sentinel.monitor.enums.RunOutcome;
import com.ml.sentinel.monitor.enums.Verdict;
import com.ml.sentinel.monitor.model.generator.GenerateResponse;
import com.ml.sentinel.monitor.model.serving.RetrainResponse;
import com.ml.sentinel.monitor.service.client.DataGeneratorClient;
import com.ml.sentinel.monitor.service.client.ServingApiClient;
import com.ml.sentinel.monitor.service.tracker.ExperimentTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a verdict into at most one retraining attempt per cooldown window
 * and reason, with at most one attempt in flight at any time.
 * <p>
 * An attempt is never retried: it either completes or is recorded as failed.
 * Failed attempts still start the cooldown so a broken backend is not
 * hammered every tick.
 */
@Slf4j
@Service
public class RetrainCoordinator {

    private final DataGeneratorClient generator;
    private final ServingApiClient serving;
    private final ExperimentTracker tracker;
    private final CooldownState cooldown;
    private final RetrainLock lock;
    private final ApplicationEventPublisher events;
    private final SentinelProperties props;
    private final Clock clock;

    private volatile Signal latestReliableSignal;
    private volatile RetrainDecision lastDecision = RetrainDecision.NO_ACTION;
    private volatile RunRecord lastRecord;

    public RetrainCoordinator(DataGeneratorClient generator,
                              ServingApiClient serving,
                              ExperimentTracker tracker,
                              CooldownState cooldown,
                              RetrainLock lock,
                              ApplicationEventPublisher events,
                              SentinelProperties props,
                              Clock clock) {
        this.generator = generator;
        this.serving = serving;
        this.tracker = tracker;
        this.cooldown = cooldown;
        this.lock = lock;
        this.events = events;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Pure policy step: verdict plus cooldown state, no side effects.
     */
    public RetrainDecision decide(Verdict verdict) {
        Optional<RetrainReason> reason = RetrainReason.fromVerdict(verdict);
        if (reason.isEmpty()) {
            return RetrainDecision.NO_ACTION;
        }
        String key = CooldownState.retrainKey(reason.get());
        if (cooldown.isCoolingDown(key, props.getCooldown().getRetrain(), clock.instant())) {
            return RetrainDecision.suppressed(reason.get());
        }
        return RetrainDecision.retrain(reason.get());
    }

    /**
     * @param signal the signal the verdict was derived from; supplies pre-retrain accuracy
     * @return the run record of an attempt made now, or empty when no attempt was made
     */
    public Optional<RunRecord> handle(Verdict verdict, Signal signal) {
        if (signal != null && signal.apiHealthy()) {
            latestReliableSignal = signal;
        }
        RetrainDecision decision = decide(verdict);
        lastDecision = decision;
        if (!decision.shouldRetrain()) {
            if (decision.reason() != RetrainReason.NONE) {
                Duration left = cooldown.remaining(CooldownState.retrainKey(decision.reason()),
                        props.getCooldown().getRetrain(), clock.instant());
                log.info("Retrain for {} suppressed by cooldown ({} left)", decision.reason().key(), left);
            }
            return Optional.empty();
        }

        String key = CooldownState.retrainKey(decision.reason());
        try (RetrainLock.Lease lease = lock.acquire("tick")) {
            // another attempt may have finished between decide() and the lease
            if (cooldown.isCoolingDown(key, props.getCooldown().getRetrain(), clock.instant())) {
                lastDecision = RetrainDecision.suppressed(decision.reason());
                log.info("Retrain for {} suppressed: cooldown started while waiting for the lease", decision.reason().key());
                return Optional.empty();
            }
            try {
                return Optional.of(attempt(decision.reason(), lease));
            } finally {
                cooldown.markTriggered(key, clock.instant());
            }
        } catch (ConcurrencyConflictException e) {
            log.info("Skipping {} retrain: {}", decision.reason().key(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Operator-requested retrain. Ignores and does not touch cooldowns, but
     * still respects the single-attempt lease.
     */
    public RunRecord requestManual() {
        try (RetrainLock.Lease lease = lock.acquire("manual")) {
            return attempt(RetrainReason.MANUAL, lease);
        } catch (ConcurrencyConflictException e) {
            log.info("Manual retrain skipped: {}", e.getMessage());
            return RunRecord.builder()
                    .runId(UUID.randomUUID().toString())
                    .triggerReason(RetrainReason.MANUAL)
                    .preAccuracy(preAccuracy())
                    .duration(Duration.ZERO)
                    .timestamp(clock.instant())
                    .outcome(RunOutcome.SKIPPED)
                    .error(e.getMessage())
                    .build();
        }
    }

    private RunRecord attempt(RetrainReason reason, RetrainLock.Lease lease) {
        Instant started = clock.instant();
        String runId = UUID.randomUUID().toString();
        Double pre = preAccuracy();
        log.info("Retrain attempt {} started (reason={}, preAccuracy={}, lease={})", runId, reason.key(), pre, lease.token());

        RunRecord.RunRecordBuilder builder = RunRecord.builder()
                .runId(runId)
                .triggerReason(reason)
                .preAccuracy(pre)
                .timestamp(started);

        RunRecord record;
        try {
            record = execute(builder);
        } catch (RuntimeException e) {
            log.error("Retrain attempt {} crashed: {}", runId, e.getMessage(), e);
            record = builder.outcome(RunOutcome.FAILED).error("unexpected: " + e).build();
        }
        record = record.toBuilder().duration(Duration.between(started, clock.instant())).build();

        try {
            Result<String> logged = tracker.logRun(record);
            logged.ifFailure(err -> log.warn("Run {} not recorded in tracker: {}", runId, err));
        } catch (RuntimeException e) {
            log.warn("Run {} not recorded in tracker: {}", runId, e.getMessage(), e);
        }

        lastRecord = record;
        if (record.isSuccess()) {
            log.info("Retrain {} succeeded: version={} accuracy {} -> {} in {}",
                    runId, record.modelVersion(), record.preAccuracy(), record.postAccuracy(), record.duration());
            events.publishEvent(new ModelRetrainedEvent(record));
        } else {
            log.warn("Retrain {} failed after {}: {}", runId, record.duration(), record.error());
        }
        return record;
    }

    private RunRecord execute(RunRecord.RunRecordBuilder builder) {
        Result<GenerateResponse> dataset = generator.generate(props.getRetrain().getSamples());
        if (dataset.isFailure()) {
            return builder.outcome(RunOutcome.FAILED)
                    .error("dataset generation failed [" + dataset.getErrorCode() + "]: " + dataset.getError())
                    .build();
        }
        GenerateResponse gen = dataset.get();
        builder.datasetRef(gen.datasetRef())
                .trainingSamples(gen.getSamplesCreated() == null ? 0 : gen.getSamplesCreated());

        Result<RetrainResponse> retrained = serving.retrain(gen.datasetRef());
        if (retrained.isFailure()) {
            return builder.outcome(RunOutcome.FAILED)
                    .error("retrain failed [" + retrained.getErrorCode() + "]: " + retrained.getError())
                    .build();
        }
        RetrainResponse body = retrained.get();
        if (body.getTrainingSamples() != null) {
            builder.trainingSamples(body.getTrainingSamples());
        }
        return builder.outcome(RunOutcome.SUCCESS)
                .postAccuracy(body.getAccuracy())
                .modelVersion(body.getModelVersion())
                .build();
    }

    private Double preAccuracy() {
        Signal s = latestReliableSignal;
        return s == null ? null : s.rollingAccuracy();
    }

    public RetrainDecision lastDecision() {
        return lastDecision;
    }

    public Optional<RunRecord> lastRecord() {
        return Optional.ofNullable(lastRecord);
    }

    public boolean isRetrainInProgress() {
        return lock.isHeld();
    }
}
