package com.ml.sentinel.monitor.service.tracker;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.RunRecord;
import com.ml.sentinel.monitor.model.mlflow.MlflowRequests;
import com.ml.sentinel.monitor.model.mlflow.MlflowResponses;
import com.ml.sentinel.monitor.service.client.RemoteCalls;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logs run records through the MLflow tracking REST API: one MLflow run per
 * retraining attempt, with params, metrics and a terminal status.
 */
@Slf4j
@Service
public class MlflowExperimentTracker implements ExperimentTracker {

    private static final String API = "/api/2.0/mlflow";

    private final RestTemplate trackerTemplate;
    private final SentinelProperties props;
    private final Retry retry;
    private final AtomicReference<String> experimentId = new AtomicReference<>();

    public MlflowExperimentTracker(@Qualifier("trackerTemplate") RestTemplate trackerTemplate,
                                   SentinelProperties props,
                                   RetryRegistry retryRegistry) {
        this.trackerTemplate = trackerTemplate;
        this.props = props;
        this.retry = retryRegistry.retry("tracker");
    }

    @Override
    public Result<String> logRun(RunRecord record) {
        try {
            String expId = resolveExperimentId();
            long start = record.timestamp().toEpochMilli();
            long end = start + (record.duration() == null ? 0L : record.duration().toMillis());

            MlflowRequests.CreateRun create = new MlflowRequests.CreateRun(
                    expId,
                    "retrain-" + record.triggerReason().key() + "-" + shortId(record.runId()),
                    start,
                    List.of(new MlflowRequests.KeyValue("sentinel.run_id", record.runId()),
                            new MlflowRequests.KeyValue("sentinel.outcome", record.outcome().name())));
            MlflowResponses.CreateRun created = post("runs/create", create, MlflowResponses.CreateRun.class);
            if (created.getRun() == null || created.getRun().getInfo() == null) {
                return Result.fail(SentinelConsts.ERR_BAD_RESPONSE, "runs/create answered without run info");
            }
            String mlflowRunId = created.getRun().getInfo().getRunId();

            post("runs/log-batch", new MlflowRequests.LogBatch(mlflowRunId, params(record), metrics(record, end)), Object.class);
            post("runs/update", new MlflowRequests.UpdateRun(mlflowRunId, terminalStatus(record), end), Object.class);

            log.info("Logged run {} to tracker as {}", record.runId(), mlflowRunId);
            return Result.ok(mlflowRunId);
        } catch (TransientIOException e) {
            log.warn("Tracker logging failed for run {} [{}]: {}", record.runId(), e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e);
        }
    }

    private String resolveExperimentId() {
        String cached = experimentId.get();
        if (cached != null) return cached;

        String name = props.getEndpoints().getExperimentName();
        URI url = UriComponentsBuilder.fromHttpUrl(props.getEndpoints().getTrackerUrl())
                .path(API + "/experiments/get-by-name")
                .queryParam("experiment_name", name)
                .encode()
                .build()
                .toUri();
        String id;
        try {
            MlflowResponses.GetExperiment found = retry.executeSupplier(() -> RemoteCalls.exchange(
                    "tracker get-by-name", () -> trackerTemplate.getForEntity(url, MlflowResponses.GetExperiment.class)));
            id = found.getExperiment() == null ? null : found.getExperiment().getExperimentId();
        } catch (TransientIOException e) {
            if (e.getHttpStatus() != 404) throw e;
            id = null;
        }
        if (id == null) {
            MlflowResponses.CreateExperiment createdExp = post("experiments/create",
                    new MlflowRequests.CreateExperiment(name), MlflowResponses.CreateExperiment.class);
            id = createdExp.getExperimentId();
            log.info("Created tracker experiment '{}' ({})", name, id);
        }
        experimentId.compareAndSet(null, id);
        return experimentId.get();
    }

    private <T> T post(String path, Object body, Class<T> type) {
        String url = RemoteCalls.url(props.getEndpoints().getTrackerUrl(), API + "/" + path);
        return retry.executeSupplier(() ->
                RemoteCalls.exchange("tracker " + path, () -> trackerTemplate.postForEntity(url, body, type)));
    }

    private static List<MlflowRequests.KeyValue> params(RunRecord r) {
        List<MlflowRequests.KeyValue> out = new ArrayList<>();
        out.add(new MlflowRequests.KeyValue("trigger_reason", r.triggerReason().key()));
        out.add(new MlflowRequests.KeyValue("training_samples", String.valueOf(r.trainingSamples())));
        if (r.datasetRef() != null) out.add(new MlflowRequests.KeyValue("dataset_ref", r.datasetRef()));
        if (r.modelVersion() != null) out.add(new MlflowRequests.KeyValue("model_version", r.modelVersion()));
        return out;
    }

    private static List<MlflowRequests.Metric> metrics(RunRecord r, long at) {
        List<MlflowRequests.Metric> out = new ArrayList<>();
        if (r.preAccuracy() != null) {
            out.add(new MlflowRequests.Metric("pre_accuracy", r.preAccuracy(), at, 0));
        }
        if (r.postAccuracy() != null) {
            out.add(new MlflowRequests.Metric("post_accuracy", r.postAccuracy(), at, 0));
        }
        if (r.duration() != null) {
            out.add(new MlflowRequests.Metric("duration_seconds", r.duration().toMillis() / 1000.0, at, 0));
        }
        return out;
    }

    private static String terminalStatus(RunRecord r) {
        switch (r.outcome()) {
            case SUCCESS:
                return "FINISHED";
            case FAILED:
                return "FAILED";
            default:
                return "KILLED";
        }
    }

    private static String shortId(String runId) {
        return runId == null || runId.length() <= 8 ? String.valueOf(runId) : runId.substring(0, 8);
    }
}
