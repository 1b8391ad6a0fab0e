package com.ml.sentinel.monitor.service.client;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.enums.ApiStatus;
import com.ml.sentinel.monitor.model.serving.HealthResponse;
import com.ml.sentinel.monitor.model.serving.PredictRequest;
import com.ml.sentinel.monitor.model.serving.PredictResponse;
import com.ml.sentinel.monitor.model.serving.RetrainRequest;
import com.ml.sentinel.monitor.model.serving.RetrainResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Locale;

/**
 * Calls the model-serving API. Health and predict go through the short probe
 * timeout with bounded retries; retrain gets its own long timeout and is
 * never retried.
 */
@Slf4j
@Service
public class ServingApiClient {

    private final RestTemplate probeTemplate;
    private final RestTemplate retrainTemplate;
    private final SentinelProperties props;
    private final Retry healthRetry;
    private final Retry predictRetry;

    public ServingApiClient(@Qualifier("probeTemplate") RestTemplate probeTemplate,
                            @Qualifier("retrainTemplate") RestTemplate retrainTemplate,
                            SentinelProperties props,
                            RetryRegistry retryRegistry) {
        this.probeTemplate = probeTemplate;
        this.retrainTemplate = retrainTemplate;
        this.props = props;
        this.healthRetry = retryRegistry.retry("servingHealth");
        this.predictRetry = retryRegistry.retry("servingPredict");
    }

    public Result<ApiStatus> health() {
        String url = RemoteCalls.url(props.getEndpoints().getServingUrl(), "/health");
        try {
            HealthResponse body = healthRetry.executeSupplier(() ->
                    RemoteCalls.exchange("serving health", () -> probeTemplate.getForEntity(url, HealthResponse.class)));
            ApiStatus status = ApiStatus.parse(body.getStatus());
            if (status == ApiStatus.DEGRADED) {
                log.warn("Serving API reports degraded status (version={})", body.getVersion());
            }
            return Result.ok(status);
        } catch (TransientIOException e) {
            log.warn("Serving health check failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e);
        }
    }

    public Result<PredictResponse> predict(List<Double> features) {
        String url = RemoteCalls.url(props.getEndpoints().getServingUrl(), "/predict");
        PredictRequest request = new PredictRequest(features);
        try {
            PredictResponse body = predictRetry.executeSupplier(() ->
                    RemoteCalls.exchange("predict", () -> probeTemplate.postForEntity(url, request, PredictResponse.class)));
            if (body.getPrediction() == null) {
                return Result.fail(SentinelConsts.ERR_BAD_RESPONSE, "predict answered without a prediction");
            }
            return Result.ok(body);
        } catch (TransientIOException e) {
            log.debug("Predict call failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e);
        }
    }

    public Result<RetrainResponse> retrain(String datasetRef) {
        String url = RemoteCalls.url(props.getEndpoints().getServingUrl(), "/retrain");
        RetrainRequest request = new RetrainRequest(datasetRef);
        log.info("Requesting retrain on dataset {}", datasetRef);
        try {
            RetrainResponse body = RemoteCalls.exchange("retrain",
                    () -> retrainTemplate.postForEntity(url, request, RetrainResponse.class));
            if (body.getStatus() != null && !isAccepted(body.getStatus())) {
                return Result.fail(SentinelConsts.ERR_REJECTED, "retrain answered status " + body.getStatus());
            }
            log.info("Retrain finished: version={} accuracy={}", body.getModelVersion(), body.getAccuracy());
            return Result.ok(body);
        } catch (TransientIOException e) {
            log.warn("Retrain call failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e);
        }
    }

    private static boolean isAccepted(String status) {
        String s = status.trim().toLowerCase(Locale.ROOT);
        return s.equals("success") || s.equals("ok") || s.equals("completed");
    }
}
