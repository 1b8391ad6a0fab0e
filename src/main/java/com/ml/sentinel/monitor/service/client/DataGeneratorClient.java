package com.ml.sentinel.monitor.service.client;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.model.generator.GenerateRequest;
import com.ml.sentinel.monitor.model.generator.GenerateResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * Requests a fresh labeled dataset. Part of a retrain attempt, so not retried.
 */
@Slf4j
@Service
public class DataGeneratorClient {

    private final RestTemplate generatorTemplate;
    private final SentinelProperties props;

    public DataGeneratorClient(@Qualifier("generatorTemplate") RestTemplate generatorTemplate,
                               SentinelProperties props) {
        this.generatorTemplate = generatorTemplate;
        this.props = props;
    }

    public Result<GenerateResponse> generate(int samples) {
        String url = RemoteCalls.url(props.getEndpoints().getGeneratorUrl(), "/generate");
        try {
            GenerateResponse body = RemoteCalls.exchange("generate",
                    () -> generatorTemplate.postForEntity(url, new GenerateRequest(samples), GenerateResponse.class));
            if (body.datasetRef() == null) {
                return Result.fail(SentinelConsts.ERR_BAD_RESPONSE, "generate answered without a generation id");
            }
            log.info("Generated dataset {} ({} samples)", body.getGenerationId(), body.getSamplesCreated());
            return Result.ok(body);
        } catch (TransientIOException e) {
            log.warn("Dataset generation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return Result.fail(e.getErrorCode(), e);
        }
    }
}
