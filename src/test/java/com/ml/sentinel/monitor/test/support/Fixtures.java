package com.ml.sentinel.monitor.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ml.sentinel.monitor.config.CustomConfig;
import com.ml.sentinel.monitor.dto.Signal;
import com.ml.sentinel.monitor.service.client.RetryableFailurePredicate;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private Fixtures() {
    }

    public static ObjectMapper mapper() {
        return new CustomConfig().mapper();
    }

    /**
     * RestTemplate wired like the application's: snake_case JSON.
     */
    public static RestTemplate restTemplate() {
        return new RestTemplate(List.<HttpMessageConverter<?>>of(
                new StringHttpMessageConverter(),
                new MappingJackson2HttpMessageConverter(mapper())));
    }

    public static RetryRegistry retries(int maxAttempts) {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(new RetryableFailurePredicate())
                .build());
    }

    public static Signal signal(double accuracy, double drift, int samples) {
        return new Signal(T0, true, accuracy, drift, samples);
    }
}
