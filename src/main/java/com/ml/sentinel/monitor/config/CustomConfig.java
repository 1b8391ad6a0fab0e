package com.ml.sentinel.monitor.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * One RestTemplate per collaborator so each call is bounded by its own timeout.
 */
@Configuration
public class CustomConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("probeTemplate")
    public RestTemplate probeTemplate(RestTemplateBuilder builder, SentinelProperties props) {
        return timed(builder, props.getTimeouts().getProbe());
    }

    @Bean
    @Qualifier("retrainTemplate")
    public RestTemplate retrainTemplate(RestTemplateBuilder builder, SentinelProperties props) {
        return timed(builder, props.getTimeouts().getRetrain());
    }

    @Bean
    @Qualifier("generatorTemplate")
    public RestTemplate generatorTemplate(RestTemplateBuilder builder, SentinelProperties props) {
        return timed(builder, props.getTimeouts().getGenerator());
    }

    @Bean
    @Qualifier("trackerTemplate")
    public RestTemplate trackerTemplate(RestTemplateBuilder builder, SentinelProperties props) {
        return timed(builder, props.getTimeouts().getTracker());
    }

    @Bean
    @Qualifier("alertTemplate")
    public RestTemplate alertTemplate(RestTemplateBuilder builder, SentinelProperties props) {
        return timed(builder, props.getTimeouts().getAlert());
    }

    private static RestTemplate timed(RestTemplateBuilder builder, Duration timeout) {
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    @Primary
    public ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        // serving API, generator and tracker all speak snake_case
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);
        return mapper;
    }
}
