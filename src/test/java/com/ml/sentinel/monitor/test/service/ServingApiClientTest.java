package com.ml.sentinel.monitor.test.service;

import com.ml.sentinel.monitor.common.Result;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.enums.ApiStatus;
import com.ml.sentinel.monitor.model.generator.GenerateResponse;
import com.ml.sentinel.monitor.model.serving.PredictResponse;
import com.ml.sentinel.monitor.model.serving.RetrainResponse;
import com.ml.sentinel.monitor.service.client.DataGeneratorClient;
import com.ml.sentinel.monitor.service.client.ServingApiClient;
import com.ml.sentinel.monitor.test.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ServingApiClientTest {

    private static final String BASE = "http://serving.test";

    private MockRestServiceServer server;
    private ServingApiClient client;
    private DataGeneratorClient generator;

    @BeforeEach
    void setUp() {
        RestTemplate rest = Fixtures.restTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        SentinelProperties props = new SentinelProperties();
        props.getEndpoints().setServingUrl(BASE);
        props.getEndpoints().setGeneratorUrl(BASE);
        client = new ServingApiClient(rest, rest, props, Fixtures.retries(3));
        generator = new DataGeneratorClient(rest, props);
    }

    @Test
    void healthyStatusIsOk() {
        server.expect(requestTo(BASE + "/health"))
                .andRespond(withSuccess("{\"status\":\"healthy\",\"version\":\"1.0.0\"}", MediaType.APPLICATION_JSON));

        Result<ApiStatus> r = client.health();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).isEqualTo(ApiStatus.OK);
        server.verify();
    }

    @Test
    void serverErrorsAreRetried() {
        server.expect(requestTo(BASE + "/health")).andRespond(withServerError());
        server.expect(requestTo(BASE + "/health")).andRespond(withServerError());
        server.expect(requestTo(BASE + "/health"))
                .andRespond(withSuccess("{\"status\":\"degraded\"}", MediaType.APPLICATION_JSON));

        Result<ApiStatus> r = client.health();

        assertThat(r.get()).isEqualTo(ApiStatus.DEGRADED);
        server.verify();
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.expect(requestTo(BASE + "/health")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        Result<ApiStatus> r = client.health();

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("HTTP_4XX");
        server.verify();
    }

    @Test
    void exhaustedRetriesSurfaceAsFailure() {
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(BASE + "/health")).andRespond(withServerError());
        }

        assertThat(client.health().getErrorCode()).isEqualTo("HTTP_5XX");
        server.verify();
    }

    @Test
    void predictSendsFeaturesAndReadsLabel() {
        server.expect(requestTo(BASE + "/predict"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.features[0]").value(0.25))
                .andExpect(jsonPath("$.features[1]").value(-1.5))
                .andRespond(withSuccess("{\"label\":1,\"confidence\":0.8,\"model_version\":\"v4\"}",
                        MediaType.APPLICATION_JSON));

        Result<PredictResponse> r = client.predict(List.of(0.25, -1.5));

        assertThat(r.get().getPrediction()).isEqualTo(1);
        assertThat(r.get().getConfidence()).isEqualTo(0.8);
        assertThat(r.get().getModelVersion()).isEqualTo("v4");
        server.verify();
    }

    @Test
    void retrainIsNeverRetried() {
        server.expect(requestTo(BASE + "/retrain"))
                .andExpect(jsonPath("$.dataset_ref").value("12"))
                .andRespond(withServerError());

        Result<RetrainResponse> r = client.retrain("12");

        assertThat(r.isFailure()).isTrue();
        assertThat(r.getErrorCode()).isEqualTo("HTTP_5XX");
        server.verify();
    }

    @Test
    void retrainReadsNewVersion() {
        server.expect(requestTo(BASE + "/retrain"))
                .andRespond(withSuccess("{\"status\":\"success\",\"new_version\":\"v5\",\"accuracy\":0.91,\"training_samples\":1000}",
                        MediaType.APPLICATION_JSON));

        RetrainResponse body = client.retrain("12").get();

        assertThat(body.getModelVersion()).isEqualTo("v5");
        assertThat(body.getAccuracy()).isEqualTo(0.91);
        assertThat(body.getTrainingSamples()).isEqualTo(1000);
    }

    @Test
    void upperCaseStatusIsAcceptedUnderAnyDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            server.expect(requestTo(BASE + "/retrain"))
                    .andRespond(withSuccess("{\"status\":\"COMPLETED\",\"new_version\":\"v6\"}", MediaType.APPLICATION_JSON));

            assertThat(client.retrain("12").isOk()).isTrue();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void retrainWithErrorStatusIsRejected() {
        server.expect(requestTo(BASE + "/retrain"))
                .andRespond(withSuccess("{\"status\":\"error\"}", MediaType.APPLICATION_JSON));

        assertThat(client.retrain("12").getErrorCode()).isEqualTo("REJECTED");
    }

    @Test
    void generatorReturnsDatasetReference() {
        server.expect(requestTo(BASE + "/generate"))
                .andExpect(jsonPath("$.samples").value(1000))
                .andRespond(withSuccess("{\"generation_id\":42,\"samples_created\":1000}", MediaType.APPLICATION_JSON));

        Result<GenerateResponse> r = generator.generate(1000);

        assertThat(r.get().datasetRef()).isEqualTo("42");
        assertThat(r.get().getSamplesCreated()).isEqualTo(1000);
        server.verify();
    }
}
