package com.ml.sentinel.monitor.test.service;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.AlertEvent;
import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.AlertSeverity;
import com.ml.sentinel.monitor.service.alert.DiscordWebhookSink;
import com.ml.sentinel.monitor.test.support.Fixtures;
import com.ml.sentinel.monitor.test.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DiscordWebhookSinkTest {

    private static final String HOOK = "https://chat.test/api/webhooks/1/token";

    private MockRestServiceServer server;
    private SentinelProperties props;
    private DiscordWebhookSink sink;

    @BeforeEach
    void setUp() {
        RestTemplate rest = Fixtures.restTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        props = new SentinelProperties();
        props.getEndpoints().setWebhookUrl(HOOK);
        sink = new DiscordWebhookSink(rest, props, Fixtures.retries(2), new MutableClock(Fixtures.T0));
    }

    private static AlertEvent failedRetrain() {
        return new AlertEvent(AlertCategory.DRIFT, AlertSeverity.CRITICAL, "Retraining failed (drift)", "boom");
    }

    @Test
    void noContentMeansDelivered() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.embeds[0].title").value("Retraining failed (drift)"))
                .andExpect(jsonPath("$.embeds[0].description").value("boom"))
                .andExpect(jsonPath("$.embeds[0].color").value(SentinelConsts.COLOR_CRITICAL))
                .andExpect(jsonPath("$.embeds[0].fields[0].value").value("critical"))
                .andExpect(jsonPath("$.embeds[0].fields[2].value").value("2024-05-01 10:00:00 UTC"))
                .andRespond(withNoContent());

        assertThat(sink.notify(failedRetrain())).isTrue();
        server.verify();
    }

    @Test
    void okWithBodyIsNotAnAcknowledgement() {
        server.expect(requestTo(HOOK)).andRespond(withSuccess());

        assertThat(sink.notify(failedRetrain())).isFalse();
    }

    @Test
    void serverErrorIsRetriedThenGivenUp() {
        server.expect(requestTo(HOOK)).andRespond(withServerError());
        server.expect(requestTo(HOOK)).andRespond(withServerError());

        assertThat(sink.notify(failedRetrain())).isFalse();
        server.verify();
    }

    @Test
    void missingWebhookSkipsDelivery() {
        props.getEndpoints().setWebhookUrl(" ");

        assertThat(sink.notify(failedRetrain())).isFalse();
        server.verify();
    }

    @Test
    void colourFollowsSeverityAndCategory() {
        assertThat(DiscordWebhookSink.colorOf(new AlertEvent(AlertCategory.DRIFT, AlertSeverity.WARNING, "t", "m")))
                .isEqualTo(SentinelConsts.COLOR_DRIFT);
        assertThat(DiscordWebhookSink.colorOf(new AlertEvent(AlertCategory.DEGRADATION, AlertSeverity.WARNING, "t", "m")))
                .isEqualTo(SentinelConsts.COLOR_WARNING);
        assertThat(DiscordWebhookSink.colorOf(new AlertEvent(AlertCategory.INFO, AlertSeverity.INFO, "t", "m")))
                .isEqualTo(SentinelConsts.COLOR_INFO);
    }

    @Test
    void statusFieldIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            server.expect(requestTo(HOOK))
                    .andExpect(jsonPath("$.embeds[0].fields[0].value").value("critical"))
                    .andRespond(withNoContent());

            assertThat(sink.notify(failedRetrain())).isTrue();
            server.verify();
        } finally {
            Locale.setDefault(previous);
        }
    }
}
