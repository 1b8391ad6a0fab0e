package com.ml.sentinel.monitor.service.alert;

import com.ml.sentinel.monitor.common.constants.SentinelConsts;
import com.ml.sentinel.monitor.common.exception.TransientIOException;
import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.dto.AlertEvent;
import com.ml.sentinel.monitor.enums.AlertCategory;
import com.ml.sentinel.monitor.enums.AlertSeverity;
import com.ml.sentinel.monitor.model.discord.WebhookPayload;
import com.ml.sentinel.monitor.service.client.RemoteCalls;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Posts alerts to a chat webhook as a single embed. Only HTTP 204 counts as
 * delivered.
 */
@Slf4j
@Component
public class DiscordWebhookSink implements AlertSink {

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final RestTemplate alertTemplate;
    private final SentinelProperties props;
    private final Retry retry;
    private final Clock clock;

    public DiscordWebhookSink(@Qualifier("alertTemplate") RestTemplate alertTemplate,
                              SentinelProperties props,
                              RetryRegistry retryRegistry,
                              Clock clock) {
        this.alertTemplate = alertTemplate;
        this.props = props;
        this.retry = retryRegistry.retry("alertSink");
        this.clock = clock;
    }

    @Override
    public boolean notify(AlertEvent event) {
        String url = props.getEndpoints().getWebhookUrl();
        if (url == null || url.isBlank()) {
            log.info("Webhook not configured, alert not delivered: [{}] {}", event.category().key(), event.title());
            return false;
        }
        WebhookPayload payload = toPayload(event);
        try {
            ResponseEntity<String> response = retry.executeSupplier(() ->
                    RemoteCalls.send("alert webhook", () -> alertTemplate.postForEntity(url, payload, String.class)));
            if (response.getStatusCode().value() != HttpStatus.NO_CONTENT.value()) {
                log.warn("Webhook answered {} instead of 204 for alert '{}'", response.getStatusCode().value(), event.title());
                return false;
            }
            log.info("Alert delivered: [{}/{}] {}", event.category().key(), event.severity(), event.title());
            return true;
        } catch (TransientIOException e) {
            log.warn("Alert delivery failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return false;
        }
    }

    WebhookPayload toPayload(AlertEvent event) {
        WebhookPayload.Embed embed = WebhookPayload.Embed.builder()
                .title(event.title())
                .description(event.message())
                .color(colorOf(event))
                .fields(List.of(
                        new WebhookPayload.Field("Status", event.severity().name().toLowerCase(Locale.ROOT), true),
                        new WebhookPayload.Field("Category", event.category().key(), true),
                        new WebhookPayload.Field("Timestamp", TS.format(clock.instant()), true),
                        new WebhookPayload.Field("Service", SentinelConsts.SERVICE_NAME, true)))
                .footer(new WebhookPayload.Footer(SentinelConsts.SERVICE_NAME + " - automated model monitoring"))
                .build();
        return new WebhookPayload(List.of(embed));
    }

    public static int colorOf(AlertEvent event) {
        if (event.severity() == AlertSeverity.CRITICAL) return SentinelConsts.COLOR_CRITICAL;
        if (event.category() == AlertCategory.DRIFT) return SentinelConsts.COLOR_DRIFT;
        if (event.severity() == AlertSeverity.WARNING) return SentinelConsts.COLOR_WARNING;
        return SentinelConsts.COLOR_INFO;
    }
}
