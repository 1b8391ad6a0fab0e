package com.ml.sentinel.monitor.service.alert;

import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.core.CooldownState;
import com.ml.sentinel.monitor.dto.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Single way out for notifications. At most one alert per category is
 * delivered per dedup window. The window only starts when the sink
 * acknowledged delivery, so a failed send is attempted again next time.
 */
@Slf4j
@Service
public class AlertDispatcher {

    private final AlertSink sink;
    private final CooldownState cooldown;
    private final SentinelProperties props;
    private final Clock clock;

    public AlertDispatcher(AlertSink sink, CooldownState cooldown, SentinelProperties props, Clock clock) {
        this.sink = sink;
        this.cooldown = cooldown;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @return true if the alert was delivered now
     */
    public boolean dispatch(AlertEvent event) {
        String key = CooldownState.alertKey(event.category());
        Instant now = clock.instant();
        if (cooldown.isCoolingDown(key, props.getCooldown().getAlertDedup(), now)) {
            log.debug("Alert '{}' deduplicated; last {} alert at {}",
                    event.title(), event.category().key(), cooldown.lastTriggered(key).orElse(null));
            return false;
        }

        boolean acked;
        try {
            acked = sink.notify(event);
        } catch (RuntimeException e) {
            log.warn("Alert sink threw for '{}': {}", event.title(), e.toString());
            acked = false;
        }
        if (acked) {
            cooldown.markTriggered(key, clock.instant());
        } else {
            log.warn("Alert '{}' not acknowledged; will retry on a later tick", event.title());
        }
        return acked;
    }
}
