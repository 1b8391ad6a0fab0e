package com.ml.sentinel.monitor.jobs;

import com.ml.sentinel.monitor.config.SentinelProperties;
import com.ml.sentinel.monitor.service.alert.AlertDispatcher;
import com.ml.sentinel.monitor.service.alert.AlertEvents;
import com.ml.sentinel.monitor.service.monitor.MonitoringCycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedRateTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the monitoring loop.
 * <p>
 * Runs on the single scheduler thread at a fixed rate. A tick that overruns
 * the interval delays the next one, ticks never overlap.
 * <p>
 * Configure (optional):
 * sentinel.schedule.tick-interval=30s
 * sentinel.schedule.enabled=true
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "sentinel.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class MonitoringJob implements SchedulingConfigurer {

    private final MonitoringCycle cycle;
    private final AlertDispatcher dispatcher;
    private final SentinelProperties props;
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public MonitoringJob(MonitoringCycle cycle, AlertDispatcher dispatcher, SentinelProperties props) {
        this.cycle = cycle;
        this.dispatcher = dispatcher;
        this.props = props;
    }

    /**
     * Registers the tick with the bound durations, so {@code 30s}, {@code PT30S}
     * and {@code 30000} are all accepted.
     */
    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        SentinelProperties.Schedule schedule = props.getSchedule();
        registrar.addFixedRateTask(new FixedRateTask(this::tick, schedule.getTickInterval(), schedule.getInitialDelay()));
        log.info("Monitoring tick scheduled every {} after {}", schedule.getTickInterval(), schedule.getInitialDelay());
    }

    public void tick() {
        if (stopping.get()) {
            log.debug("Shutdown requested; skipping tick");
            return;
        }
        try {
            cycle.runTick();
        } catch (Throwable t) {
            log.error("Monitoring tick error: {}", t.getMessage(), t);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Model sentinel started: tick every {}, drift > {}, accuracy < {}, retrain cooldown {}",
                props.getSchedule().getTickInterval(),
                props.getThresholds().getDrift(),
                props.getThresholds().getAccuracy(),
                props.getCooldown().getRetrain());
        if (!props.getSchedule().isStartupNotification()) return;
        try {
            dispatcher.dispatch(AlertEvents.startup(props.getSchedule().getTickInterval(),
                    props.toThresholds(), props.getCooldown().getRetrain()));
        } catch (RuntimeException e) {
            log.warn("Startup notification failed: {}", e.getMessage(), e);
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        if (stopping.compareAndSet(false, true)) {
            log.info("Stop requested after {} ticks; the running tick, if any, finishes first", cycle.tickCount());
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }
}
