package com.ml.sentinel.monitor.test;

import com.ml.sentinel.monitor.ModelSentinelApplication;
import com.ml.sentinel.monitor.jobs.MonitoringJob;
import com.ml.sentinel.monitor.service.monitor.MonitoringCycle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots with the scheduler on, using the human-readable duration format of
 * application.yml, and waits for the first tick to fire.
 */
@SpringBootTest(classes = ModelSentinelApplication.class, properties = {
        "sentinel.schedule.enabled=true",
        "sentinel.schedule.startup-notification=false",
        "sentinel.schedule.tick-interval=1h",
        "sentinel.schedule.initial-delay=100ms",
        "sentinel.endpoints.serving-url=http://127.0.0.1:1",
        "sentinel.endpoints.webhook-url="
})
class SentinelSchedulingTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MonitoringCycle cycle;

    @Test
    void scheduledTickRunsWithDurationProperties() throws InterruptedException {
        assertThat(context.getBeansOfType(MonitoringJob.class)).hasSize(1);

        long deadline = System.currentTimeMillis() + 10_000;
        while (cycle.tickCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(cycle.tickCount()).isEqualTo(1);
    }
}
