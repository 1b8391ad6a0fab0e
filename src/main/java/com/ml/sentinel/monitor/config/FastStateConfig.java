package com.ml.sentinel.monitor.config;

import com.ml.sentinel.monitor.core.CooldownState;
import com.ml.sentinel.monitor.core.FastStateStore;
import com.ml.sentinel.monitor.core.InMemoryFastStateStore;
import com.ml.sentinel.monitor.service.retrain.RetrainLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class FastStateConfig {

    @Bean
    public FastStateStore fastStateStore(Clock clock) {
        return new InMemoryFastStateStore("ms:", clock);
    }

    @Bean
    public RetrainLock retrainLock(FastStateStore fastStateStore, SentinelProperties props) {
        return new RetrainLock(fastStateStore, props.effectiveLockStaleAfter());
    }

    @Bean
    public CooldownState cooldownState() {
        return new CooldownState();
    }
}
