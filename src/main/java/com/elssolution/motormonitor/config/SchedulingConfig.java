package com.elssolution.motormonitor.config;

import com.elssolution.motormonitor.alerts.GlobalUncaughtHandler;
import com.elssolution.motormonitor.analysis.AnomalyDetector;
import com.elssolution.motormonitor.analysis.HealthThresholds;
import com.elssolution.motormonitor.analysis.ZScoreAnomalyDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Slf4j
@Configuration
@EnableConfigurationProperties(HealthThresholds.class)
public class SchedulingConfig {

    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    // poll, analysis, sweep and the status logger each get a thread, so a blocked read never starves the others
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(4, r -> {
            Thread t = new Thread(r);
            t.setName("motor-sched-" + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    @Bean
    public AnomalyDetector anomalyDetector(
            @Value("${motor.analysis.anomaly.enabled:false}") boolean enabled,
            @Value("${motor.analysis.anomaly.minSamples:50}") int minSamples,
            @Value("${motor.analysis.anomaly.window:100}") int window,
            @Value("${motor.analysis.anomaly.zLimit:3.0}") double zLimit) {
        if (!enabled) return AnomalyDetector.NONE;
        log.info("Anomaly detector enabled: minSamples={} window={} zLimit={}", minSamples, window, zLimit);
        return new ZScoreAnomalyDetector(minSamples, window, zLimit);
    }
}
