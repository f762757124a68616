package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.alerts.AlertService;
import com.elssolution.motormonitor.alerts.OperationalAlert;
import com.elssolution.motormonitor.analysis.HealthScorer;
import com.elssolution.motormonitor.analysis.RecommendationEngine;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.UnitConverter;
import com.elssolution.motormonitor.integration.controller.ControllerReadException;
import com.elssolution.motormonitor.integration.controller.ControllerReader;
import com.elssolution.motormonitor.integration.controller.ControllerRegisters;
import com.elssolution.motormonitor.integration.persistence.TelemetryStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The three periodic loops over {@link MonitorState}:
 *
 *   poll     (5 s)  controller registers -> converted values
 *   analysis (15 s) snapshot + 2 h history -> health, recommendations, promoted alerts
 *   sweep    (10 s) liveness timeouts, then status_update
 *
 * Each loop runs with fixed delay on the shared executor, so a slow cycle delays only
 * its own next run. Every cycle catches its own failures; nothing here may kill a loop.
 * Shutdown is cooperative: handles are cancelled and a running cycle returns at its next check.
 */
@Slf4j
@Component
public class MonitorScheduler {

    // ==== Infra ====
    private final ScheduledExecutorService scheduler;
    private final MonitorState state;
    private final ControllerReader controller;
    private final TelemetryStore store;
    private final HealthScorer scorer;
    private final RecommendationEngine recommendations;
    private final AlertDeduplicator deduplicator;
    private final LivenessTracker liveness;
    private final AlertService alerts;
    private final Clock clock;

    // ==== Config ====
    @Value("${motor.schedule.pollSeconds:5}")          private long pollSeconds = 5;
    @Value("${motor.schedule.analysisSeconds:15}")     private long analysisSeconds = 15;
    @Value("${motor.schedule.sweepSeconds:10}")        private long sweepSeconds = 10;
    @Value("${motor.schedule.initialDelaySeconds:5}")  private long initialDelaySeconds = 5;
    @Value("${motor.analysis.historyMinutes:120}")     private long historyMinutes = 120;

    private final List<ScheduledFuture<?>> handles = new ArrayList<>(3);
    private volatile boolean stopping = false;

    public MonitorScheduler(ScheduledExecutorService scheduler, MonitorState state, ControllerReader controller,
                            TelemetryStore store, HealthScorer scorer, RecommendationEngine recommendations,
                            AlertDeduplicator deduplicator, LivenessTracker liveness, AlertService alerts,
                            Clock clock) {
        this.scheduler = scheduler;
        this.state = state;
        this.controller = controller;
        this.store = store;
        this.scorer = scorer;
        this.recommendations = recommendations;
        this.deduplicator = deduplicator;
        this.liveness = liveness;
        this.alerts = alerts;
        this.clock = clock;
    }

    // ---- Lifecycle ----

    @PostConstruct
    public void start() {
        pollSeconds = positive("pollSeconds", pollSeconds, 5);
        analysisSeconds = positive("analysisSeconds", analysisSeconds, 15);
        sweepSeconds = positive("sweepSeconds", sweepSeconds, 10);
        historyMinutes = positive("historyMinutes", historyMinutes, 120);
        long delay = Math.max(0, initialDelaySeconds);

        handles.add(scheduler.scheduleWithFixedDelay(this::pollControllerSafe, 0, pollSeconds, TimeUnit.SECONDS));
        handles.add(scheduler.scheduleWithFixedDelay(this::analysisCycleSafe, delay, analysisSeconds, TimeUnit.SECONDS));
        handles.add(scheduler.scheduleWithFixedDelay(this::livenessSweepSafe, delay, sweepSeconds, TimeUnit.SECONDS));
        log.info("Monitor loops started: poll={}s analysis={}s sweep={}s history={}min controller={}",
                pollSeconds, analysisSeconds, sweepSeconds, historyMinutes, controller.endpoint());
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        for (ScheduledFuture<?> h : handles) {
            if (h != null) h.cancel(false);
        }
        handles.clear();
    }

    public boolean isStopping() {
        return stopping;
    }

    // ---- poll loop ----

    void pollControllerSafe() {
        if (stopping) return;
        ControllerRegisters regs;
        try {
            regs = controller.read();
        } catch (ControllerReadException e) {
            if (stopping) return;
            log.warn("controller_read_failed timeout={} err={}", e.isTimeout(), e.getMessage());
            alerts.raise(OperationalAlert.CONTROLLER_UNREACHABLE, e.getMessage());
            liveness.markUnreachable(Device.CONTROLLER, "read failed");
            return;
        } catch (RuntimeException e) {
            log.warn("controller_poll_failed: {}", e.toString());
            alerts.raise(OperationalAlert.CONTROLLER_UNREACHABLE, "Controller poll failed: " + e);
            liveness.markUnreachable(Device.CONTROLLER, "poll failed");
            return;
        }

        double volts = UnitConverter.voltageFromRaw(regs.rawVoltage());
        double tempC = UnitConverter.temperatureFromRaw(regs.rawTemperature());
        state.applyControllerReading(tempC, volts, clock.instant());
        if (!stopping) {
            alerts.resolve(OperationalAlert.CONTROLLER_UNREACHABLE);
            alerts.resolve(OperationalAlert.CONTROLLER_UNCAUGHT);
        }
        if (log.isDebugEnabled()) {
            log.debug("controller_poll raw=({}, {}) -> {}V {}C", regs.rawVoltage(), regs.rawTemperature(), volts, tempC);
        }
    }

    // ---- analysis loop ----

    void analysisCycleSafe() {
        if (stopping) return;
        try {
            analysisCycle();
            alerts.resolve(OperationalAlert.ANALYSIS_FAILED);
        } catch (Exception e) {
            log.warn("analysis_cycle_failed: {}", e.toString(), e);
            state.setAnalysisStatus(AnalysisStatus.ERROR);
            alerts.raise(OperationalAlert.ANALYSIS_FAILED, "Analysis cycle failed: " + e);
        }
    }

    private void analysisCycle() {
        MonitorView view = state.view();
        if (!view.snapshot().hasAnyValue()) {
            state.setAnalysisStatus(AnalysisStatus.WAITING_FOR_DATA);
            return;
        }

        List<HistoricalReading> history;
        try {
            history = store.recent(Duration.ofMinutes(historyMinutes));
            alerts.resolve(OperationalAlert.HISTORY_UNAVAILABLE);
        } catch (RuntimeException e) {
            // score without trends rather than skip the cycle
            log.warn("history_read_failed: {}", e.toString());
            alerts.raise(OperationalAlert.HISTORY_UNAVAILABLE, "History read failed: " + e.getMessage());
            history = List.of();
        }
        if (stopping) return;

        HealthBreakdown health = scorer.score(view.snapshot(), history);
        List<Recommendation> recs = recommendations.generate(health, view.connectedFlags());
        state.applyAnalysis(health, recs);

        try {
            deduplicator.promote(recs);
            alerts.resolve(OperationalAlert.PERSISTENCE_FAILED);
        } catch (RuntimeException e) {
            log.warn("alert_promotion_failed: {}", e.toString());
            alerts.raise(OperationalAlert.PERSISTENCE_FAILED, "Alert persistence failed: " + e.getMessage());
        }

        log.info("analysis overall={} status={} recommendations={}",
                health.getOverall(), health.statusLabel(), recs.size());
    }

    // ---- liveness loop ----

    void livenessSweepSafe() {
        if (stopping) return;
        try {
            liveness.sweep(clock.instant());
            state.publishStatus();
            alerts.resolve(OperationalAlert.LIVENESS_SWEEP_FAILED);
        } catch (Exception e) {
            log.warn("liveness_sweep_failed: {}", e.toString());
            alerts.raise(OperationalAlert.LIVENESS_SWEEP_FAILED, "Liveness sweep failed: " + e);
        }
    }

    private static long positive(String name, long value, long fallback) {
        if (value > 0) return value;
        log.warn("{} <= 0 ({}). Using {}.", name, value, fallback);
        return fallback;
    }
}
