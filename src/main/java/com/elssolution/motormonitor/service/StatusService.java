package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.alerts.AlertService;
import com.elssolution.motormonitor.domain.ConnectivityStatus;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.SensorSnapshot;
import com.elssolution.motormonitor.integration.controller.ControllerReader;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.DecimalFormat;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Status aggregation for {@code /api/system-status}, the actuator health check
 * and the periodic one-line summary log.
 */
@Slf4j
@Component
public class StatusService {

    private static final DecimalFormat DF1 = new DecimalFormat("#0.0");

    private final ScheduledExecutorService scheduler;
    private final MonitorState state;
    private final LivenessTracker liveness;
    private final AlertService alerts;
    private final ControllerReader controller;
    private final Clock clock;

    // Summary log period
    private final int summaryEverySec = 30;

    public StatusService(ScheduledExecutorService scheduler, MonitorState state, LivenessTracker liveness,
                         AlertService alerts, ControllerReader controller, Clock clock) {
        this.scheduler = scheduler;
        this.state = state;
        this.liveness = liveness;
        this.alerts = alerts;
        this.controller = controller;
        this.clock = clock;
    }

    @PostConstruct
    void startSummaryLogger() {
        scheduler.scheduleAtFixedRate(this::logSummarySafe, 10, summaryEverySec, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", summaryEverySec);
    }

    // ---------------------- Public API ----------------------

    public SystemStatusView buildStatusView() {
        Instant now = clock.instant();
        MonitorView v = state.view();
        ConnectivityStatus sm = v.connectivity(Device.SENSOR_MODULE);
        ConnectivityStatus plc = v.connectivity(Device.CONTROLLER);
        long smAgeMs = ageMs(sm, now);
        long plcAgeMs = ageMs(plc, now);

        return SystemStatusView.builder()
                .sensorModuleConnected(sm.isConnected())
                .sensorModuleLastSeen(sm.getLastSeen())
                .sensorModuleAgeMs(smAgeMs)
                .sensorModuleAgeHuman(humanAge(smAgeMs))
                .sensorModuleTimeoutSeconds(liveness.timeoutFor(Device.SENSOR_MODULE).toSeconds())

                .controllerConnected(plc.isConnected())
                .controllerLastSeen(plc.getLastSeen())
                .controllerAgeMs(plcAgeMs)
                .controllerAgeHuman(humanAge(plcAgeMs))
                .controllerTimeoutSeconds(liveness.timeoutFor(Device.CONTROLLER).toSeconds())
                .controllerEndpoint(controller.endpoint())

                .analysisStatus(v.analysisStatus().label())
                .overallHealth(v.health().getOverall())
                .healthStatus(v.health().statusLabel())
                .recommendationCount(v.recommendations().size())
                .lastUpdate(v.lastUpdate())

                .degraded(alerts.isDegraded())
                .activeAlerts(alerts.activeCount())
                .build();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            SystemStatusView s = buildStatusView();
            SensorSnapshot snap = state.view().snapshot();
            log.info("Status: health={} ({}) analysis={}; SM {} (age {}): I={}A V={}V rpm={}; " +
                            "PLC {} (age {}): T={}C V={}V; alerts={}",
                    fmt(s.overallHealth), s.healthStatus, s.analysisStatus,
                    s.sensorModuleConnected ? "up" : "down", s.sensorModuleAgeHuman,
                    fmt(snap.getCurrent()), fmt(snap.getVoltage()), fmt(snap.getRpm()),
                    s.controllerConnected ? "up" : "down", s.controllerAgeHuman,
                    fmt(snap.getMotorTempC()), fmt(snap.getMotorVoltage()),
                    s.activeAlerts);
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- formatting helpers ----------------------

    private static long ageMs(ConnectivityStatus st, Instant now) {
        Duration silence = st.silenceAt(now);
        return silence == null ? -1 : Math.max(0, silence.toMillis());
    }

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    private static String fmt(Double v) { return v == null ? "-" : DF1.format(v); }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class SystemStatusView {
        // Sensor module
        boolean sensorModuleConnected;
        Instant sensorModuleLastSeen;
        long    sensorModuleAgeMs;
        String  sensorModuleAgeHuman;
        long    sensorModuleTimeoutSeconds;

        // Controller
        boolean controllerConnected;
        Instant controllerLastSeen;
        long    controllerAgeMs;
        String  controllerAgeHuman;
        long    controllerTimeoutSeconds;
        String  controllerEndpoint;

        // Analysis
        String  analysisStatus;
        double  overallHealth;
        String  healthStatus;
        int     recommendationCount;
        Instant lastUpdate;

        // Operational alerts
        boolean degraded;
        int     activeAlerts;
    }
}
