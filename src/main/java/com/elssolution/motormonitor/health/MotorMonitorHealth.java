package com.elssolution.motormonitor.health;

import com.elssolution.motormonitor.service.AnalysisStatus;
import com.elssolution.motormonitor.service.StatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class MotorMonitorHealth implements HealthIndicator {
    private final StatusService status;

    public MotorMonitorHealth(StatusService status) { this.status = status; }

    @Override public Health health() {
        var v = status.buildStatusView();
        boolean ok = AnalysisStatus.ACTIVE.label().equals(v.getAnalysisStatus())
                && (v.isSensorModuleConnected() || v.isControllerConnected());

        return (ok ? Health.up() : Health.down())
                .withDetail("analysisStatus", v.getAnalysisStatus())
                .withDetail("sensorModuleConnected", v.isSensorModuleConnected())
                .withDetail("controllerConnected", v.isControllerConnected())
                .withDetail("overallHealth", v.getOverallHealth())
                .withDetail("degraded", v.isDegraded())
                .build();
    }
}
