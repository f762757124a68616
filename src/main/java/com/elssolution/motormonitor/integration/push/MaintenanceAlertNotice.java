package com.elssolution.motormonitor.integration.push;

import com.elssolution.motormonitor.domain.MaintenanceAlert;

public record MaintenanceAlertNotice(Long id, String type, String severity, String message, double confidence) {

    public static MaintenanceAlertNotice of(MaintenanceAlert a) {
        return new MaintenanceAlertNotice(a.getId(), a.getType(), a.getSeverity().name(),
                a.getDescription(), a.getConfidence());
    }
}
