package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.Device;

import java.time.Instant;

/** Payload of {@code status_update}. */
public record StatusUpdate(
        boolean sensorModuleConnected,
        boolean controllerConnected,
        Instant sensorModuleLastSeen,
        Instant controllerLastSeen,
        String analysisStatus,
        Instant lastUpdate
) {
    public static StatusUpdate of(MonitorView v) {
        return new StatusUpdate(
                v.isConnected(Device.SENSOR_MODULE),
                v.isConnected(Device.CONTROLLER),
                v.connectivity(Device.SENSOR_MODULE).getLastSeen(),
                v.connectivity(Device.CONTROLLER).getLastSeen(),
                v.analysisStatus().label(),
                v.lastUpdate());
    }
}
