package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.SensorSnapshot;

import java.time.Instant;

/** Payload of {@code sensor_update}. */
public record SensorUpdate(SensorSnapshot data, boolean sensorModuleConnected, boolean controllerConnected,
                           Instant lastUpdate) {

    public static SensorUpdate of(MonitorView v) {
        return new SensorUpdate(v.snapshot(), v.isConnected(Device.SENSOR_MODULE),
                v.isConnected(Device.CONTROLLER), v.lastUpdate());
    }
}
