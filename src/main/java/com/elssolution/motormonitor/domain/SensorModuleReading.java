package com.elssolution.motormonitor.domain;

/** One parsed push from the sensor module; numeric fields are null when absent. */
public record SensorModuleReading(
        Double current,
        Double voltage,
        Double rpm,
        Double ambientTempC,
        Double humidity,
        Double ambientTempF,
        Double heatIndexC,
        Double heatIndexF,
        String relay1,
        String relay2,
        String relay3,
        String combinedStatus
) {}
