package com.elssolution.motormonitor.domain;

import java.time.Instant;
import java.util.Map;

/** Append-only history row: snapshot + health + derived power, stamped at write time. */
public record HistoricalReading(
        Instant timestamp,
        SensorSnapshot snapshot,
        Map<Device, Boolean> connected,
        HealthBreakdown health,
        double powerKw
) {
    public static HistoricalReading of(Instant at, SensorSnapshot snapshot,
                                       Map<Device, Boolean> connected, HealthBreakdown health) {
        return new HistoricalReading(at, snapshot, Map.copyOf(connected), health, snapshot.powerKw());
    }

    /** Overall score, or null when this row carries no scored health. */
    public Double overallScore() {
        if (health == null || health.getHealthStatus() == HealthStatus.NO_DATA) return null;
        return health.getOverall();
    }
}
