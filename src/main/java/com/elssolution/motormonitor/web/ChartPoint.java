package com.elssolution.motormonitor.web;

import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.SensorSnapshot;

import java.time.Instant;

/** One row of {@code /api/historical-data}; absent values stay null. */
public record ChartPoint(
        Instant timestamp,
        Double current,
        Double voltage,
        Double rpm,
        Double motorTemp,
        Double envTemp,
        Double humidity,
        Double overallHealthScore,
        Double electricalHealth,
        Double thermalHealth,
        Double mechanicalHealth,
        Double predictiveHealth,
        Double efficiencyScore,
        double power
) {
    static ChartPoint of(HistoricalReading r) {
        SensorSnapshot s = r.snapshot();
        HealthBreakdown h = r.health();
        boolean scored = r.overallScore() != null;
        return new ChartPoint(r.timestamp(),
                s.getCurrent(), s.getVoltage(), s.getRpm(),
                s.getMotorTempC(), s.getAmbientTempC(), s.getHumidity(),
                r.overallScore(),
                scored ? h.getElectrical() : null,
                scored ? h.getThermal() : null,
                scored ? h.getMechanical() : null,
                scored ? h.getPredictive() : null,
                scored ? h.getEfficiency() : null,
                r.powerKw());
    }
}
