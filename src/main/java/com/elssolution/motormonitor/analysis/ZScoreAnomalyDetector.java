package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.SensorSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Flags the current reading when any feature sits more than {@code zLimit}
 * standard deviations from its rolling-window mean.
 * Stays silent until {@code minSamples} values of a feature are available.
 */
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final Map<String, Function<SensorSnapshot, Double>> FEATURES = new LinkedHashMap<>();
    static {
        FEATURES.put("current", SensorSnapshot::getCurrent);
        FEATURES.put("voltage", SensorSnapshot::getVoltage);
        FEATURES.put("rpm", SensorSnapshot::getRpm);
        FEATURES.put("ambientTemp", SensorSnapshot::getAmbientTempC);
        FEATURES.put("humidity", SensorSnapshot::getHumidity);
        FEATURES.put("motorTemp", SensorSnapshot::getMotorTempC);
        FEATURES.put("motorVoltage", SensorSnapshot::getMotorVoltage);
    }

    private final int minSamples;
    private final int window;
    private final double zLimit;

    public ZScoreAnomalyDetector(int minSamples, int window, double zLimit) {
        this.minSamples = Math.max(2, minSamples);
        this.window = Math.max(this.minSamples, window);
        this.zLimit = zLimit;
    }

    @Override
    public Optional<String> inspect(SensorSnapshot current, List<HistoricalReading> chronological) {
        if (chronological.size() < minSamples) return Optional.empty();
        List<HistoricalReading> recent = chronological.subList(Math.max(0, chronological.size() - window), chronological.size());

        List<String> flagged = new ArrayList<>();
        for (var f : FEATURES.entrySet()) {
            Double x = f.getValue().apply(current);
            if (x == null) continue;

            double sum = 0, sumSq = 0;
            int n = 0;
            for (HistoricalReading r : recent) {
                Double v = f.getValue().apply(r.snapshot());
                if (v == null || !Double.isFinite(v)) continue;
                sum += v;
                sumSq += v * v;
                n++;
            }
            if (n < minSamples) continue;

            double mean = sum / n;
            double var = Math.max(0.0, sumSq / n - mean * mean);
            double sd = Math.sqrt(var);
            if (sd < 1e-9) continue;

            double z = Math.abs(x - mean) / sd;
            if (z > zLimit) flagged.add(String.format(Locale.ROOT, "%s z=%.1f", f.getKey(), z));
        }
        return flagged.isEmpty()
                ? Optional.empty()
                : Optional.of("Anomalous reading pattern detected (" + String.join(", ", flagged) + ")");
    }
}
