package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HealthStatus;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.Maths;
import com.elssolution.motormonitor.domain.SensorSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Multi-factor motor health.
 *
 * Each sub-score starts at 100, subtracts fixed band deductions (one band per metric,
 * most extreme first) and is clamped to [0, 100].
 *
 *   overall = 0.30 electrical + 0.35 thermal + 0.25 mechanical + 0.10 predictive
 *
 * Missing inputs score 0 for electrical/thermal/mechanical but 50 for predictive.
 * Efficiency is reported alongside and is not part of the overall score.
 */
@Slf4j
@Component
public class HealthScorer {

    static final double W_ELECTRICAL = 0.30;
    static final double W_THERMAL = 0.35;
    static final double W_MECHANICAL = 0.25;
    static final double W_PREDICTIVE = 0.10;

    static final double PREDICTIVE_NEUTRAL = 50.0;
    static final double IMBALANCE_PENALTY = 20.0;
    static final double ANOMALY_PENALTY = 10.0;

    static final String INSUFFICIENT_HISTORY = "Insufficient data for prediction";

    private final HealthThresholds t;
    private final AnomalyDetector anomalyDetector;

    private final BandTable voltageBands;
    private final BandTable currentBands;
    private final BandTable motorTempBands;
    private final BandTable ambientTempBands;
    private final BandTable humidityBands;
    private final BandTable rpmBands;
    private final List<TrendRule> trendRules;

    public HealthScorer(HealthThresholds thresholds, AnomalyDetector anomalyDetector) {
        this.t = thresholds.sanitized();
        this.anomalyDetector = anomalyDetector;

        this.voltageBands = BandTable.of("voltage",
                BandRule.below("critical-low", t.getVoltageCriticalLow(), 40, "Critical undervoltage: %.1fV"),
                BandRule.below("warning-low", t.getVoltageWarningLow(), 20, "Low voltage: %.1fV"),
                BandRule.above("critical-high", t.getVoltageCriticalHigh(), 40, "Critical overvoltage: %.1fV"),
                BandRule.above("warning-high", t.getVoltageWarningHigh(), 20, "High voltage: %.1fV"));

        this.currentBands = BandTable.of("current",
                BandRule.below("underload", t.getCurrentUnderload(), 30, "Motor underloaded: %.1fA"),
                BandRule.above("overload-critical", t.getCurrentCritical(), 50, "Critical overcurrent: %.1fA"),
                BandRule.above("overload", t.getCurrentOverload(), 25, "Motor overloaded: %.1fA"));

        this.motorTempBands = BandTable.of("motorTemp",
                BandRule.above("critical", t.getMotorTempCritical(), 50, "Critical motor temperature: %.1f°C"),
                BandRule.above("high", t.getMotorTempHigh(), 30, "High motor temperature: %.1f°C"),
                BandRule.above("elevated", t.getMotorTempElevated(), 15, "Elevated motor temperature: %.1f°C"));

        this.ambientTempBands = BandTable.of("ambientTemp",
                BandRule.above("critical", t.getAmbientTempCritical(), 25, "Critical ambient temperature: %.1f°C"),
                BandRule.above("high", t.getAmbientTempHigh(), 15, "High ambient temperature: %.1f°C"));

        this.humidityBands = BandTable.of("humidity",
                BandRule.above("critical", t.getHumidityCritical(), 20, "Critical humidity: %.1f%%"),
                BandRule.above("high", t.getHumidityHigh(), 10, "High humidity: %.1f%%"),
                BandRule.below("low", t.getHumidityLow(), 5, "Low humidity: %.1f%%"));

        this.rpmBands = BandTable.of("rpm",
                BandRule.below("critical-low", t.getRpmCriticalLow(), 50, "Critical low RPM: %.0f"),
                BandRule.below("warning-low", t.getRpmWarningLow(), 30, "Low RPM: %.0f"),
                BandRule.above("critical-high", t.getRpmCriticalHigh(), 50, "Critical high RPM: %.0f"),
                BandRule.above("warning-high", t.getRpmWarningHigh(), 30, "High RPM: %.0f"));

        this.trendRules = List.of(
                new TrendRule("motorTemp", r -> r.snapshot().getMotorTempC(), t.getMotorTempTrendWindow(),
                        s -> s > t.getMotorTempSlopeMax(), 30, "Rising temperature trend: +%.1f°C/reading"),
                new TrendRule("current", r -> r.snapshot().getCurrent(), t.getCurrentTrendWindow(),
                        s -> Math.abs(s) > t.getCurrentSlopeMax(), 25, "Current instability: ±%.1fA/reading",
                        Math::abs),
                new TrendRule("overallHealth", HistoricalReading::overallScore, t.getHealthTrendWindow(),
                        s -> s < t.getHealthSlopeMin(), 35, "Health degradation: %.1f points/reading"));
    }

    // ---------------------- Public API ----------------------

    /**
     * @param snapshot           latest known values
     * @param historyNewestFirst recent history as returned by the store
     */
    public HealthBreakdown score(SensorSnapshot snapshot, List<HistoricalReading> historyNewestFirst) {
        SubScore electrical = electrical(snapshot);
        SubScore thermal = thermal(snapshot);
        SubScore mechanical = mechanical(snapshot);
        SubScore predictive = predictive(snapshot, historyNewestFirst);

        double overall = Maths.clamp(
                electrical.score() * W_ELECTRICAL
                        + thermal.score() * W_THERMAL
                        + mechanical.score() * W_MECHANICAL
                        + predictive.score() * W_PREDICTIVE,
                0, 100);

        double published = Maths.round1(overall);
        return HealthBreakdown.builder()
                .overall(published)
                .electrical(Maths.round1(electrical.score()))
                .thermal(Maths.round1(thermal.score()))
                .mechanical(Maths.round1(mechanical.score()))
                .predictive(Maths.round1(predictive.score()))
                .efficiency(Maths.round1(efficiency(snapshot)))
                .healthStatus(statusOf(overall))
                .issue(HealthBreakdown.ELECTRICAL, electrical.issues())
                .issue(HealthBreakdown.THERMAL, thermal.issues())
                .issue(HealthBreakdown.MECHANICAL, mechanical.issues())
                .issue(HealthBreakdown.PREDICTIVE, predictive.issues())
                .build();
    }

    /** Status band of the overall as published, i.e. after one-decimal rounding. */
    static HealthStatus statusOf(double rawOverall) {
        return HealthStatus.fromScore(Maths.round1(rawOverall));
    }

    public SubScore electrical(SensorSnapshot s) {
        Double voltage = s.effectiveVoltage();
        Double current = s.getCurrent();
        if (voltage == null && current == null) {
            return SubScore.zero("No electrical data available");
        }
        Tally tally = new Tally();
        if (voltage != null) tally.apply(voltageBands, voltage);
        if (current != null) tally.apply(currentBands, current);
        return tally.result();
    }

    public SubScore thermal(SensorSnapshot s) {
        Double motorTemp = s.getMotorTempC();
        Double ambient = s.getAmbientTempC();
        Double humidity = s.getHumidity();
        if (motorTemp == null && ambient == null) {
            return SubScore.zero("No thermal data available");
        }
        Tally tally = new Tally();
        if (motorTemp != null) tally.apply(motorTempBands, motorTemp);
        if (ambient != null) tally.apply(ambientTempBands, ambient);
        if (humidity != null) tally.apply(humidityBands, humidity);
        return tally.result();
    }

    public SubScore mechanical(SensorSnapshot s) {
        Double rpm = s.getRpm();
        if (rpm == null) {
            return SubScore.zero("No RPM data available");
        }
        Tally tally = new Tally();
        tally.apply(rpmBands, rpm);

        Double current = s.getCurrent();
        if (current != null && rpm > 0) {
            double expected = (rpm / t.getOptimalRpm()) * t.getOptimalCurrent();
            if (expected > 0) {
                double deviation = Math.abs(current - expected) / expected;
                if (deviation > t.getImbalanceTolerance()) {
                    tally.deduct(IMBALANCE_PENALTY, "Current/RPM imbalance detected");
                }
            }
        }
        return tally.result();
    }

    /**
     * Trend-based sub-score. Fewer than the minimum history rows gives a neutral 50,
     * which is deliberately not the 0 used by the other sub-scores for missing data.
     */
    public SubScore predictive(SensorSnapshot current, List<HistoricalReading> historyNewestFirst) {
        if (historyNewestFirst == null || historyNewestFirst.size() < t.getPredictiveMinSamples()) {
            return new SubScore(PREDICTIVE_NEUTRAL, List.of(INSUFFICIENT_HISTORY));
        }
        List<HistoricalReading> chronological = new ArrayList<>(historyNewestFirst);
        Collections.reverse(chronological);

        Tally tally = new Tally();
        for (TrendRule rule : trendRules) {
            TrendOutcome outcome = TrendAnalyzer.analyze(rule, chronological);
            switch (outcome.kind()) {
                case TREND_DETECTED -> tally.deduct(rule.deduction(), outcome.detail());
                case COMPUTATION_ERROR -> {
                    log.warn("trend_fit_failed metric={} detail={}", outcome.metric(), outcome.detail());
                    tally.note("Predictive analysis error: " + outcome.metric());
                }
                case INSUFFICIENT_DATA -> {
                    if (log.isDebugEnabled()) log.debug("trend_skipped {}", outcome.detail());
                }
                case STABLE -> { }
            }
        }

        Optional<String> anomaly;
        try {
            anomaly = anomalyDetector.inspect(current, chronological);
        } catch (RuntimeException e) {
            log.warn("anomaly_detector_failed: {}", e.toString());
            anomaly = Optional.empty();
            tally.note("Predictive analysis error: anomaly detector");
        }
        anomaly.ifPresent(issue -> tally.deduct(ANOMALY_PENALTY, issue));

        return tally.result();
    }

    /** Average of rpm efficiency and power efficiency, each capped at 100. */
    public double efficiency(SensorSnapshot s) {
        Double voltage = s.effectiveVoltage();
        Double current = s.getCurrent();
        Double rpm = s.getRpm();
        if (isZero(voltage) || isZero(current) || isZero(rpm)) return 0.0;

        double rpmEfficiency = Math.min(100.0, (rpm / t.getOptimalRpm()) * 100.0);

        double actualKw = voltage * current / 1000.0;
        double optimalKw = t.getOptimalVoltage() * t.getOptimalCurrent() / 1000.0;
        double powerEfficiency = actualKw > 0 ? Math.min(100.0, (optimalKw / actualKw) * 100.0) : 0.0;

        return Maths.clamp((rpmEfficiency + powerEfficiency) / 2.0, 0, 100);
    }

    BandTable voltageBands() { return voltageBands; }

    private static boolean isZero(Double v) {
        return v == null || v == 0.0;
    }

    // ---------------------- types ----------------------

    public record SubScore(double score, List<String> issues) {
        static SubScore zero(String issue) {
            return new SubScore(0.0, List.of(issue));
        }
    }

    /** Additive penalties, clamped once at the end. */
    private static final class Tally {
        private double score = 100.0;
        private final List<String> issues = new ArrayList<>();

        void apply(BandTable table, double value) {
            table.evaluate(value).ifPresent(hit -> deduct(hit.deduction(), hit.issue()));
        }

        void deduct(double points, String issue) {
            score -= points;
            issues.add(issue);
        }

        void note(String issue) {
            issues.add(issue);
        }

        SubScore result() {
            return new SubScore(Maths.clamp(score, 0, 100), List.copyOf(issues));
        }
    }
}
