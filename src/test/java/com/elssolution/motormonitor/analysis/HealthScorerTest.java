package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HealthStatus;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.SensorSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HealthScorerTest {

    private final HealthScorer scorer = new HealthScorer(new HealthThresholds(), AnomalyDetector.NONE);

    private static final SensorSnapshot OPTIMUM = SensorSnapshot.builder()
            .voltage(24.0).current(6.25).rpm(2750.0)
            .build();

    private static final SensorSnapshot HEALTHY = OPTIMUM.toBuilder()
            .motorTempC(35.0).ambientTempC(25.0).humidity(50.0)
            .build();

    // ---- electrical ----

    @Test
    void optimum_scores_full_electrical_and_mechanical() {
        assertThat(scorer.electrical(OPTIMUM).score()).isEqualTo(100.0);
        assertThat(scorer.electrical(OPTIMUM).issues()).isEmpty();
        assertThat(scorer.mechanical(OPTIMUM).score()).isEqualTo(100.0);
        assertThat(scorer.mechanical(OPTIMUM).issues()).isEmpty();
    }

    @Test
    void critical_undervoltage_deducts_forty_once() {
        var e = scorer.electrical(SensorSnapshot.builder().voltage(15.0).build());

        assertThat(e.score()).isEqualTo(60.0);
        assertThat(e.issues()).containsExactly("Critical undervoltage: 15.0V");
    }

    @Test
    void controller_voltage_is_used_when_sensor_module_has_none() {
        var e = scorer.electrical(SensorSnapshot.builder().motorVoltage(21.0).build());

        assertThat(e.score()).isEqualTo(80.0);
        assertThat(e.issues()).containsExactly("Low voltage: 21.0V");
    }

    @Test
    void voltage_and_current_bands_add_up() {
        var e = scorer.electrical(SensorSnapshot.builder().voltage(29.0).current(13.0).build());

        assertThat(e.score()).isEqualTo(10.0);
        assertThat(e.issues()).containsExactly("Critical overvoltage: 29.0V", "Critical overcurrent: 13.0A");
    }

    @Test
    void no_electrical_data_is_a_true_zero() {
        var e = scorer.electrical(SensorSnapshot.EMPTY);

        assertThat(e.score()).isEqualTo(0.0);
        assertThat(e.issues()).containsExactly("No electrical data available");
    }

    // ---- thermal ----

    @Test
    void thermal_bands_per_metric() {
        var t = scorer.thermal(SensorSnapshot.builder().motorTempC(55.0).ambientTempC(32.0).humidity(25.0).build());

        assertThat(t.score()).isEqualTo(50.0);
        assertThat(t.issues()).containsExactly(
                "High motor temperature: 55.0°C",
                "High ambient temperature: 32.0°C",
                "Low humidity: 25.0%");
    }

    @Test
    void humidity_alone_is_not_thermal_data() {
        var t = scorer.thermal(SensorSnapshot.builder().humidity(50.0).build());

        assertThat(t.score()).isEqualTo(0.0);
        assertThat(t.issues()).containsExactly("No thermal data available");
    }

    // ---- mechanical ----

    @Test
    void rpm_bands_and_missing_rpm() {
        assertThat(scorer.mechanical(SensorSnapshot.builder().rpm(2300.0).build()).score()).isEqualTo(50.0);
        assertThat(scorer.mechanical(SensorSnapshot.builder().rpm(3000.0).build()).score()).isEqualTo(70.0);

        var none = scorer.mechanical(SensorSnapshot.builder().current(6.0).build());
        assertThat(none.score()).isEqualTo(0.0);
        assertThat(none.issues()).containsExactly("No RPM data available");
    }

    @Test
    void current_far_from_rpm_expectation_is_an_imbalance() {
        // expected current at 2750 rpm is 6.25 A; 10 A is 60% off
        var m = scorer.mechanical(OPTIMUM.toBuilder().current(10.0).build());

        assertThat(m.score()).isEqualTo(80.0);
        assertThat(m.issues()).containsExactly("Current/RPM imbalance detected");
    }

    // ---- predictive ----

    @Test
    void short_history_is_neutral_fifty() {
        List<HistoricalReading> four = HistoryFixtures.chronological(4, i -> HEALTHY, i -> 90.0);

        var p = scorer.predictive(HEALTHY, four);

        assertThat(p.score()).isEqualTo(50.0);
        assertThat(p.issues()).containsExactly("Insufficient data for prediction");
        assertThat(scorer.predictive(SensorSnapshot.EMPTY, List.of()).score()).isEqualTo(50.0);
    }

    @Test
    void rising_motor_temperature_is_a_trend() {
        List<HistoricalReading> rows = HistoryFixtures.chronological(10,
                i -> SensorSnapshot.builder().motorTempC(40.0 + 2 * i).build(), i -> null);

        var p = scorer.predictive(HEALTHY, HistoryFixtures.newestFirst(rows));

        assertThat(p.score()).isEqualTo(70.0);
        assertThat(p.issues()).containsExactly("Rising temperature trend: +2.0°C/reading");
    }

    @Test
    void falling_health_is_a_trend() {
        List<HistoricalReading> rows = HistoryFixtures.chronological(20, i -> HEALTHY, i -> 95.0 - 2 * i);

        var p = scorer.predictive(HEALTHY, HistoryFixtures.newestFirst(rows));

        assertThat(p.score()).isEqualTo(65.0);
        assertThat(p.issues()).containsExactly("Health degradation: -2.0 points/reading");
    }

    @Test
    void falling_current_reports_slope_magnitude() {
        List<HistoricalReading> rows = HistoryFixtures.chronological(10,
                i -> SensorSnapshot.builder().current(10.0 - i).build(), i -> null);

        var p = scorer.predictive(HEALTHY, HistoryFixtures.newestFirst(rows));

        assertThat(p.score()).isEqualTo(75.0);
        assertThat(p.issues()).containsExactly("Current instability: ±1.0A/reading");
    }

    @Test
    void status_band_follows_the_rounded_overall() {
        assertThat(HealthScorer.statusOf(59.94)).isEqualTo(HealthStatus.CRITICAL);
        assertThat(HealthScorer.statusOf(59.95)).isEqualTo(HealthStatus.WARNING);
        assertThat(HealthScorer.statusOf(59.96)).isEqualTo(HealthStatus.WARNING);
        assertThat(HealthScorer.statusOf(89.94)).isEqualTo(HealthStatus.GOOD);
        assertThat(HealthScorer.statusOf(89.96)).isEqualTo(HealthStatus.EXCELLENT);
    }

    @Test
    void steady_history_keeps_full_predictive_score() {
        List<HistoricalReading> rows = HistoryFixtures.chronological(20, i -> HEALTHY, i -> 90.0);

        var p = scorer.predictive(HEALTHY, HistoryFixtures.newestFirst(rows));

        assertThat(p.score()).isEqualTo(100.0);
        assertThat(p.issues()).isEmpty();
    }

    @Test
    void anomaly_detector_deducts_ten() {
        HealthScorer withDetector = new HealthScorer(new HealthThresholds(),
                (current, history) -> Optional.of("Anomalous reading pattern detected (rpm z=4.0)"));
        List<HistoricalReading> rows = HistoryFixtures.chronological(10, i -> HEALTHY, i -> 90.0);

        var p = withDetector.predictive(HEALTHY, rows);

        assertThat(p.score()).isEqualTo(90.0);
        assertThat(p.issues()).containsExactly("Anomalous reading pattern detected (rpm z=4.0)");
    }

    @Test
    void failing_anomaly_detector_is_a_note_not_an_error() {
        HealthScorer broken = new HealthScorer(new HealthThresholds(), (current, history) -> {
            throw new IllegalStateException("boom");
        });
        List<HistoricalReading> rows = HistoryFixtures.chronological(10, i -> HEALTHY, i -> 90.0);

        var p = broken.predictive(HEALTHY, rows);

        assertThat(p.score()).isEqualTo(100.0);
        assertThat(p.issues()).containsExactly("Predictive analysis error: anomaly detector");
    }

    // ---- efficiency ----

    @Test
    void efficiency_at_optimum_is_full() {
        assertThat(scorer.efficiency(OPTIMUM)).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void efficiency_needs_all_three_inputs() {
        assertThat(scorer.efficiency(OPTIMUM.toBuilder().rpm(null).build())).isEqualTo(0.0);
        assertThat(scorer.efficiency(SensorSnapshot.builder().voltage(24.0).current(6.25).build())).isEqualTo(0.0);
    }

    @Test
    void efficiency_averages_rpm_and_power_parts() {
        // rpm 2200/2750 = 80%; power 150 W vs optimal 150 W = 100%
        SensorSnapshot s = OPTIMUM.toBuilder().rpm(2200.0).build();
        assertThat(scorer.efficiency(s)).isCloseTo(90.0, within(1e-9));
    }

    // ---- overall ----

    @Test
    void overall_is_the_weighted_sum() {
        HealthBreakdown h = scorer.score(HEALTHY, List.of());

        // 100*0.30 + 100*0.35 + 100*0.25 + 50*0.10
        assertThat(h.getOverall()).isEqualTo(95.0);
        assertThat(h.getPredictive()).isEqualTo(50.0);
        assertThat(h.getHealthStatus()).isEqualTo(HealthStatus.EXCELLENT);
        assertThat(h.statusLabel()).isEqualTo("Excellent");
        assertThat(h.statusClass()).isEqualTo("success");
        assertThat(h.issuesFor(HealthBreakdown.ELECTRICAL)).isEmpty();
        assertThat(h.issuesFor(HealthBreakdown.PREDICTIVE)).containsExactly("Insufficient data for prediction");
    }

    @Test
    void missing_thermal_data_pulls_overall_down() {
        HealthBreakdown h = scorer.score(OPTIMUM, List.of());

        assertThat(h.getThermal()).isEqualTo(0.0);
        assertThat(h.getOverall()).isEqualTo(60.0);
        assertThat(h.getHealthStatus()).isEqualTo(HealthStatus.WARNING);
    }

    @Test
    void empty_snapshot_is_critical() {
        HealthBreakdown h = scorer.score(SensorSnapshot.EMPTY, List.of());

        assertThat(h.getOverall()).isEqualTo(5.0);
        assertThat(h.getHealthStatus()).isEqualTo(HealthStatus.CRITICAL);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1e9, -1, 0.001, 1e6, 1e12, Double.MAX_VALUE, Double.POSITIVE_INFINITY})
    void every_score_stays_within_bounds(double v) {
        SensorSnapshot s = SensorSnapshot.builder()
                .voltage(v).current(v).rpm(v)
                .motorTempC(v).ambientTempC(v).humidity(v)
                .build();
        List<HistoricalReading> rows = HistoryFixtures.newestFirst(HistoryFixtures.chronological(20,
                i -> SensorSnapshot.builder().motorTempC(10.0 * i).current(i % 2 == 0 ? 1.0 : 20.0).build(),
                i -> 100.0 - 5 * i));

        HealthBreakdown h = scorer.score(s, rows);

        for (double score : new double[]{h.getOverall(), h.getElectrical(), h.getThermal(),
                h.getMechanical(), h.getPredictive(), h.getEfficiency()}) {
            assertThat(score).isBetween(0.0, 100.0);
        }
    }
}
