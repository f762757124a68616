package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HealthStatus;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine(10);

    private static final Map<Device, Boolean> BOTH_UP = Map.of(Device.SENSOR_MODULE, true, Device.CONTROLLER, true);

    private static HealthBreakdown health(double overall, double electrical, double thermal, double mechanical) {
        return HealthBreakdown.builder()
                .overall(overall).electrical(electrical).thermal(thermal).mechanical(mechanical)
                .predictive(100).healthStatus(HealthStatus.fromScore(overall))
                .build();
    }

    private static Recommendation rec(String type, Severity s) {
        return Recommendation.builder().type(type).severity(s).priority(s).confidence(0.9).build();
    }

    @Test
    void healthy_and_connected_gives_nothing() {
        assertThat(engine.generate(health(95, 100, 100, 100), BOTH_UP)).isEmpty();
    }

    @Test
    void ranking_is_stable_by_priority() {
        List<Recommendation> ranked = RecommendationEngine.rank(List.of(
                rec("medium-a", Severity.MEDIUM),
                rec("high", Severity.HIGH),
                rec("medium-b", Severity.MEDIUM),
                rec("critical", Severity.CRITICAL)), 10);

        assertThat(ranked).extracting(Recommendation::getType)
                .containsExactly("critical", "high", "medium-a", "medium-b");
    }

    @Test
    void rules_fire_independently_and_are_ranked() {
        List<Recommendation> recs = engine.generate(health(50, 60, 65, 100),
                Map.of(Device.SENSOR_MODULE, true, Device.CONTROLLER, false));

        assertThat(recs).extracting(Recommendation::getPriority)
                .containsExactly(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.MEDIUM);
        assertThat(recs).extracting(Recommendation::getType)
                .containsExactly("Critical Alert", "Controller Connection Alert",
                        "Electrical Warning", "Temperature Warning");
        assertThat(recs.get(0).getDescription())
                .isEqualTo("Overall health: 50.0% - Immediate attention required");
        assertThat(recs.get(0).getConfidence()).isEqualTo(0.95);
    }

    @Test
    void each_disconnected_device_gets_its_own_alert_type() {
        List<Recommendation> recs = engine.generate(health(95, 100, 100, 100), Map.of());

        assertThat(recs).extracting(Recommendation::getType)
                .containsExactly("Sensor Module Connection Alert", "Controller Connection Alert");
        assertThat(recs).allSatisfy(r -> {
            assertThat(r.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(r.getConfidence()).isEqualTo(1.0);
        });
    }

    @Test
    void thresholds_are_strict() {
        assertThat(engine.generate(health(60, 70, 70, 70), BOTH_UP)).isEmpty();
        assertThat(engine.generate(health(59.9, 69.9, 70, 70), BOTH_UP))
                .extracting(Recommendation::getType)
                .containsExactly("Critical Alert", "Electrical Warning");
    }

    @Test
    void output_is_capped() {
        RecommendationEngine two = new RecommendationEngine(2);

        List<Recommendation> recs = two.generate(health(10, 10, 10, 10), Map.of());

        assertThat(recs).hasSize(2);
        assertThat(recs).extracting(Recommendation::getPriority).containsExactly(Severity.CRITICAL, Severity.HIGH);
    }
}
