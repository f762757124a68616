package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.Severity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maintenance recommendations from the latest health and device connectivity.
 *
 * Rules are independent (several may fire):
 *   - device disconnected           -> HIGH connection alert (one per device)
 *   - overall < 60                  -> CRITICAL health alert
 *   - electrical/thermal/mechanical < 70 -> MEDIUM category warning
 *
 * Output is stable-sorted by priority rank (CRITICAL first) and capped.
 *
 * The two connection alerts carry distinct types ("Sensor Module Connection Alert",
 * "Controller Connection Alert") rather than one shared "Connection Alert". Alert
 * deduplication keys on type, so an outage of each device is persisted on its own
 * instead of the second one being suppressed inside the window.
 */
@Component
public class RecommendationEngine {

    static final double CRITICAL_OVERALL = 60.0;
    static final double CATEGORY_WARNING = 70.0;

    private final int maxRecommendations;

    public RecommendationEngine(@Value("${motor.recommendations.max:10}") int maxRecommendations) {
        this.maxRecommendations = Math.max(1, maxRecommendations);
    }

    public List<Recommendation> generate(HealthBreakdown health, Map<Device, Boolean> connected) {
        List<Recommendation> out = new ArrayList<>();

        if (!connected.getOrDefault(Device.SENSOR_MODULE, false)) {
            out.add(Recommendation.builder()
                    .type("Sensor Module Connection Alert")
                    .category("System")
                    .severity(Severity.HIGH).priority(Severity.HIGH)
                    .title("Sensor Module Disconnected")
                    .description("Sensor module not responding")
                    .action("Check sensor module power and network connectivity")
                    .confidence(1.0)
                    .build());
        }

        if (!connected.getOrDefault(Device.CONTROLLER, false)) {
            out.add(Recommendation.builder()
                    .type("Controller Connection Alert")
                    .category("System")
                    .severity(Severity.HIGH).priority(Severity.HIGH)
                    .title("PLC Controller Disconnected")
                    .description("PLC controller not responding to register reads")
                    .action("Check controller network and Modbus TCP settings")
                    .confidence(1.0)
                    .build());
        }

        double overall = health.getOverall();
        if (overall < CRITICAL_OVERALL) {
            out.add(Recommendation.builder()
                    .type("Critical Alert")
                    .category("Health")
                    .severity(Severity.CRITICAL).priority(Severity.CRITICAL)
                    .title("Motor Health Critical")
                    .description(String.format(Locale.ROOT,
                            "Overall health: %.1f%% - Immediate attention required", overall))
                    .action("Stop motor and perform immediate inspection")
                    .confidence(0.95)
                    .build());
        }

        if (health.getElectrical() < CATEGORY_WARNING) {
            out.add(Recommendation.builder()
                    .type("Electrical Warning")
                    .category("Electrical")
                    .severity(Severity.MEDIUM).priority(Severity.MEDIUM)
                    .title("Electrical System Issues")
                    .description("Voltage or current outside optimal range")
                    .action("Check 24V motor connections and measure with multimeter")
                    .confidence(0.8)
                    .build());
        }

        if (health.getThermal() < CATEGORY_WARNING) {
            out.add(Recommendation.builder()
                    .type("Temperature Warning")
                    .category("Thermal")
                    .severity(Severity.MEDIUM).priority(Severity.MEDIUM)
                    .title("Thermal Issues")
                    .description("Temperature above optimal levels")
                    .action("Improve ventilation and check cooling system")
                    .confidence(0.85)
                    .build());
        }

        if (health.getMechanical() < CATEGORY_WARNING) {
            out.add(Recommendation.builder()
                    .type("Mechanical Warning")
                    .category("Mechanical")
                    .severity(Severity.MEDIUM).priority(Severity.MEDIUM)
                    .title("Mechanical Issues")
                    .description("RPM or load outside optimal range")
                    .action("Inspect bearings and check coupling alignment")
                    .confidence(0.8)
                    .build());
        }

        return rank(out, maxRecommendations);
    }

    /** Stable sort by descending priority rank, then truncate to {@code limit}. */
    public static List<Recommendation> rank(List<Recommendation> recommendations, int limit) {
        List<Recommendation> sorted = new ArrayList<>(recommendations);
        sorted.sort(Comparator.comparingInt((Recommendation r) -> r.getPriority().rank()).reversed());
        return List.copyOf(sorted.subList(0, Math.min(limit, sorted.size())));
    }
}
