package com.elssolution.motormonitor.web;

import com.elssolution.motormonitor.analysis.RecommendationEngine;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.MaintenanceAlert;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.integration.persistence.TelemetryStore;
import com.elssolution.motormonitor.service.MonitorState;
import com.elssolution.motormonitor.service.MonitorView;
import com.elssolution.motormonitor.service.SensorUpdate;
import com.elssolution.motormonitor.service.StatusUpdate;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class MonitorController {

    static final int MAX_HISTORY_HOURS = 24 * 30;
    static final int MAINTENANCE_ALERT_LIMIT = 10;

    private final MonitorState state;
    private final RecommendationEngine recommendations;
    private final TelemetryStore store;
    private final Clock clock;

    public MonitorController(MonitorState state, RecommendationEngine recommendations,
                             TelemetryStore store, Clock clock) {
        this.state = state;
        this.recommendations = recommendations;
        this.store = store;
        this.clock = clock;
    }

    public record CurrentData(SensorUpdate data, HealthBreakdown health, StatusUpdate status, Instant timestamp) {}

    @GetMapping("/current-data")
    public CurrentData currentData() {
        MonitorView v = state.view();
        return new CurrentData(SensorUpdate.of(v), v.health(), StatusUpdate.of(v), clock.instant());
    }

    @GetMapping("/health-details")
    public HealthBreakdown healthDetails() {
        return state.view().health();
    }

    @GetMapping("/recommendations")
    public Map<String, List<Recommendation>> recommendations() {
        MonitorView v = state.view();
        return Map.of("recommendations", recommendations.generate(v.health(), v.connectedFlags()));
    }

    @GetMapping("/historical-data")
    public Map<String, Object> historicalData(@RequestParam(name = "hours", defaultValue = "24") int hours) {
        int h = Math.max(1, Math.min(hours, MAX_HISTORY_HOURS));
        List<ChartPoint> rows = store.recent(Duration.ofHours(h)).stream().map(ChartPoint::of).toList();
        if (rows.isEmpty()) {
            return Map.of("data", rows, "message", "No data available");
        }
        return Map.of("data", rows);
    }

    @GetMapping("/maintenance-alerts")
    public Map<String, List<MaintenanceAlert>> maintenanceAlerts() {
        return Map.of("alerts", store.unacknowledgedAlerts(MAINTENANCE_ALERT_LIMIT));
    }

    @PostMapping("/acknowledge-alert/{id}")
    public ResponseEntity<ApiResponse> acknowledge(@PathVariable("id") long id) {
        if (store.acknowledge(id)) {
            return ResponseEntity.ok(ApiResponse.success("Alert acknowledged"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("Alert not found"));
    }

    /** Records the operator command; actuation itself happens on the controller side. */
    @PostMapping("/motor-control")
    public ResponseEntity<ApiResponse> motorControl(@RequestBody(required = false) JsonNode body) {
        String command = body == null ? "" : body.path("command").asText("").trim();
        if (command.isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Missing command"));
        }
        log.info("motor_control command={}", command);
        store.logSystemEvent("Manual Control", "Motor", "Command: " + command, "INFO");
        return ResponseEntity.ok(ApiResponse.success("Command " + command + " executed"));
    }
}
