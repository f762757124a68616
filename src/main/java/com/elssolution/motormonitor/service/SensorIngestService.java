package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.alerts.AlertService;
import com.elssolution.motormonitor.alerts.OperationalAlert;
import com.elssolution.motormonitor.analysis.HealthScorer;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.SensorModuleReading;
import com.elssolution.motormonitor.integration.persistence.TelemetryStore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Push path: parse, merge into shared state, then score the merged snapshot against
 * recent history and append it as one history row. Each row carries the health of its
 * own snapshot; the published health is still the analysis loop's.
 */
@Slf4j
@Service
public class SensorIngestService {

    private final ReadingParser parser;
    private final MonitorState state;
    private final TelemetryStore store;
    private final HealthScorer scorer;
    private final AlertService alerts;
    private final Clock clock;
    private final Duration historyWindow;

    public SensorIngestService(ReadingParser parser, MonitorState state, TelemetryStore store,
                               HealthScorer scorer, AlertService alerts, Clock clock,
                               @Value("${motor.analysis.historyMinutes:120}") long historyMinutes) {
        this.parser = parser;
        this.state = state;
        this.store = store;
        this.scorer = scorer;
        this.alerts = alerts;
        this.clock = clock;
        this.historyWindow = Duration.ofMinutes(historyMinutes > 0 ? historyMinutes : 120);
    }

    /**
     * @return the state after the merge
     * @throws IllegalArgumentException for an absent or empty payload
     */
    public MonitorView ingest(JsonNode payload) {
        SensorModuleReading reading = parser.parse(payload);
        Instant now = clock.instant();
        MonitorView view = state.applySensorReading(reading, now);

        if (log.isDebugEnabled()) {
            log.debug("sensor_push current={}A voltage={}V rpm={}",
                    reading.current(), reading.voltage(), reading.rpm());
        }

        // store I/O and scoring happen outside the state lock; a failure still leaves the live update in place
        HealthBreakdown health = scorer.score(view.snapshot(), recentHistory());
        try {
            store.append(HistoricalReading.of(now, view.snapshot(), view.connectedFlags(), health));
            alerts.resolve(OperationalAlert.PERSISTENCE_FAILED);
        } catch (RuntimeException e) {
            log.warn("history_append_failed: {}", e.toString());
            alerts.raise(OperationalAlert.PERSISTENCE_FAILED, "History append failed: " + e.getMessage());
        }
        return view;
    }

    private List<HistoricalReading> recentHistory() {
        try {
            List<HistoricalReading> history = store.recent(historyWindow);
            alerts.resolve(OperationalAlert.HISTORY_UNAVAILABLE);
            return history;
        } catch (RuntimeException e) {
            log.warn("history_read_failed: {}", e.toString());
            alerts.raise(OperationalAlert.HISTORY_UNAVAILABLE, "History read failed: " + e.getMessage());
            return List.of();
        }
    }
}
