package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.MaintenanceAlert;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.Severity;
import com.elssolution.motormonitor.integration.persistence.TelemetryStore;
import com.elssolution.motormonitor.integration.push.EventPublisher;
import com.elssolution.motormonitor.integration.push.MaintenanceAlertNotice;
import com.elssolution.motormonitor.integration.push.MonitorEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Promotes HIGH/CRITICAL recommendations with confidence above 0.8 to persisted
 * maintenance alerts, at most one unacknowledged alert per type within the window.
 */
@Slf4j
@Service
public class AlertDeduplicator {

    static final double MIN_CONFIDENCE = 0.8;

    private final TelemetryStore store;
    private final EventPublisher publisher;
    private final Clock clock;
    private final Duration window;

    public AlertDeduplicator(TelemetryStore store, EventPublisher publisher, Clock clock,
                             @Value("${motor.alerts.dedupWindowMinutes:30}") long windowMinutes) {
        this.store = store;
        this.publisher = publisher;
        this.clock = clock;
        if (windowMinutes <= 0) {
            log.warn("dedupWindowMinutes <= 0 ({}). Using 30.", windowMinutes);
            windowMinutes = 30;
        }
        this.window = Duration.ofMinutes(windowMinutes);
    }

    public static boolean qualifies(Recommendation r) {
        return r.getSeverity().atLeast(Severity.HIGH) && r.getConfidence() > MIN_CONFIDENCE;
    }

    /** @return alerts persisted in this call; suppressed duplicates are left out */
    public List<MaintenanceAlert> promote(List<Recommendation> recommendations) {
        List<MaintenanceAlert> stored = new ArrayList<>();
        for (Recommendation r : recommendations) {
            if (!qualifies(r)) continue;
            submit(r).ifPresent(stored::add);
        }
        return stored;
    }

    public Optional<MaintenanceAlert> submit(Recommendation r) {
        Instant now = clock.instant();
        if (store.hasUnacknowledgedAlertSince(r.getType(), now.minus(window))) {
            if (log.isDebugEnabled()) log.debug("alert_suppressed type={}", r.getType());
            return Optional.empty();
        }
        MaintenanceAlert saved = store.append(MaintenanceAlert.from(r, now));
        log.info("maintenance_alert id={} type={} severity={}", saved.getId(), saved.getType(), saved.getSeverity());
        try {
            publisher.publish(MonitorEvent.MAINTENANCE_ALERT, MaintenanceAlertNotice.of(saved));
        } catch (RuntimeException e) {
            log.warn("publish_failed event={} err={}", MonitorEvent.MAINTENANCE_ALERT.wireName(), e.toString());
        }
        return Optional.of(saved);
    }
}
