package com.elssolution.motormonitor.support;

import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.MaintenanceAlert;
import com.elssolution.motormonitor.integration.persistence.TelemetryStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryTelemetryStore implements TelemetryStore {

    private final Clock clock;
    private final List<HistoricalReading> history = new ArrayList<>();
    private final List<MaintenanceAlert> alerts = new ArrayList<>();
    private final List<String> systemEvents = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public InMemoryTelemetryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void append(HistoricalReading reading) {
        history.add(reading);
    }

    @Override
    public List<HistoricalReading> recent(Duration window) {
        return since(clock.instant().minus(window));
    }

    @Override
    public synchronized List<HistoricalReading> since(Instant since) {
        return history.stream()
                .filter(r -> !r.timestamp().isBefore(since))
                .sorted(Comparator.comparing(HistoricalReading::timestamp).reversed())
                .toList();
    }

    @Override
    public synchronized boolean hasUnacknowledgedAlertSince(String type, Instant since) {
        return alerts.stream().anyMatch(a -> a.getType().equals(type)
                && !a.isAcknowledged() && !a.getCreatedAt().isBefore(since));
    }

    @Override
    public synchronized MaintenanceAlert append(MaintenanceAlert alert) {
        MaintenanceAlert stored = alert.withId(ids.incrementAndGet());
        alerts.add(stored);
        return stored;
    }

    @Override
    public synchronized boolean acknowledge(long alertId) {
        for (int i = 0; i < alerts.size(); i++) {
            MaintenanceAlert a = alerts.get(i);
            if (a.getId() == alertId) {
                alerts.set(i, a.toBuilder().acknowledged(true).build());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized List<MaintenanceAlert> unacknowledgedAlerts(int limit) {
        return alerts.stream()
                .filter(a -> !a.isAcknowledged())
                .sorted(Comparator.comparing(MaintenanceAlert::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized void logSystemEvent(String eventType, String component, String message, String severity) {
        systemEvents.add(eventType + "|" + component + "|" + message + "|" + severity);
    }

    public synchronized List<HistoricalReading> history() {
        return List.copyOf(history);
    }

    public synchronized List<MaintenanceAlert> alerts() {
        return List.copyOf(alerts);
    }

    public synchronized List<String> systemEvents() {
        return List.copyOf(systemEvents);
    }
}
