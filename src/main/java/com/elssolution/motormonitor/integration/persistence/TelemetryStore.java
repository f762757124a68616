package com.elssolution.motormonitor.integration.persistence;

import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.MaintenanceAlert;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable history and maintenance alerts. Implementations surface failures as
 * Spring {@code DataAccessException}; callers catch them at the cycle boundary.
 */
public interface TelemetryStore {

    void append(HistoricalReading reading);

    /** Rows stamped within {@code window} of now, newest first. */
    List<HistoricalReading> recent(Duration window);

    /** Rows stamped at or after {@code since}, newest first. */
    List<HistoricalReading> since(Instant since);

    boolean hasUnacknowledgedAlertSince(String type, Instant since);

    /** @return the stored alert with its id assigned */
    MaintenanceAlert append(MaintenanceAlert alert);

    /** @return false when no alert has this id */
    boolean acknowledge(long alertId);

    /** Newest first. */
    List<MaintenanceAlert> unacknowledgedAlerts(int limit);

    void logSystemEvent(String eventType, String component, String message, String severity);
}
