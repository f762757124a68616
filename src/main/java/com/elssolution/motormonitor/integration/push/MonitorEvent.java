package com.elssolution.motormonitor.integration.push;

/** Outbound event names as seen by dashboard clients. */
public enum MonitorEvent {
    SENSOR_UPDATE("sensor_update"),
    HEALTH_UPDATE("health_update"),
    RECOMMENDATIONS_UPDATE("recommendations_update"),
    CONNECTION_LOST("connection_lost"),
    STATUS_UPDATE("status_update"),
    MAINTENANCE_ALERT("maintenance_alert");

    private final String wireName;

    MonitorEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
