package com.elssolution.motormonitor.alerts;

/**
 * Conditions under which the monitor itself is degraded. Each has a fixed level;
 * none of them is about the motor (that is what maintenance alerts are for).
 */
public enum OperationalAlert {
    CONTROLLER_UNREACHABLE(Level.ERROR, "PLC"),
    CONTROLLER_UNCAUGHT(Level.CRITICAL, "PLC"),
    ANALYSIS_FAILED(Level.ERROR, "ANALYSIS"),
    HISTORY_UNAVAILABLE(Level.WARN, "STORE"),
    PERSISTENCE_FAILED(Level.ERROR, "STORE"),
    LIVENESS_SWEEP_FAILED(Level.WARN, "LIVENESS"),
    UNCAUGHT(Level.CRITICAL, "SYSTEM");

    public enum Level { WARN, ERROR, CRITICAL }

    private final Level level;
    private final String component;

    OperationalAlert(Level level, String component) {
        this.level = level;
        this.component = component;
    }

    public Level level() { return level; }

    public String component() { return component; }
}
