package com.elssolution.motormonitor.domain;

/** The two field devices of one deployment. */
public enum Device {
    /** Push-based sensor module (current, voltage, rpm, climate, relays). */
    SENSOR_MODULE("ESP", "Sensor module"),
    /** Poll-based programmable controller (motor temperature, motor voltage). */
    CONTROLLER("PLC", "PLC controller");

    private final String component;
    private final String displayName;

    Device(String component, String displayName) {
        this.component = component;
        this.displayName = displayName;
    }

    /** Short component tag used in outbound events and system events. */
    public String component() { return component; }

    public String displayName() { return displayName; }
}
