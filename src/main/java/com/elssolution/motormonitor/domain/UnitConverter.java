package com.elssolution.motormonitor.domain;

/**
 * Controller register scaling.
 *
 * Voltage register: 12-bit ADC, 0..4095 spans 0..30 V.
 * Temperature register: degC = 0.05175 * raw.
 *
 * Non-positive raw values decode to 0.0. That is not a valid reading;
 * callers decide validity from the controller's connectivity flag.
 */
public final class UnitConverter {

    public static final double ADC_FULL_SCALE = 4095.0;
    public static final double VOLTAGE_RANGE = 30.0;
    public static final double TEMPERATURE_COEFF = 0.05175;

    private UnitConverter() {}

    public static double voltageFromRaw(int raw) {
        if (raw <= 0) return 0.0;
        return Maths.round1((raw / ADC_FULL_SCALE) * VOLTAGE_RANGE);
    }

    // no upper clamp: register noise must be sanity-checked by the caller
    public static double temperatureFromRaw(int raw) {
        if (raw <= 0) return 0.0;
        return Maths.round1(raw * TEMPERATURE_COEFF);
    }
}
