package com.elssolution.motormonitor.analysis;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optimal operating point and band limits for a 24 V DC motor.
 * Field initializers are the defaults; override under {@code motor.health.*}.
 */
@Slf4j
@Getter @Setter
@ConfigurationProperties(prefix = "motor.health")
public class HealthThresholds {

    // === Optimal operating point ===
    private double optimalVoltage = 24.0;
    private double optimalCurrent = 6.25;
    private double optimalRpm = 2750.0;

    // === Voltage (24 V +/-15%) ===
    private double voltageCriticalLow = 20.0;
    private double voltageWarningLow = 22.0;
    private double voltageWarningHigh = 26.0;
    private double voltageCriticalHigh = 28.0;

    // === Current (6.25 A +/-30%) ===
    private double currentUnderload = 4.0;
    private double currentOverload = 9.0;
    private double currentCritical = 12.0;

    // === Motor temperature (controller) ===
    private double motorTempElevated = 40.0;
    private double motorTempHigh = 50.0;
    private double motorTempCritical = 60.0;

    // === Environment ===
    private double ambientTempHigh = 30.0;
    private double ambientTempCritical = 35.0;
    private double humidityLow = 30.0;
    private double humidityHigh = 70.0;
    private double humidityCritical = 80.0;

    // === RPM (2750 +/-8%) ===
    private double rpmCriticalLow = 2400.0;
    private double rpmWarningLow = 2600.0;
    private double rpmWarningHigh = 2900.0;
    private double rpmCriticalHigh = 3100.0;

    /** Relative |actual - expected| / expected current above which load is imbalanced. */
    private double imbalanceTolerance = 0.5;

    // === Trend analysis ===
    private int predictiveMinSamples = 5;
    private int motorTempTrendWindow = 10;
    private int currentTrendWindow = 10;
    private int healthTrendWindow = 20;
    /** degC per reading. */
    private double motorTempSlopeMax = 1.0;
    /** A per reading, either direction. */
    private double currentSlopeMax = 0.5;
    /** points per reading; more negative is a breach. */
    private double healthSlopeMin = -1.0;

    /** Repairs values that would break scoring; never fatal. */
    public HealthThresholds sanitized() {
        if (optimalRpm <= 0) {
            log.warn("optimalRpm <= 0 ({}). Using 2750.", optimalRpm);
            optimalRpm = 2750.0;
        }
        if (optimalCurrent <= 0) {
            log.warn("optimalCurrent <= 0 ({}). Using 6.25.", optimalCurrent);
            optimalCurrent = 6.25;
        }
        if (predictiveMinSamples < 2) {
            log.warn("predictiveMinSamples < 2 ({}). Using 5.", predictiveMinSamples);
            predictiveMinSamples = 5;
        }
        motorTempTrendWindow = Math.max(2, motorTempTrendWindow);
        currentTrendWindow = Math.max(2, currentTrendWindow);
        healthTrendWindow = Math.max(2, healthTrendWindow);
        return this;
    }
}
