package com.elssolution.motormonitor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Latest known value per metric. Every field is independently nullable;
 * null means "no reading", never zero.
 */
@Value
@Builder(toBuilder = true)
public class SensorSnapshot {

    public static final SensorSnapshot EMPTY = SensorSnapshot.builder().build();

    // ---- sensor module ----
    Double current;          // A
    Double voltage;          // V
    Double rpm;
    Double ambientTempC;
    Double humidity;         // %
    Double ambientTempF;
    Double heatIndexC;
    Double heatIndexF;
    String relay1;
    String relay2;
    String relay3;
    String combinedStatus;   // NOR / BUZ

    // ---- controller ----
    Double motorTempC;
    Double motorVoltage;

    /** Push-device voltage when present, else the controller's. */
    public Double effectiveVoltage() {
        return voltage != null ? voltage : motorVoltage;
    }

    /** kW from effective voltage and current; 0 when either is absent. */
    public double powerKw() {
        Double v = effectiveVoltage();
        if (v == null || current == null) return 0.0;
        return v * current / 1000.0;
    }

    public boolean hasAnyValue() {
        return current != null || voltage != null || rpm != null
                || ambientTempC != null || humidity != null
                || ambientTempF != null || heatIndexC != null || heatIndexF != null
                || relay1 != null || relay2 != null || relay3 != null || combinedStatus != null
                || motorTempC != null || motorVoltage != null;
    }

    public SensorSnapshot withSensorModule(SensorModuleReading r) {
        return toBuilder()
                .current(r.current()).voltage(r.voltage()).rpm(r.rpm())
                .ambientTempC(r.ambientTempC()).humidity(r.humidity())
                .ambientTempF(r.ambientTempF())
                .heatIndexC(r.heatIndexC()).heatIndexF(r.heatIndexF())
                .relay1(r.relay1()).relay2(r.relay2()).relay3(r.relay3())
                .combinedStatus(r.combinedStatus())
                .build();
    }

    public SensorSnapshot withController(double motorTempC, double motorVoltage) {
        return toBuilder().motorTempC(motorTempC).motorVoltage(motorVoltage).build();
    }

    /** Reset every field owned by {@code device} to absent. */
    public SensorSnapshot without(Device device) {
        return switch (device) {
            case SENSOR_MODULE -> toBuilder()
                    .current(null).voltage(null).rpm(null)
                    .ambientTempC(null).humidity(null).ambientTempF(null)
                    .heatIndexC(null).heatIndexF(null)
                    .relay1(null).relay2(null).relay3(null).combinedStatus(null)
                    .build();
            case CONTROLLER -> toBuilder().motorTempC(null).motorVoltage(null).build();
        };
    }
}
