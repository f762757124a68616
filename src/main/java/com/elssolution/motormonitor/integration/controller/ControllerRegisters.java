package com.elssolution.motormonitor.integration.controller;

/** Raw unsigned 16-bit register values, before unit conversion. */
public record ControllerRegisters(int rawVoltage, int rawTemperature) {}
