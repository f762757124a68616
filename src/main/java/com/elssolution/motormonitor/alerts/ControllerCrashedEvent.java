package com.elssolution.motormonitor.alerts;

public record ControllerCrashedEvent(Throwable cause) {}
