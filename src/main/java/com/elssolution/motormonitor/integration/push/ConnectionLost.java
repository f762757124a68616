package com.elssolution.motormonitor.integration.push;

public record ConnectionLost(String component, String message, long timeoutSeconds) {}
