package com.elssolution.motormonitor.integration.controller;

public class ControllerReadException extends Exception {

    private final boolean timeout;

    public ControllerReadException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
