package com.elssolution.motormonitor.integration.controller;

/** One blocking read of the poll device. Never called with the state lock held. */
public interface ControllerReader {

    ControllerRegisters read() throws ControllerReadException;

    /** host:port/unit, for logs and status. */
    String endpoint();
}
