package com.elssolution.motormonitor.service;

public enum AnalysisStatus {
    INITIALIZING("Initializing"),
    ACTIVE("Active"),
    WAITING_FOR_DATA("Waiting for data"),
    ERROR("Error");

    private final String label;

    AnalysisStatus(String label) {
        this.label = label;
    }

    public String label() { return label; }
}
