package com.elssolution.motormonitor.domain;

public enum HealthStatus {
    EXCELLENT("Excellent", "success"),
    GOOD("Good", "info"),
    WARNING("Warning", "warning"),
    CRITICAL("Critical", "danger"),
    NO_DATA("No Data", "secondary");

    private final String label;
    private final String cssClass;

    HealthStatus(String label, String cssClass) {
        this.label = label;
        this.cssClass = cssClass;
    }

    public String label() { return label; }

    public String cssClass() { return cssClass; }

    /** Fixed bands: >=90, >=75, >=60, else critical. */
    public static HealthStatus fromScore(double overall) {
        if (overall >= 90) return EXCELLENT;
        if (overall >= 75) return GOOD;
        if (overall >= 60) return WARNING;
        return CRITICAL;
    }
}
