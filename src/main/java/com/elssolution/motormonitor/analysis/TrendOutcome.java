package com.elssolution.motormonitor.analysis;

/** Result of fitting one metric's trailing samples. */
public record TrendOutcome(Kind kind, String metric, double slope, String detail) {

    public enum Kind { STABLE, TREND_DETECTED, INSUFFICIENT_DATA, COMPUTATION_ERROR }

    static TrendOutcome stable(String metric, double slope) {
        return new TrendOutcome(Kind.STABLE, metric, slope, null);
    }

    static TrendOutcome detected(String metric, double slope, String issue) {
        return new TrendOutcome(Kind.TREND_DETECTED, metric, slope, issue);
    }

    static TrendOutcome insufficient(String metric, int clean, int needed) {
        return new TrendOutcome(Kind.INSUFFICIENT_DATA, metric, Double.NaN,
                metric + ": " + clean + "/" + needed + " clean samples");
    }

    static TrendOutcome error(String metric, String why) {
        return new TrendOutcome(Kind.COMPUTATION_ERROR, metric, Double.NaN, why);
    }
}
