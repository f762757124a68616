package com.elssolution.motormonitor.analysis;

import java.util.Locale;
import java.util.function.DoublePredicate;

/**
 * One threshold band: when {@code breached} matches, deduct {@code deduction}
 * and report {@code issueTemplate} formatted with the offending value.
 */
public record BandRule(String name, DoublePredicate breached, double deduction, String issueTemplate) {

    public static BandRule below(String name, double limit, double deduction, String issueTemplate) {
        return new BandRule(name, v -> v < limit, deduction, issueTemplate);
    }

    public static BandRule above(String name, double limit, double deduction, String issueTemplate) {
        return new BandRule(name, v -> v > limit, deduction, issueTemplate);
    }

    public String issue(double value) {
        return String.format(Locale.ROOT, issueTemplate, value);
    }
}
