package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HistoricalReading;

import java.util.Locale;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * Trend check over the trailing {@code window} history rows of one metric.
 * At least half the window must hold a value for a fit to be attempted.
 * {@code shown} maps the fitted slope to the value printed in the issue.
 */
public record TrendRule(
        String metric,
        Function<HistoricalReading, Double> extractor,
        int window,
        DoublePredicate breached,
        double deduction,
        String issueTemplate,
        DoubleUnaryOperator shown
) {
    public TrendRule(String metric, Function<HistoricalReading, Double> extractor, int window,
                     DoublePredicate breached, double deduction, String issueTemplate) {
        this(metric, extractor, window, breached, deduction, issueTemplate, DoubleUnaryOperator.identity());
    }

    public int minClean() {
        return Math.max(2, window / 2);
    }

    public String issue(double slope) {
        return String.format(Locale.ROOT, issueTemplate, shown.applyAsDouble(slope));
    }
}
