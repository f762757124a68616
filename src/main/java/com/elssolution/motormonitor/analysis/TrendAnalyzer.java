package com.elssolution.motormonitor.analysis;

import com.elssolution.motormonitor.domain.HistoricalReading;
import com.elssolution.motormonitor.domain.Maths;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/** Least-squares slope checks over chronologically ordered history. */
public final class TrendAnalyzer {

    private TrendAnalyzer() {}

    /**
     * @param chronological oldest first
     */
    public static TrendOutcome analyze(TrendRule rule, List<HistoricalReading> chronological) {
        List<Double> clean;
        try {
            int from = Math.max(0, chronological.size() - rule.window());
            clean = new ArrayList<>(rule.window());
            for (HistoricalReading r : chronological.subList(from, chronological.size())) {
                Double v = rule.extractor().apply(r);
                if (v != null && Double.isFinite(v)) clean.add(v);
            }
        } catch (RuntimeException e) {
            return TrendOutcome.error(rule.metric(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (clean.size() < rule.minClean()) {
            return TrendOutcome.insufficient(rule.metric(), clean.size(), rule.minClean());
        }

        OptionalDouble slope = Maths.slope(clean);
        if (slope.isEmpty()) {
            return TrendOutcome.error(rule.metric(), "degenerate fit over " + clean.size() + " samples");
        }
        double s = slope.getAsDouble();
        return rule.breached().test(s)
                ? TrendOutcome.detected(rule.metric(), s, rule.issue(s))
                : TrendOutcome.stable(rule.metric(), s);
    }
}
