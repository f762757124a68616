package com.elssolution.motormonitor.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Ordered band rules for one metric, evaluated top to bottom; the first match wins.
 * Order the most extreme bands first so that only one band fires per value.
 */
public final class BandTable {

    private final String metric;
    private final List<BandRule> rules;

    public BandTable(String metric, List<BandRule> rules) {
        this.metric = metric;
        this.rules = List.copyOf(rules);
    }

    public static BandTable of(String metric, BandRule... rules) {
        return new BandTable(metric, List.of(rules));
    }

    public String metric() { return metric; }

    public List<BandRule> rules() { return rules; }

    public Optional<Hit> evaluate(double value) {
        for (BandRule r : rules) {
            if (r.breached().test(value)) {
                return Optional.of(new Hit(r.name(), r.deduction(), r.issue(value)));
            }
        }
        return Optional.empty();
    }

    public record Hit(String band, double deduction, String issue) {}
}
