package com.elssolution.motormonitor.domain;

import java.util.List;
import java.util.OptionalDouble;

public final class Maths {
    private static final double EPS = 1e-9;

    private Maths() {}

    public static double safeDiv(double num, double den) {
        return Math.abs(den) < EPS ? 0.0 : num / den;
    }

    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /** Half-up rounding to one decimal place. */
    public static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    /**
     * Least-squares slope of {@code ys} against their index 0..n-1.
     * Empty when fewer than two points, a value is not finite, or the fit is degenerate.
     */
    public static OptionalDouble slope(List<Double> ys) {
        int n = ys.size();
        if (n < 2) return OptionalDouble.empty();

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            Double y = ys.get(i);
            if (y == null || !Double.isFinite(y)) return OptionalDouble.empty();
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double den = n * sumXX - sumX * sumX;
        if (Math.abs(den) < EPS) return OptionalDouble.empty();
        double s = (n * sumXY - sumX * sumY) / den;
        return Double.isFinite(s) ? OptionalDouble.of(s) : OptionalDouble.empty();
    }
}
