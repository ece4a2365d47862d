package com.topolens.timeseries;

/** Ordinary least squares fit of the present points of a series. */
public final class LinearRegression {

    private final long origin;
    private final double slope;
    private final double intercept;

    private LinearRegression(long origin, double slope, double intercept) {
        this.origin = origin;
        this.slope = slope;
        this.intercept = intercept;
    }

    /** Fits {@code ts}; {@code null} when it has fewer than two present points at distinct times. */
    public static LinearRegression of(TimeSeries ts) {
        if (ts == null) {
            return null;
        }
        long origin = ts.from();
        int n = 0;
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        TimeSeriesIterator iter = ts.iterator();
        while (iter.next()) {
            float v = iter.value();
            if (Float.isNaN(v)) {
                continue;
            }
            // relative time keeps x^2 well inside double precision
            double x = iter.time() - origin;
            n++;
            sumX += x;
            sumY += v;
            sumXY += x * v;
            sumXX += x * x;
        }
        if (n < 2) {
            return null;
        }
        double denominator = n * sumXX - sumX * sumX;
        if (denominator == 0) {
            return null;
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new LinearRegression(origin, slope, intercept);
    }

    /** Value of the fitted line at {@code t}. */
    public float calc(long t) {
        return (float) (intercept + slope * (t - origin));
    }

    /** Change per second. */
    public double slope() {
        return slope;
    }
}
