package com.topolens.timeseries;

import java.util.function.BinaryOperator;

/**
 * Operations combining whole series.
 *
 * <p>Every operation tolerates {@code null} operands, which stand for "no series", and returns
 * {@code null} when the result is undefined.
 */
public final class TimeSeriesOps {

    private TimeSeriesOps() {}

    /**
     * Per-step increase of the monotonic counter {@code x}, gated by the liveness series
     * {@code status}.
     *
     * <ul>
     *   <li>current and previous present: {@code curr - prev}, or {@code curr} alone when the counter
     *       went down (reset from zero);
     *   <li>previous missing while {@code status} was 1 at the previous step: {@code curr}, the
     *       first value after a start counts in full;
     *   <li>otherwise missing.
     * </ul>
     */
    public static TimeSeries increase(TimeSeries x, TimeSeries status) {
        if (x == null || status == null) {
            return null;
        }
        float[] data = new float[x.size()];
        float prev = TimeSeries.NaN;
        float prevStatus = TimeSeries.NaN;
        TimeSeriesIterator iter = x.iterator();
        TimeSeriesIterator statusIter = status.iterator();
        int i = 0;
        while (iter.next() && statusIter.next()) {
            float v = iter.value();
            float d = TimeSeries.NaN;
            if (!Float.isNaN(v) && !Float.isNaN(prev)) {
                d = v - prev >= 0 ? v - prev : v;
            } else if (Float.isNaN(prev) && prevStatus == 1) {
                d = v;
            }
            prev = v;
            prevStatus = statusIter.value();
            data[i++] = d;
        }
        for (; i < data.length; i++) {
            data[i] = TimeSeries.NaN;
        }
        return TimeSeries.of(x.from(), x.step(), data);
    }

    /** Point-wise combination of two series of the same shape. */
    public static TimeSeries aggregate2(TimeSeries x, TimeSeries y, BinaryOperator<Float> f) {
        if (x == null || !x.sameShape(y)) {
            return null;
        }
        float[] data = new float[x.size()];
        TimeSeriesIterator xIter = x.iterator();
        TimeSeriesIterator yIter = y.iterator();
        int i = 0;
        while (xIter.next() && yIter.next()) {
            data[i++] = f.apply(xIter.value(), yIter.value());
        }
        return TimeSeries.of(x.from(), x.step(), data);
    }

    public static TimeSeries mul(TimeSeries x, TimeSeries y) {
        return aggregate2(x, y, (a, b) -> a * b);
    }

    /** Division; a zero divisor yields a missing point. */
    public static TimeSeries div(TimeSeries x, TimeSeries y) {
        return aggregate2(x, y, (a, b) -> b == 0 ? TimeSeries.NaN : a / b);
    }

    public static TimeSeries sub(TimeSeries x, TimeSeries y) {
        return aggregate2(x, y, (a, b) -> a - b);
    }

    public static TimeSeries sum(TimeSeries x, TimeSeries y) {
        return aggregate2(x, y, (a, b) -> a + b);
    }

    /**
     * Folds {@code ts} into the accumulator {@code acc} with {@code f}. A {@code null} accumulator
     * starts as a copy of {@code ts}; a series of a different shape leaves the accumulator as is.
     */
    public static TimeSeries merge(TimeSeries acc, TimeSeries ts, Reducer f) {
        if (ts == null) {
            return acc;
        }
        if (acc == null) {
            return ts.copy();
        }
        if (!acc.sameShape(ts)) {
            return acc;
        }
        float[] data = new float[acc.size()];
        TimeSeriesIterator accIter = acc.iterator();
        TimeSeriesIterator iter = ts.iterator();
        int i = 0;
        while (accIter.next() && iter.next()) {
            data[i++] = f.apply(accIter.time(), accIter.value(), iter.value());
        }
        return TimeSeries.of(acc.from(), acc.step(), data);
    }
}
