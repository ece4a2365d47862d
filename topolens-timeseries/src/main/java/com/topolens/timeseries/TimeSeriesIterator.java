package com.topolens.timeseries;

/**
 * Single-pass cursor over the points of a {@link TimeSeries} in chronological order.
 *
 * <p>Missing points are yielded as {@link TimeSeries#NaN}. Obtain a fresh cursor from the
 * series to iterate again.
 */
public final class TimeSeriesIterator {

    private final long from;
    private final long step;
    private final float[] data;
    private int idx = -1;

    TimeSeriesIterator(long from, long step, float[] data) {
        this.from = from;
        this.step = step;
        this.data = data;
    }

    public boolean next() {
        if (idx + 1 >= data.length) {
            idx = data.length;
            return false;
        }
        idx++;
        return true;
    }

    public long time() {
        return from + idx * step;
    }

    public float value() {
        return data[idx];
    }
}
