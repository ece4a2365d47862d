package com.topolens.timeseries;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Arrays;
import java.util.StringJoiner;

/**
 * Dense fixed-step series of {@code float} samples.
 *
 * <p>Point {@code i} holds the value observed at {@code from + i * step}. The length is fixed at
 * construction: {@link #set} and {@link #fill} only write inside the window and never grow it.
 * Missing samples are {@link #NaN}, a valid observation meaning "no data" that is distinct from 0.
 *
 * <p>Not thread-safe. A series must not be shared between threads while it is being written.
 */
@JsonSerialize(using = TimeSeriesSerializer.class)
public final class TimeSeries {

    public static final float NaN = Float.NaN;

    private final long from;
    private final long step;
    private final float[] data;

    private TimeSeries(long from, long step, float[] data) {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        this.from = from;
        this.step = step;
        this.data = data;
    }

    /** A series of {@code count} missing points. */
    public static TimeSeries empty(long from, int count, long step) {
        float[] data = new float[count];
        Arrays.fill(data, NaN);
        return new TimeSeries(from, step, data);
    }

    public static TimeSeries empty(TimeContext ctx) {
        return empty(ctx.from(), ctx.pointsCount(), ctx.step());
    }

    /** Wraps {@code data} without copying it. */
    public static TimeSeries of(long from, long step, float... data) {
        return new TimeSeries(from, step, data);
    }

    public long from() {
        return from;
    }

    public long step() {
        return step;
    }

    /** Exclusive end of the window. */
    public long to() {
        return from + data.length * step;
    }

    public int size() {
        return data.length;
    }

    public boolean sameShape(TimeSeries other) {
        return other != null && other.from == from && other.step == step && other.data.length == data.length;
    }

    public float get(long t) {
        int idx = indexOf(t);
        return idx < 0 ? NaN : data[idx];
    }

    /** Writes {@code v} at {@code t} truncated to the step; a no-op outside the window. */
    public void set(long t, float v) {
        int idx = indexOf(t);
        if (idx >= 0) {
            data[idx] = v;
        }
    }

    /**
     * Merges {@code src}, sampled from {@code srcFrom} every {@code srcStep}, into the overlapping
     * part of this window.
     *
     * <p>The first source point that lands on a given slot wins and the cursor never moves back,
     * so later points mapping to an already visited slot are skipped. A missing source point never
     * replaces a present value.
     *
     * @return whether at least one present value was written
     */
    public boolean fill(long srcFrom, long srcStep, float[] src) {
        boolean changed = false;
        int next = 0;
        long t = srcFrom - srcStep;
        for (float v : src) {
            t += srcStep;
            if (t >= to()) {
                break;
            }
            if (t < from) {
                continue;
            }
            int idx = (int) ((Timestamps.truncate(t, step) - from) / step);
            if (idx < next) {
                continue;
            }
            next = idx + 1;
            if (Float.isNaN(v)) {
                continue;
            }
            data[idx] = v;
            changed = true;
        }
        return changed;
    }

    public TimeSeriesIterator iterator() {
        return new TimeSeriesIterator(from, step, data);
    }

    public float last() {
        return data.length == 0 ? NaN : data[data.length - 1];
    }

    /** The last {@code n} points, left-padded with missing values when the series is shorter. */
    public float[] lastN(int n) {
        float[] res = new float[n];
        Arrays.fill(res, NaN);
        int offset = data.length - n;
        if (offset < 0) {
            System.arraycopy(data, 0, res, -offset, data.length);
        } else {
            System.arraycopy(data, offset, res, 0, n);
        }
        return res;
    }

    /** The latest present point, or {@code null} when every point is missing. */
    public Point lastNotNull() {
        for (int i = data.length - 1; i >= 0; i--) {
            if (!Float.isNaN(data[i])) {
                return new Point(from + i * step, data[i]);
            }
        }
        return null;
    }

    public float reduce(Reducer f) {
        float acc = NaN;
        TimeSeriesIterator iter = iterator();
        while (iter.next()) {
            acc = f.apply(iter.time(), acc, iter.value());
        }
        return acc;
    }

    public TimeSeries map(Mapper f) {
        float[] res = new float[data.length];
        TimeSeriesIterator iter = iterator();
        int i = 0;
        while (iter.next()) {
            res[i++] = f.apply(iter.time(), iter.value());
        }
        return new TimeSeries(from, step, res);
    }

    public TimeSeries withNewValue(float v) {
        float[] res = new float[data.length];
        Arrays.fill(res, v);
        return new TimeSeries(from, step, res);
    }

    public TimeSeries copy() {
        return new TimeSeries(from, step, data.clone());
    }

    public boolean isAllMissing() {
        return lastNotNull() == null;
    }

    private int indexOf(long t) {
        t = Timestamps.truncate(t, step);
        if (t < from) {
            return -1;
        }
        long idx = (t - from) / step;
        return idx < data.length ? (int) idx : -1;
    }

    @Override
    public String toString() {
        StringJoiner values = new StringJoiner(" ", "[", "]");
        for (float v : data) {
            values.add(Float.isNaN(v) ? "." : formatValue(v));
        }
        return "TimeSeries(" + from + ", " + data.length + ", " + step + ", " + values + ")";
    }

    private static String formatValue(float v) {
        if (v == (long) v) {
            return Long.toString((long) v);
        }
        return Float.toString(v);
    }

    /** A single {@code (time, value)} observation. */
    public record Point(long time, float value) {}
}
