package com.topolens.timeseries;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates any number of series with a reducer, without knowing the final count up front.
 *
 * <p>The folded series is materialised on {@link #get()} and cached until the next {@link #add}.
 * Series whose shape differs from the first one added are ignored.
 */
public final class Aggregate {

    private final Reducer reducer;
    private final List<TimeSeries> input = new ArrayList<>();
    private TimeSeries result;

    public Aggregate() {
        this(Reducer.NAN_SUM);
    }

    public Aggregate(Reducer reducer) {
        this.reducer = reducer;
    }

    public Aggregate add(TimeSeries... series) {
        for (TimeSeries ts : series) {
            if (ts == null) {
                continue;
            }
            if (!input.isEmpty() && !input.get(0).sameShape(ts)) {
                continue;
            }
            input.add(ts);
            result = null;
        }
        return this;
    }

    public boolean isEmpty() {
        return input.isEmpty();
    }

    /** The folded series, or {@code null} when nothing was added. */
    public TimeSeries get() {
        if (input.isEmpty()) {
            return null;
        }
        if (result == null) {
            TimeSeries acc = null;
            for (TimeSeries ts : input) {
                acc = TimeSeriesOps.merge(acc, ts, reducer);
            }
            result = acc;
        }
        return result;
    }
}
