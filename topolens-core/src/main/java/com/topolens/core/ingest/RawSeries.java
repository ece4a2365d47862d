package com.topolens.core.ingest;

import java.util.Map;

/**
 * One series as returned by the metrics backend for a logical query: its labels and the
 * {@code (timestamps[i], values[i])} samples, timestamps in epoch seconds.
 */
public record RawSeries(String queryName, Map<String, String> labels, long[] timestamps, float[] values) {

    public RawSeries {
        labels = labels == null ? Map.of() : labels;
        timestamps = timestamps == null ? new long[0] : timestamps;
        values = values == null ? new float[0] : values;
    }

    public int size() {
        return Math.min(timestamps.length, values.length);
    }
}
