package com.topolens.core.cache;

import com.topolens.core.ingest.RawSeries;
import com.topolens.timeseries.TimeContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Serves canned series per query name and records every query issued. */
public class FakeMetricsCacheClient implements MetricsCacheClient {
    private final Map<String, List<RawSeries>> series = new HashMap<>();
    private final List<String> expressions = new ArrayList<>();
    private final List<TimeContext> windows = new ArrayList<>();
    private long to;
    private MetricsQueryException failure;

    public FakeMetricsCacheClient to(long to) {
        this.to = to;
        return this;
    }

    public FakeMetricsCacheClient failWith(MetricsQueryException failure) {
        this.failure = failure;
        return this;
    }

    /** Adds a series whose samples start at {@code from}, one every {@code step}. */
    public FakeMetricsCacheClient add(String queryName, long from, long step, float[] values, String... labels) {
        long[] timestamps = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            timestamps[i] = from + i * step;
        }
        Map<String, String> labelMap = new HashMap<>();
        for (int i = 0; i + 1 < labels.length; i += 2) {
            labelMap.put(labels[i], labels[i + 1]);
        }
        series.computeIfAbsent(queryName, q -> new ArrayList<>())
                .add(new RawSeries(queryName, labelMap, timestamps, values));
        return this;
    }

    public List<String> expressions() {
        return expressions;
    }

    public List<TimeContext> windows() {
        return windows;
    }

    @Override
    public long getTo() throws MetricsQueryException {
        if (failure != null) {
            throw failure;
        }
        return to;
    }

    @Override
    public List<RawSeries> queryRange(String queryName, String expression, TimeContext ctx)
            throws MetricsQueryException {
        if (failure != null) {
            throw failure;
        }
        expressions.add(expression);
        if (!windows.contains(ctx)) {
            windows.add(ctx);
        }
        return series.getOrDefault(queryName, List.of());
    }
}
