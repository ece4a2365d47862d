package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;
import java.util.List;

/** Cumulative latency histogram; buckets are ordered by upper bound. */
public record LatencySli(List<Bucket> histogram) {

    /** Rate of requests that completed within {@code le} seconds. */
    public record Bucket(float le, TimeSeries timeSeries) {}
}
