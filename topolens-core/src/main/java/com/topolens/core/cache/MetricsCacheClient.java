package com.topolens.core.cache;

import com.topolens.core.ingest.RawSeries;
import com.topolens.timeseries.TimeContext;
import java.util.List;

/** Read access to the metrics cache of one project. */
public interface MetricsCacheClient {

    /** Latest timestamp available in the cache, epoch seconds; 0 when the cache is empty. */
    long getTo() throws MetricsQueryException;

    /** Evaluates {@code expression} over the window, tagging every returned series with {@code queryName}. */
    List<RawSeries> queryRange(String queryName, String expression, TimeContext ctx) throws MetricsQueryException;
}
