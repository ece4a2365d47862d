package com.topolens.core.ingest;

import com.topolens.core.model.LabelSet;
import com.topolens.core.model.MetricValues;
import com.topolens.timeseries.Reducer;
import com.topolens.timeseries.TimeContext;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.TimeSeriesOps;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups raw series by catalog query, placing every sample on the window grid. Series of
 * unknown queries are ignored; samples outside the window are dropped.
 */
@Component
@Slf4j
public class MetricsIngestAdapter {

    public Map<MetricQuery, List<MetricValues>> group(TimeContext ctx, List<RawSeries> raw) {
        Map<MetricQuery, Map<LabelSet, TimeSeries>> grouped = new EnumMap<>(MetricQuery.class);
        for (RawSeries series : raw) {
            Optional<MetricQuery> query = MetricQuery.fromQueryName(series.queryName());
            if (query.isEmpty()) {
                log.debug("Ignoring series of unknown query {}", series.queryName());
                continue;
            }
            TimeSeries ts = TimeSeries.empty(ctx);
            for (int i = 0; i < series.size(); i++) {
                ts.set(series.timestamps()[i], series.values()[i]);
            }
            grouped.computeIfAbsent(query.get(), q -> new LinkedHashMap<>())
                    .merge(LabelSet.of(series.labels()), ts, (acc, v) -> TimeSeriesOps.merge(acc, v, Reducer.ANY));
        }
        Map<MetricQuery, List<MetricValues>> result = new EnumMap<>(MetricQuery.class);
        grouped.forEach((query, byLabels) -> {
            List<MetricValues> values = new ArrayList<>(byLabels.size());
            byLabels.forEach((labels, ts) -> values.add(new MetricValues(labels, ts)));
            result.put(query, values);
        });
        return result;
    }
}
