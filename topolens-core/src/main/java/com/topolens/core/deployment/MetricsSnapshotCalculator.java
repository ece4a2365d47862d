package com.topolens.core.deployment;

import com.topolens.core.model.Application;
import com.topolens.core.model.AvailabilitySli;
import com.topolens.core.model.Container;
import com.topolens.core.model.Instance;
import com.topolens.core.model.LatencySli;
import com.topolens.core.model.LogLevel;
import com.topolens.core.model.MetricsSnapshot;
import com.topolens.timeseries.Aggregate;
import com.topolens.timeseries.LinearRegression;
import com.topolens.timeseries.Reducer;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.Timestamps;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Totals of an application's health metrics over the window after a rollout. */
@Component
public class MetricsSnapshotCalculator {
    static final String INF_BUCKET = "+Inf";

    public MetricsSnapshot calculate(Application app, long from, long to, long step) {
        long requests = 0;
        long errors = 0;
        if (!app.getAvailabilitySlis().isEmpty()) {
            AvailabilitySli sli = app.getAvailabilitySlis().get(0);
            requests = (long) sumRate(sli.totalRequests(), step);
            errors = (long) sumRate(sli.failedRequests(), step);
        }
        Map<String, Long> latency = new LinkedHashMap<>();
        if (!app.getLatencySlis().isEmpty()) {
            for (LatencySli.Bucket bucket : app.getLatencySlis().get(0).histogram()) {
                latency.put(bucketKey(bucket.le()), (long) sumRate(bucket.timeSeries(), step));
            }
        }

        Aggregate cpuUsage = new Aggregate();
        Aggregate memoryUsage = new Aggregate();
        Aggregate oomKills = new Aggregate();
        Aggregate restarts = new Aggregate();
        Aggregate logErrors = new Aggregate();
        Aggregate logWarnings = new Aggregate();
        for (Instance instance : app.getInstances()) {
            for (Container c : instance.getContainerList()) {
                cpuUsage.add(c.getCpuUsage());
                memoryUsage.add(c.getMemoryRss());
                restarts.add(c.getRestarts());
                oomKills.add(c.getOomKills());
            }
            instance.getLogMessagesByLevel().forEach((level, ts) -> {
                if (level.isError()) {
                    logErrors.add(ts);
                } else if (level == LogLevel.WARNING) {
                    logWarnings.add(ts);
                }
            });
        }

        long memoryLeak = 0;
        LinearRegression lr = LinearRegression.of(memoryUsage.get());
        if (lr != null) {
            memoryLeak = (long) (lr.calc(from + Timestamps.HOUR) - lr.calc(from));
        }
        return new MetricsSnapshot(
                Timestamps.toInstant(to),
                Duration.ofSeconds(to - from),
                requests,
                errors,
                latency,
                sumRate(cpuUsage.get(), step),
                memoryLeak,
                (long) sum(oomKills.get()),
                (long) sum(restarts.get()),
                (long) sum(logErrors.get()),
                (long) sum(logWarnings.get()));
    }

    static String bucketKey(float le) {
        if (Float.isInfinite(le)) {
            return INF_BUCKET;
        }
        return String.format(Locale.ROOT, "%.3f", le);
    }

    /** Integral of a per-second rate: sum of the points times the step. */
    private static float sumRate(TimeSeries ts, long step) {
        return sum(ts) * step;
    }

    private static float sum(TimeSeries ts) {
        if (ts == null) {
            return 0;
        }
        float v = ts.reduce(Reducer.NAN_SUM);
        return Float.isNaN(v) ? 0 : v;
    }
}
