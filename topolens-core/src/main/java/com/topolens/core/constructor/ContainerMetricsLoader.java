package com.topolens.core.constructor;

import com.topolens.core.ingest.MetricQuery;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.AvailabilitySli;
import com.topolens.core.model.Connection;
import com.topolens.core.model.Container;
import com.topolens.core.model.Instance;
import com.topolens.core.model.LabelSet;
import com.topolens.core.model.LatencySli;
import com.topolens.core.model.LogLevel;
import com.topolens.core.model.MetricValues;
import com.topolens.core.model.Service;
import com.topolens.timeseries.Aggregate;
import com.topolens.timeseries.Reducer;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.TimeSeriesOps;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Handlers for container resource usage, log, request and connection metrics. */
@Slf4j
@Component
public class ContainerMetricsLoader {

    static final String INF = "+Inf";

    Map<MetricQuery, MetricHandler> handlers() {
        Map<MetricQuery, MetricHandler> handlers = new EnumMap<>(MetricQuery.class);
        handlers.put(MetricQuery.KUBE_POD_CONTAINER_STATUS_RESTARTS_TOTAL, this::containerMetrics);
        handlers.put(MetricQuery.CONTAINER_CPU_USAGE, this::containerMetrics);
        handlers.put(MetricQuery.CONTAINER_MEMORY_RSS, this::containerMetrics);
        handlers.put(MetricQuery.CONTAINER_OOM_KILLS_TOTAL, this::containerMetrics);
        handlers.put(MetricQuery.CONTAINER_LOG_MESSAGES, this::logMessages);
        handlers.put(MetricQuery.CONTAINER_HTTP_REQUESTS, this::requests);
        handlers.put(MetricQuery.CONTAINER_HTTP_REQUESTS_HISTOGRAM, this::requestsHistogram);
        handlers.put(MetricQuery.CONTAINER_NET_TCP_ACTIVE_CONNECTIONS, this::connections);
        return handlers;
    }

    void containerMetrics(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null || m.labels().container().isEmpty()) {
                continue;
            }
            Container container = instance.getOrCreateContainer(m.labels().container());
            TimeSeries values = m.values();
            switch (query) {
                case CONTAINER_CPU_USAGE -> container.setCpuUsage(
                        TimeSeriesOps.merge(container.getCpuUsage(), values, Reducer.ANY));
                case CONTAINER_MEMORY_RSS -> container.setMemoryRss(
                        TimeSeriesOps.merge(container.getMemoryRss(), values, Reducer.ANY));
                case KUBE_POD_CONTAINER_STATUS_RESTARTS_TOTAL -> container.setRestarts(TimeSeriesOps.merge(
                        container.getRestarts(), TimeSeriesOps.increase(values, running(instance, values)),
                        Reducer.NAN_SUM));
                case CONTAINER_OOM_KILLS_TOTAL -> container.setOomKills(TimeSeriesOps.merge(
                        container.getOomKills(), TimeSeriesOps.increase(values, running(instance, values)),
                        Reducer.NAN_SUM));
                default -> log.debug("no container metric handling for {}", query);
            }
        }
    }

    void logMessages(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            LogLevel level = LogLevel.fromLabel(m.labels().level());
            instance.addLogMessages(level, TimeSeriesOps.increase(m.values(), running(instance, m.values())));
        }
    }

    void requests(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            ConstructionContext.SliAccumulator sli = ctx.sli(instance.getOwnerId());
            sli.totalRequests.add(m.values());
            if (m.labels().status().startsWith("5")) {
                sli.failedRequests.add(m.values());
            }
        }
    }

    void requestsHistogram(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            Float le = parseLe(m.labels().le());
            if (le == null) {
                log.warn("invalid histogram bucket bound: {}", m.labels().le());
                continue;
            }
            ctx.sli(instance.getOwnerId()).histogram.computeIfAbsent(le, k -> new Aggregate()).add(m.values());
        }
    }

    void connections(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            String serviceIp = IpAddresses.host(m.labels().destination());
            String actualIp = IpAddresses.host(m.labels().actualDestination());
            Connection connection = new Connection(instance.ref(), serviceIp, actualIp, m.values());
            instance.getUpstreams().add(connection);
            Service service = ctx.world().getServiceByClusterIp(serviceIp);
            if (service != null) {
                service.getConnections().add(connection);
            }
        }
    }

    /** Turns the per-application request aggregates into SLIs. */
    void complete(ConstructionContext ctx) {
        for (Map.Entry<ApplicationId, ConstructionContext.SliAccumulator> e : ctx.slis().entrySet()) {
            Application app = ctx.world().getApplication(e.getKey());
            if (app == null) {
                continue;
            }
            ConstructionContext.SliAccumulator acc = e.getValue();
            TimeSeries total = acc.totalRequests.get();
            if (total != null) {
                TimeSeries failed = acc.failedRequests.get();
                app.getAvailabilitySlis().add(new AvailabilitySli(total, failed != null ? failed : total.withNewValue(0)));
            }
            if (!acc.histogram.isEmpty()) {
                List<LatencySli.Bucket> buckets = new ArrayList<>();
                acc.histogram.forEach((le, agg) -> buckets.add(new LatencySli.Bucket(le, agg.get())));
                app.getLatencySlis().add(new LatencySli(buckets));
            }
        }
    }

    static Float parseLe(String le) {
        if (INF.equals(le)) {
            return Float.POSITIVE_INFINITY;
        }
        try {
            return Float.parseFloat(le);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Running series of the pod, or an all-missing series so only consecutive samples count. */
    private static TimeSeries running(Instance instance, TimeSeries like) {
        if (instance.getPod() != null && instance.getPod().getRunning() != null) {
            return instance.getPod().getRunning();
        }
        return like.withNewValue(TimeSeries.NaN);
    }

    private static Instance knownPod(ConstructionContext ctx, LabelSet labels) {
        Instance instance = ctx.podByName(labels);
        if (instance == null) {
            log.warn("unknown pod: {} {}", labels.pod(), labels.namespace());
        }
        return instance;
    }
}
