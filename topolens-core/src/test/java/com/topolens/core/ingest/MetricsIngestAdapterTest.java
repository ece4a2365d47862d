package com.topolens.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.topolens.core.model.MetricValues;
import com.topolens.timeseries.TimeContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsIngestAdapterTest {
    private static final TimeContext CTX = new TimeContext(1_700_000_040L, 1_700_000_040L + 240, 60);

    private final MetricsIngestAdapter adapter = new MetricsIngestAdapter();

    @Test
    void placesSamplesOnTheWindowGrid() {
        RawSeries raw = new RawSeries(
                "kube_pod_info",
                Map.of("pod", "api-1"),
                new long[] {1_700_000_040L, 1_700_000_165L, 1_700_000_400L},
                new float[] {1, 2, 3});

        Map<MetricQuery, List<MetricValues>> grouped = adapter.group(CTX, List.of(raw));

        MetricValues values = grouped.get(MetricQuery.KUBE_POD_INFO).get(0);
        assertThat(values.labels().pod()).isEqualTo("api-1");
        assertThat(values.values().lastN(4)).containsExactly(1f, Float.NaN, 2f, Float.NaN);
    }

    @Test
    void mergesSeriesWithIdenticalLabels() {
        Map<String, String> labels = Map.of("uid", "u1", "condition", "true");
        RawSeries first = new RawSeries(
                "kube_pod_status_ready", labels, new long[] {1_700_000_040L}, new float[] {1});
        RawSeries second = new RawSeries(
                "kube_pod_status_ready", labels, new long[] {1_700_000_040L, 1_700_000_100L}, new float[] {0, 0});

        List<MetricValues> values = adapter.group(CTX, List.of(first, second)).get(MetricQuery.KUBE_POD_STATUS_READY);

        assertThat(values).hasSize(1);
        assertThat(values.get(0).values().lastN(4)).containsExactly(1f, 0f, Float.NaN, Float.NaN);
    }

    @Test
    void ignoresUnknownQueries() {
        RawSeries raw = new RawSeries("up", Map.of(), new long[] {1_700_000_040L}, new float[] {1});

        assertThat(adapter.group(CTX, List.of(raw))).isEmpty();
    }

    @Test
    void expressionsCarryTheExtraSelector() {
        assertThat(MetricQuery.KUBE_POD_INFO.expression("")).isEqualTo("kube_pod_info");
        assertThat(MetricQuery.CONTAINER_CPU_USAGE.expression("cluster=\"eu\""))
                .isEqualTo("rate(container_resources_cpu_usage_seconds_total{cluster=\"eu\"}[5m])");
        assertThat(MetricQuery.fromQueryName("kube_service_info")).contains(MetricQuery.KUBE_SERVICE_INFO);
    }
}
