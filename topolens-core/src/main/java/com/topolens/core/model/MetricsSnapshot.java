package com.topolens.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Totals of an application's health metrics over a fixed window after a rollout.
 *
 * @param latency request count per histogram bucket, keyed by the bucket upper bound formatted
 *     with three decimals
 * @param cpuUsage CPU seconds consumed over the window
 * @param memoryLeak fitted memory growth over one hour, in bytes
 */
public record MetricsSnapshot(
        Instant timestamp,
        Duration duration,
        long requests,
        long errors,
        Map<String, Long> latency,
        float cpuUsage,
        long memoryLeak,
        long oomKills,
        long restarts,
        long logErrors,
        long logWarnings) {

    public MetricsSnapshot {
        latency = latency == null ? Map.of() : Map.copyOf(latency);
    }
}
