package com.topolens.core.deployment;

import com.topolens.core.config.TopolensProperties;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentState;
import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.DeploymentSummary;
import com.topolens.core.model.MetricsSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Announceable state of every rollout of an application.
 *
 * <p>A finished rollout with a metrics snapshot is summarized against the snapshot of the rollout
 * before it. A metric counts as degraded when it grew by more than {@link #DEGRADATION_FACTOR} over
 * the previous rollout and exceeds its absolute floor.
 */
@Component
@RequiredArgsConstructor
public class DeploymentStatusCalculator {
    static final double DEGRADATION_FACTOR = 1.2;
    static final double ERROR_SHARE_FLOOR = 1.0;
    static final double SLOW_SHARE_FLOOR = 5.0;
    static final double CPU_CHANGE_LIMIT = 20.0;
    static final long MEMORY_LEAK_FLOOR = 10L * 1024 * 1024;

    private final TopolensProperties properties;

    public List<ApplicationDeploymentStatus> calculate(Application app, Instant now) {
        List<ApplicationDeployment> deployments = app.getDeployments();
        List<ApplicationDeploymentStatus> res = new ArrayList<>(deployments.size());
        Duration stuckAfter = properties.getDeployments().getStuckAfter();
        for (int i = 0; i < deployments.size(); i++) {
            ApplicationDeployment d = deployments.get(i);
            ApplicationDeployment next = i + 1 < deployments.size() ? deployments.get(i + 1) : null;
            if (!d.isFinished()) {
                Duration lifetime = Duration.between(d.getStartedAt(), now);
                if (next != null) {
                    res.add(status(d, ApplicationDeploymentState.CANCELLED, "cancelled by a later rollout",
                            Duration.between(d.getStartedAt(), next.getStartedAt()), List.of()));
                } else if (lifetime.compareTo(stuckAfter) > 0) {
                    res.add(status(d, ApplicationDeploymentState.STUCK,
                            "no progress for " + formatDuration(lifetime), lifetime, List.of()));
                } else {
                    res.add(status(d, ApplicationDeploymentState.IN_PROGRESS, "in progress", lifetime, List.of()));
                }
                continue;
            }
            Duration lifetime = Duration.between(d.getStartedAt(), d.getFinishedAt());
            if (d.getMetricsSnapshot() == null) {
                res.add(status(d, ApplicationDeploymentState.IN_PROGRESS, "finished, collecting metrics", lifetime,
                        List.of()));
                continue;
            }
            MetricsSnapshot prev = i > 0 ? deployments.get(i - 1).getMetricsSnapshot() : null;
            List<DeploymentSummary> summary = summarize(d.getMetricsSnapshot(), prev);
            long issues = summary.stream().filter(s -> !s.ok()).count();
            String message = issues == 0 ? "deployed successfully" : "deployed with " + issues + " issue(s)";
            res.add(status(d, ApplicationDeploymentState.SUMMARY, message, lifetime, summary));
        }
        return res;
    }

    List<DeploymentSummary> summarize(MetricsSnapshot curr, MetricsSnapshot prev) {
        List<DeploymentSummary> items = new ArrayList<>();

        Double errorShare = share(curr.errors(), curr.requests());
        if (errorShare != null) {
            Double prevShare = prev == null ? null : share(prev.errors(), prev.requests());
            items.add(new DeploymentSummary(
                    "Errors",
                    !degraded(errorShare, prevShare, ERROR_SHARE_FLOOR),
                    withPrevious(String.format(Locale.ROOT, "%.1f%% of requests failed", errorShare), prevShare)));
        }

        Double slowShare = slowShare(curr);
        if (slowShare != null) {
            Double prevSlow = prev == null ? null : slowShare(prev);
            items.add(new DeploymentSummary(
                    "Latency",
                    !degraded(slowShare, prevSlow, SLOW_SHARE_FLOOR),
                    withPrevious(
                            String.format(
                                    Locale.ROOT,
                                    "%.1f%% of requests slower than %ss",
                                    slowShare,
                                    properties.getDeployments().getLatencyThreshold()),
                            prevSlow)));
        }

        if (prev != null && prev.cpuUsage() > 0) {
            double change = (curr.cpuUsage() - prev.cpuUsage()) * 100.0 / prev.cpuUsage();
            items.add(new DeploymentSummary(
                    "CPU usage",
                    change <= CPU_CHANGE_LIMIT,
                    String.format(Locale.ROOT, "%+.0f%%", change)));
        }

        if (curr.memoryLeak() > MEMORY_LEAK_FLOOR) {
            boolean ok = prev != null && !degraded(curr.memoryLeak(), (double) prev.memoryLeak(), MEMORY_LEAK_FLOOR);
            items.add(new DeploymentSummary(
                    "Memory", ok, String.format(Locale.ROOT, "grows by %d MB/h", curr.memoryLeak() / (1024 * 1024))));
        }

        items.add(new DeploymentSummary(
                "Restarts", curr.restarts() == 0, curr.restarts() + " container restart(s)"));
        if (curr.oomKills() > 0) {
            items.add(new DeploymentSummary("OOM kills", false, curr.oomKills() + " container(s) killed by OOM"));
        }

        Double prevLogErrors = prev == null ? null : (double) prev.logErrors();
        items.add(new DeploymentSummary(
                "Logs",
                prevLogErrors == null || !degraded(curr.logErrors(), prevLogErrors, 0),
                curr.logErrors() + " error(s) in logs"));
        return items;
    }

    /**
     * Percentage of requests slower than the latency threshold, read from the cumulative bucket
     * with the smallest bound at or above the threshold.
     */
    Double slowShare(MetricsSnapshot s) {
        if (s.requests() <= 0 || s.latency().isEmpty()) {
            return null;
        }
        double threshold = properties.getDeployments().getLatencyThreshold();
        Double bestLe = null;
        long fast = 0;
        for (Map.Entry<String, Long> e : s.latency().entrySet()) {
            double le = MetricsSnapshotCalculator.INF_BUCKET.equals(e.getKey())
                    ? Double.POSITIVE_INFINITY
                    : Double.parseDouble(e.getKey());
            if (le >= threshold && (bestLe == null || le < bestLe)) {
                bestLe = le;
                fast = e.getValue();
            }
        }
        if (bestLe == null || bestLe.isInfinite()) {
            return null;
        }
        return Math.max(0, s.requests() - fast) * 100.0 / s.requests();
    }

    private static boolean degraded(double curr, Double prev, double floor) {
        if (curr <= floor) {
            return false;
        }
        return prev == null || curr > prev * DEGRADATION_FACTOR;
    }

    private static Double share(long part, long total) {
        return total > 0 ? part * 100.0 / total : null;
    }

    private static String withPrevious(String message, Double prev) {
        return prev == null ? message : message + String.format(Locale.ROOT, " (was %.1f%%)", prev);
    }

    private static String formatDuration(Duration d) {
        long minutes = d.toMinutes();
        return minutes < 60 ? minutes + "m" : d.toHours() + "h" + (minutes % 60) + "m";
    }

    private static ApplicationDeploymentStatus status(
            ApplicationDeployment d,
            ApplicationDeploymentState state,
            String message,
            Duration lifetime,
            List<DeploymentSummary> summary) {
        return new ApplicationDeploymentStatus(d, state, message, lifetime, summary);
    }
}
