package com.topolens.core.deployment;

import com.topolens.core.cache.MetricsCache;
import com.topolens.core.cache.MetricsCacheClient;
import com.topolens.core.cache.MetricsQueryException;
import com.topolens.core.config.TopolensProperties;
import com.topolens.core.constructor.WorldConstructor;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentNotifications;
import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.Project;
import com.topolens.core.model.World;
import com.topolens.core.notification.DeploymentNotifier;
import com.topolens.core.notification.NotificationSendExecutor;
import com.topolens.core.project.ProjectRepository;
import com.topolens.timeseries.Timestamps;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One pass over all projects: detect and persist rollouts, snapshot the metrics of finished ones
 * and announce state changes. Projects are processed sequentially and a failure in one never
 * affects the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentWatcher {
    private final ProjectRepository projectRepository;
    private final MetricsCache metricsCache;
    private final WorldConstructor worldConstructor;
    private final DeploymentDiscoveryService discoveryService;
    private final MetricsSnapshotCalculator snapshotCalculator;
    private final DeploymentStatusCalculator statusCalculator;
    private final DeploymentRepository deploymentRepository;
    private final List<DeploymentNotifier> notifiers;
    private final NotificationSendExecutor sendExecutor;
    private final TopolensProperties properties;
    private final Clock clock;

    public void runOnce() {
        List<Project> projects;
        try {
            projects = projectRepository.findAll();
        } catch (RuntimeException ex) {
            log.error("failed to get projects", ex);
            return;
        }
        for (Project project : projects) {
            try {
                processProject(project);
            } catch (RuntimeException ex) {
                log.error("[{}] deployment watcher pass failed", project.id(), ex);
            }
        }
    }

    void processProject(Project project) {
        long started = clock.millis();
        MetricsCacheClient client = metricsCache.getClient(project);
        long cacheTo;
        try {
            cacheTo = client.getTo();
        } catch (MetricsQueryException ex) {
            log.error("[{}] failed to read metrics cache state", project.id(), ex);
            return;
        }
        if (cacheTo <= 0) {
            log.warn("[{}] metrics cache is empty", project.id());
            return;
        }
        long step = project.stepSeconds();
        long from = cacheTo - properties.getDeployments().getLookback().toSeconds();
        World world;
        try {
            world = worldConstructor.loadWorld(project, client, from, cacheTo, step);
        } catch (MetricsQueryException ex) {
            log.error("[{}] failed to load world", project.id(), ex);
            return;
        }
        Instant now = Timestamps.toInstant(cacheTo);
        int apps = discoveryService.discover(project.id(), world, now);
        log.info("[{}] checked {} apps in {} ms", project.id(), apps, clock.millis() - started);

        snapshotDeploymentMetrics(project, client, world.getApplications(), cacheTo);
        sendNotifications(project, world, now);
    }

    void snapshotDeploymentMetrics(
            Project project, MetricsCacheClient client, List<Application> applications, long cacheTo) {
        long step = project.stepSeconds();
        long shift = properties.getDeployments().getSnapshotShift().toSeconds();
        long window = properties.getDeployments().getSnapshotWindow().toSeconds();
        for (Application app : applications) {
            List<ApplicationDeployment> deployments = app.getDeployments();
            for (int i = 0; i < deployments.size(); i++) {
                ApplicationDeployment d = deployments.get(i);
                if (d.getMetricsSnapshot() != null || !d.isFinished()) {
                    continue;
                }
                long from = Timestamps.truncate(Timestamps.fromInstant(d.getFinishedAt()) + shift, step);
                long to = Timestamps.truncate(from + window, step);
                long nextOrNow = i < deployments.size() - 1
                        ? Timestamps.fromInstant(deployments.get(i + 1).getStartedAt())
                        : cacheTo;
                if (to > nextOrNow) {
                    continue;
                }
                World world;
                try {
                    world = worldConstructor.loadWorld(project, client, from, to, step);
                } catch (MetricsQueryException ex) {
                    log.error("[{}] failed to load world for the snapshot of {}", project.id(), d, ex);
                    continue;
                }
                Application a = world.getApplication(d.getApplicationId());
                if (a == null) {
                    log.warn("[{}] unknown application: {}", project.id(), d.getApplicationId());
                    continue;
                }
                d.setMetricsSnapshot(snapshotCalculator.calculate(a, from, to, step));
                try {
                    deploymentRepository.saveMetricsSnapshot(project.id(), d);
                } catch (RuntimeException ex) {
                    log.error("[{}] failed to save metrics snapshot of {}", project.id(), d, ex);
                }
            }
        }
    }

    void sendNotifications(Project project, World world, Instant now) {
        Duration freshness = properties.getNotifications().getFreshness();
        for (Application app : world.getApplications()) {
            for (ApplicationDeploymentStatus ds : statusCalculator.calculate(app, now)) {
                ApplicationDeployment d = ds.deployment();
                if (Duration.between(d.getStartedAt(), now).compareTo(freshness) > 0) {
                    continue;
                }
                if (d.getNotifications() == null) {
                    d.setNotifications(new ApplicationDeploymentNotifications());
                }
                ApplicationDeploymentNotifications notifications = d.getNotifications();
                if (!ds.state().isAfter(notifications.getState())) {
                    continue;
                }
                boolean needSave = false;
                boolean allReached = true;
                for (DeploymentNotifier notifier : notifiers) {
                    if (!notifier.isEnabled(project)) {
                        continue;
                    }
                    if (notifications.reached(notifier.channel(), ds.state())) {
                        continue;
                    }
                    if (sendExecutor.send(notifier, project, ds)) {
                        notifications.markSent(notifier.channel(), ds.state());
                        needSave = true;
                    } else {
                        allReached = false;
                    }
                }
                if (!needSave) {
                    continue;
                }
                // a channel still behind keeps the rollout eligible on the next pass
                if (allReached) {
                    notifications.advance(ds.state());
                }
                try {
                    deploymentRepository.saveNotifications(project.id(), d);
                } catch (RuntimeException ex) {
                    log.error("[{}] failed to save notification state of {}", project.id(), d, ex);
                }
            }
        }
    }
}
