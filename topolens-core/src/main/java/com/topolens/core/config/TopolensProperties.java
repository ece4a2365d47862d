package com.topolens.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "topolens")
public class TopolensProperties {
    private Deployments deployments = new Deployments();
    private Notifications notifications = new Notifications();
    private List<ProjectConfig> projects = new ArrayList<>();

    public Deployments getDeployments() {
        return deployments;
    }

    public void setDeployments(Deployments deployments) {
        this.deployments = deployments;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public List<ProjectConfig> getProjects() {
        return projects;
    }

    public void setProjects(List<ProjectConfig> projects) {
        this.projects = projects;
    }

    public static class Deployments {
        /** Window loaded on every pass to detect rollouts. */
        private Duration lookback = Duration.ofHours(1);

        private Duration snapshotShift = Duration.ofMinutes(5);
        private Duration snapshotWindow = Duration.ofMinutes(30);
        private Duration stuckAfter = Duration.ofMinutes(30);

        /** Requests slower than this, in seconds, count as slow in the rollout summary. */
        private double latencyThreshold = 0.5;

        public Duration getLookback() {
            return lookback;
        }

        public void setLookback(Duration lookback) {
            this.lookback = lookback;
        }

        public Duration getSnapshotShift() {
            return snapshotShift;
        }

        public void setSnapshotShift(Duration snapshotShift) {
            this.snapshotShift = snapshotShift;
        }

        public Duration getSnapshotWindow() {
            return snapshotWindow;
        }

        public void setSnapshotWindow(Duration snapshotWindow) {
            this.snapshotWindow = snapshotWindow;
        }

        public Duration getStuckAfter() {
            return stuckAfter;
        }

        public void setStuckAfter(Duration stuckAfter) {
            this.stuckAfter = stuckAfter;
        }

        public double getLatencyThreshold() {
            return latencyThreshold;
        }

        public void setLatencyThreshold(double latencyThreshold) {
            this.latencyThreshold = latencyThreshold;
        }
    }

    public static class Notifications {
        private Duration sendTimeout = Duration.ofSeconds(30);

        /** Rollouts that started longer ago than this are never announced. */
        private Duration freshness = Duration.ofHours(24);

        private boolean loggingEnabled = true;

        /** Upper bound on concurrently running notifier calls, hung ones included. */
        private int workers = 4;

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public Duration getFreshness() {
            return freshness;
        }

        public void setFreshness(Duration freshness) {
            this.freshness = freshness;
        }

        public boolean isLoggingEnabled() {
            return loggingEnabled;
        }

        public void setLoggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class ProjectConfig {
        private String id;
        private String name;
        private Duration refreshInterval = Duration.ofSeconds(30);
        private String extraSelector = "";

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Duration getRefreshInterval() {
            return refreshInterval;
        }

        public void setRefreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
        }

        public String getExtraSelector() {
            return extraSelector;
        }

        public void setExtraSelector(String extraSelector) {
            this.extraSelector = extraSelector;
        }
    }
}
