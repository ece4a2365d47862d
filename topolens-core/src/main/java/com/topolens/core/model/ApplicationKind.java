package com.topolens.core.model;

import java.util.Arrays;
import java.util.Optional;

public enum ApplicationKind {
    DEPLOYMENT("Deployment"),
    STATEFUL_SET("StatefulSet"),
    DAEMON_SET("DaemonSet"),
    REPLICA_SET("ReplicaSet"),
    CRON_JOB("CronJob"),
    JOB("Job"),
    REPLICATION_CONTROLLER("ReplicationController"),
    DEPLOYMENT_CONFIG("DeploymentConfig"),
    ROLLOUT("Rollout"),
    STATIC_PODS("StaticPods");

    private final String label;

    ApplicationKind(String label) {
        this.label = label;
    }

    /** Kind as Kubernetes spells it, e.g. {@code StatefulSet}. */
    public String label() {
        return label;
    }

    public static Optional<ApplicationKind> fromLabel(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(k -> k.label.equals(value)).findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
