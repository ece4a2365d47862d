package com.topolens.core.model;

import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * One rollout of an application, identified by {@code (applicationId, name, startedAt)}.
 *
 * <p>{@code finishedAt} is {@code null} while the rollout is still in progress. An instantaneous
 * cut-over has {@code finishedAt == startedAt}.
 */
@Getter
@Setter
@ToString(of = {"applicationId", "name", "startedAt", "finishedAt"})
public class ApplicationDeployment {
    private final ApplicationId applicationId;
    private final String name;
    private final Instant startedAt;
    private Instant finishedAt;
    private ApplicationDeploymentDetails details;
    private MetricsSnapshot metricsSnapshot;
    private ApplicationDeploymentNotifications notifications;

    public ApplicationDeployment(ApplicationId applicationId, String name, Instant startedAt) {
        this.applicationId = applicationId;
        this.name = name;
        this.startedAt = startedAt;
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    public boolean sameRollout(ApplicationDeployment other) {
        return other != null && name.equals(other.name) && startedAt.equals(other.startedAt);
    }
}
