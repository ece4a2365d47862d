package com.topolens.core.deployment;

import com.topolens.core.model.ApplicationDeployment;
import java.util.List;

/**
 * Persisted rollouts. Records are keyed by {@code (projectId, applicationId, name, startedAt)};
 * every write is idempotent and atomic per record.
 */
public interface DeploymentRepository {
    List<ApplicationDeployment> findByProject(String projectId);

    /** Inserts the rollout, or updates {@code finishedAt} and details of an existing one. */
    void save(String projectId, ApplicationDeployment deployment);

    void saveMetricsSnapshot(String projectId, ApplicationDeployment deployment);

    void saveNotifications(String projectId, ApplicationDeployment deployment);
}
