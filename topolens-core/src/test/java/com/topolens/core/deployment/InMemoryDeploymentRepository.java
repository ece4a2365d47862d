package com.topolens.core.deployment;

import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationId;
import java.util.ArrayList;
import java.util.List;

public class InMemoryDeploymentRepository implements DeploymentRepository {
    private final List<ApplicationDeployment> deployments = new ArrayList<>();
    private final List<ApplicationDeployment> saved = new ArrayList<>();
    private final List<ApplicationDeployment> snapshots = new ArrayList<>();
    private final List<ApplicationDeployment> notifications = new ArrayList<>();
    private ApplicationId failingApplication;
    private RuntimeException saveFailure;

    /** Every save of a rollout of {@code applicationId} throws {@code failure}. */
    public void failSavesOf(ApplicationId applicationId, RuntimeException failure) {
        this.failingApplication = applicationId;
        this.saveFailure = failure;
    }

    public void preload(ApplicationDeployment deployment) {
        deployments.add(deployment);
    }

    public List<ApplicationDeployment> all() {
        return deployments;
    }

    public List<ApplicationDeployment> saved() {
        return saved;
    }

    public List<ApplicationDeployment> snapshots() {
        return snapshots;
    }

    public List<ApplicationDeployment> notifications() {
        return notifications;
    }

    @Override
    public List<ApplicationDeployment> findByProject(String projectId) {
        return new ArrayList<>(deployments);
    }

    @Override
    public void save(String projectId, ApplicationDeployment deployment) {
        if (saveFailure != null && deployment.getApplicationId().equals(failingApplication)) {
            throw saveFailure;
        }
        saved.add(deployment);
        for (ApplicationDeployment d : deployments) {
            if (d.getApplicationId().equals(deployment.getApplicationId()) && d.sameRollout(deployment)) {
                d.setFinishedAt(deployment.getFinishedAt());
                return;
            }
        }
        deployments.add(deployment);
    }

    @Override
    public void saveMetricsSnapshot(String projectId, ApplicationDeployment deployment) {
        snapshots.add(deployment);
    }

    @Override
    public void saveNotifications(String projectId, ApplicationDeployment deployment) {
        notifications.add(deployment);
    }
}
