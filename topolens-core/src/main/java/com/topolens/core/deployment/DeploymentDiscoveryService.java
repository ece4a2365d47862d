package com.topolens.core.deployment;

import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationKind;
import com.topolens.core.model.World;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Reconciles detected rollouts with the persisted ones and saves what changed. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeploymentDiscoveryService {
    private final DeploymentDetector detector;
    private final DeploymentRepository repository;

    /** @return the number of Deployment applications checked */
    public int discover(String projectId, World world, Instant now) {
        int apps = 0;
        for (Application app : world.getApplications()) {
            if (app.getId().kind() != ApplicationKind.DEPLOYMENT) {
                continue;
            }
            apps++;
            List<ApplicationDeployment> detected = detector.detect(app);
            if (app.getDeployments().isEmpty() && detected.isEmpty()) {
                ApplicationDeployment initial = detector.initialDeployment(app, now);
                try {
                    repository.save(projectId, initial);
                } catch (RuntimeException ex) {
                    log.error("[{}] failed to save initial deployment of {}", projectId, app.getId(), ex);
                }
                continue;
            }
            try {
                merge(projectId, app, detected);
            } catch (RuntimeException ex) {
                log.error("[{}] failed to save deployment of {}", projectId, app.getId(), ex);
            }
        }
        return apps;
    }

    private void merge(String projectId, Application app, List<ApplicationDeployment> detected) {
        for (ApplicationDeployment d : detected) {
            ApplicationDeployment known = null;
            for (ApplicationDeployment existing : app.getDeployments()) {
                if (existing.sameRollout(d)) {
                    known = existing;
                    break;
                }
            }
            if (known != null && Objects.equals(known.getFinishedAt(), d.getFinishedAt())) {
                continue;
            }
            repository.save(projectId, d);
            if (known == null) {
                log.info("[{}] new deployment detected for {}: {}", projectId, app.getId(), d.getName());
                app.addDeployment(d);
            } else {
                known.setFinishedAt(d.getFinishedAt());
            }
        }
    }
}
