package com.topolens.core.notification;

import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.Project;

/** An outbound channel that announces rollout statuses. */
public interface DeploymentNotifier {

    /** Stable channel key under which delivery progress is recorded. */
    String channel();

    boolean isEnabled(Project project);

    void send(Project project, ApplicationDeploymentStatus status) throws Exception;
}
