package com.topolens.core.model;

import java.time.Duration;
import java.util.List;

public record ApplicationDeploymentStatus(
        ApplicationDeployment deployment,
        ApplicationDeploymentState state,
        String message,
        Duration lifetime,
        List<DeploymentSummary> summary) {

    public ApplicationDeploymentStatus {
        summary = summary == null ? List.of() : List.copyOf(summary);
    }
}
