package com.topolens.core.model;

/** Lifecycle of a rollout as announced to users; later constants supersede earlier ones. */
public enum ApplicationDeploymentState {
    IN_PROGRESS,
    STUCK,
    CANCELLED,
    SUMMARY;

    public boolean isAfter(ApplicationDeploymentState other) {
        return other == null || compareTo(other) > 0;
    }
}
