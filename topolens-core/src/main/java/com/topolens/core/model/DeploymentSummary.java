package com.topolens.core.model;

/** One line of a rollout health summary, e.g. {@code "CPU usage" / "+25%"}. */
public record DeploymentSummary(String report, boolean ok, String message) {}
