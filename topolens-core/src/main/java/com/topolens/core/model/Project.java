package com.topolens.core.model;

import java.time.Duration;

/**
 * A monitored cluster.
 *
 * @param refreshInterval scrape step used as the series step
 * @param extraSelector label matchers appended to every metric query, may be empty
 */
public record Project(String id, String name, Duration refreshInterval, String extraSelector) {

    public Project {
        extraSelector = extraSelector == null ? "" : extraSelector;
    }

    public long stepSeconds() {
        return refreshInterval.toSeconds();
    }
}
