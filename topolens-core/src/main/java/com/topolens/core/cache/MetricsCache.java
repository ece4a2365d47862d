package com.topolens.core.cache;

import com.topolens.core.model.Project;

public interface MetricsCache {

    MetricsCacheClient getClient(Project project);
}
