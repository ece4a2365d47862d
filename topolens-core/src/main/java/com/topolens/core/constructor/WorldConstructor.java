package com.topolens.core.constructor;

import com.topolens.core.cache.MetricsCacheClient;
import com.topolens.core.cache.MetricsQueryException;
import com.topolens.core.deployment.DeploymentRepository;
import com.topolens.core.ingest.MetricQuery;
import com.topolens.core.ingest.MetricsIngestAdapter;
import com.topolens.core.ingest.RawSeries;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.MetricValues;
import com.topolens.core.model.Project;
import com.topolens.core.model.World;
import com.topolens.timeseries.TimeContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link World} of a project for one window from the metrics cache.
 *
 * <p>Every catalog query is issued, the results grouped by query and folded into the world family
 * by family, so pods exist before their statuses and services before the connections that use
 * them. Samples that reference unknown entities are dropped with a warning.
 */
@Slf4j
@Service
public class WorldConstructor {
    private final MetricsIngestAdapter ingestAdapter;
    private final DeploymentRepository deploymentRepository;
    private final ContainerMetricsLoader containerMetricsLoader;
    private final Map<MetricQuery, MetricHandler> handlers = new EnumMap<>(MetricQuery.class);

    public WorldConstructor(
            MetricsIngestAdapter ingestAdapter,
            DeploymentRepository deploymentRepository,
            KubernetesMetadataLoader kubernetesMetadataLoader,
            ContainerMetricsLoader containerMetricsLoader) {
        this.ingestAdapter = ingestAdapter;
        this.deploymentRepository = deploymentRepository;
        this.containerMetricsLoader = containerMetricsLoader;
        handlers.putAll(kubernetesMetadataLoader.handlers());
        handlers.putAll(containerMetricsLoader.handlers());
    }

    public World loadWorld(Project project, MetricsCacheClient client, long from, long to, long step)
            throws MetricsQueryException {
        return loadWorld(project, client, from, to, step, project.extraSelector());
    }

    public World loadWorld(
            Project project, MetricsCacheClient client, long from, long to, long step, String extraSelector)
            throws MetricsQueryException {
        TimeContext ctx = new TimeContext(from, to, step);
        List<RawSeries> raw = new ArrayList<>();
        for (MetricQuery query : MetricQuery.values()) {
            raw.addAll(client.queryRange(query.queryName(), query.expression(extraSelector), ctx));
        }
        Map<MetricQuery, List<MetricValues>> metrics = ingestAdapter.group(ctx, raw);

        World world = new World(ctx);
        ConstructionContext construction = new ConstructionContext(world);
        for (MetricQuery.Family family : MetricQuery.Family.values()) {
            for (MetricQuery query : MetricQuery.values()) {
                if (query.family() != family) {
                    continue;
                }
                MetricHandler handler = handlers.get(query);
                if (handler == null) {
                    log.debug("no handler registered for {}", query);
                    continue;
                }
                handler.handle(query, metrics.getOrDefault(query, Collections.emptyList()), construction);
            }
        }
        containerMetricsLoader.complete(construction);
        attachDeployments(project, world);

        if (log.isDebugEnabled()) {
            log.debug(
                    "world of project {} for [{}, {}]: {} nodes, {} services, {} applications",
                    project.id(),
                    from,
                    to,
                    world.getNodes().size(),
                    world.getServices().size(),
                    world.getApplications().size());
        }
        return world;
    }

    private void attachDeployments(Project project, World world) {
        List<ApplicationDeployment> deployments = new ArrayList<>(deploymentRepository.findByProject(project.id()));
        deployments.sort(Comparator.comparing(ApplicationDeployment::getStartedAt));
        for (ApplicationDeployment d : deployments) {
            Application app = world.getApplication(d.getApplicationId());
            if (app != null) {
                app.getDeployments().add(d);
            }
        }
    }
}
