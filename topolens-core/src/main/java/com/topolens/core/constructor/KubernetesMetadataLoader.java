package com.topolens.core.constructor;

import com.topolens.core.ingest.MetricQuery;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.ApplicationKind;
import com.topolens.core.model.Container;
import com.topolens.core.model.ContainerStatus;
import com.topolens.core.model.Instance;
import com.topolens.core.model.LabelSet;
import com.topolens.core.model.Listen;
import com.topolens.core.model.MetricValues;
import com.topolens.core.model.Node;
import com.topolens.core.model.Pod;
import com.topolens.core.model.Service;
import com.topolens.core.model.World;
import com.topolens.timeseries.Reducer;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.TimeSeriesOps;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handlers for the kube-state-metrics families: nodes, services, replica set owners, pods, pod
 * labels, pod and container statuses, desired replicas.
 */
@Slf4j
@Component
public class KubernetesMetadataLoader {

    static final String KUBE_API_SERVICE = "kubernetes";
    static final String KUBE_API_SERVICE_ALIAS = "kube-apiserver";

    Map<MetricQuery, MetricHandler> handlers() {
        Map<MetricQuery, MetricHandler> handlers = new EnumMap<>(MetricQuery.class);
        handlers.put(MetricQuery.KUBE_NODE_INFO, this::nodes);
        handlers.put(MetricQuery.KUBE_SERVICE_INFO, this::services);
        handlers.put(MetricQuery.KUBE_REPLICASET_OWNER, this::replicaSetOwners);
        handlers.put(MetricQuery.KUBE_POD_INFO, this::podInfo);
        handlers.put(MetricQuery.KUBE_POD_LABELS, this::podLabels);
        handlers.put(MetricQuery.KUBE_POD_STATUS_PHASE, this::podStatus);
        handlers.put(MetricQuery.KUBE_POD_STATUS_READY, this::podStatus);
        handlers.put(MetricQuery.KUBE_POD_STATUS_SCHEDULED, this::podStatus);
        for (MetricQuery q : MetricQuery.values()) {
            if (q.family() == MetricQuery.Family.CONTAINER_STATUS) {
                handlers.put(q, this::containerStatus);
            }
        }
        handlers.put(MetricQuery.KUBE_DEPLOYMENT_SPEC_REPLICAS, this::desiredReplicas);
        handlers.put(MetricQuery.KUBE_STATEFULSET_REPLICAS, this::desiredReplicas);
        handlers.put(MetricQuery.KUBE_DAEMONSET_STATUS_DESIRED_NUMBER_SCHEDULED, this::desiredReplicas);
        return handlers;
    }

    void nodes(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        World world = ctx.world();
        for (MetricValues m : metrics) {
            String name = m.labels().node();
            if (name.isEmpty() || world.getNode(name) != null) {
                continue;
            }
            Node node = new Node(name);
            node.setInternalIp(m.labels().internalIp());
            node.setOsImage(m.labels().get("os_image"));
            node.setKernelVersion(m.labels().get("kernel_version"));
            world.getNodes().add(node);
        }
    }

    void services(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            String clusterIp = m.labels().clusterIp();
            if (clusterIp.isEmpty()) {
                continue;
            }
            String name = m.labels().service();
            if (KUBE_API_SERVICE.equals(name)) {
                name = KUBE_API_SERVICE_ALIAS;
            }
            ctx.world().getServices().add(new Service(name, m.labels().namespace(), clusterIp));
        }
    }

    void replicaSetOwners(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            LabelSet labels = m.labels();
            if (ApplicationKind.DEPLOYMENT.label().equals(labels.ownerKind()) && labels.has("owner_name")) {
                ctx.registerReplicaSetOwner(labels.namespace(), labels.replicaSet(), labels.ownerName());
            }
        }
    }

    void podInfo(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        World world = ctx.world();
        for (MetricValues m : metrics) {
            world.setKubeStateMetricsInstalled(true);
            LabelSet labels = m.labels();
            String pod = labels.pod();
            String ns = labels.namespace();
            String ownerKind = labels.createdByKind();
            String ownerName = labels.createdByName();
            String nodeName = labels.node();

            ApplicationId appId = resolveOwner(ctx, ns, pod, nodeName, ownerKind, ownerName);
            if (appId == null) {
                continue;
            }
            Instance instance = world.getOrCreateApplication(appId).getOrCreateInstance(pod, world.getNode(nodeName));

            String podIp = labels.podIp();
            if (!podIp.isEmpty() && !podIp.equals(labels.hostIp()) && IpAddresses.isValid(podIp)) {
                instance.getTcpListens().put(new Listen(podIp, "0", false), m.values().last() == 1);
            }
            if (instance.getPod() == null) {
                instance.setPod(new Pod());
            }
            if (ApplicationKind.REPLICA_SET.label().equals(ownerKind)) {
                instance.getPod().setReplicaSet(ownerName);
            }
            ctx.registerPod(labels.uid(), ns, pod, instance);
        }
    }

    private ApplicationId resolveOwner(
            ConstructionContext ctx, String ns, String pod, String nodeName, String ownerKind, String ownerName) {
        if (ownerKind.isEmpty() || "<none>".equals(ownerKind) || "Node".equals(ownerKind)) {
            String suffix = "-" + nodeName;
            String name = pod.endsWith(suffix) ? pod.substring(0, pod.length() - suffix.length()) : pod;
            return new ApplicationId(ns, ApplicationKind.STATIC_PODS, name);
        }
        if (ownerName.isEmpty()) {
            log.debug("pod {}/{} has owner kind {} but no owner name, skipping", ns, pod, ownerKind);
            return null;
        }
        Optional<ApplicationKind> kind = ApplicationKind.fromLabel(ownerKind);
        if (kind.isEmpty()) {
            log.debug("pod {}/{} has unsupported owner kind {}, skipping", ns, pod, ownerKind);
            return null;
        }
        if (kind.get() == ApplicationKind.REPLICA_SET) {
            String deployment = ctx.replicaSetOwner(ns, ownerName);
            if (deployment != null) {
                return new ApplicationId(ns, ApplicationKind.DEPLOYMENT, deployment);
            }
        }
        return new ApplicationId(ns, kind.get(), ownerName);
    }

    void podLabels(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            LabelSet labels = m.labels();
            String cluster;
            String role = "";
            if (labels.has("label_postgres_operator_crunchydata_com_cluster")) {
                cluster = labels.get("label_postgres_operator_crunchydata_com_cluster");
                role = labels.get("label_postgres_operator_crunchydata_com_role");
            } else if (labels.has("label_cluster_name") && labels.has("label_team")) {
                cluster = labels.get("label_cluster_name");
                // poolers (pgbouncer) carry the cluster labels but have no role
                if ("spilo".equals(labels.get("label_application"))) {
                    role = labels.get("label_spilo_role");
                }
            } else if (labels.has("label_k8s_enterprisedb_io_cluster")) {
                cluster = labels.get("label_k8s_enterprisedb_io_cluster");
                role = labels.get("label_role");
            } else {
                continue;
            }
            if (!cluster.isEmpty()) {
                instance.updateClusterName(m.values(), cluster);
            }
            if ("master".equals(role)) {
                role = "primary";
            }
            instance.updateClusterRole(role, m.values());
        }
    }

    void podStatus(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            Pod pod = instance.getPod();
            TimeSeries values = m.values();
            switch (query) {
                case KUBE_POD_STATUS_PHASE -> {
                    pod.setLifeSpan(TimeSeriesOps.merge(pod.getLifeSpan(), values, Reducer.NAN_SUM));
                    if (values.last() > 0) {
                        pod.setPhase(m.labels().phase());
                    }
                    if ("Running".equals(m.labels().phase())) {
                        pod.setRunning(TimeSeriesOps.merge(pod.getRunning(), values, Reducer.ANY));
                    }
                }
                case KUBE_POD_STATUS_READY -> {
                    if ("true".equals(m.labels().condition())) {
                        pod.setReady(TimeSeriesOps.merge(pod.getReady(), values, Reducer.ANY));
                    }
                }
                case KUBE_POD_STATUS_SCHEDULED -> {
                    if (values.last() > 0 && "true".equals(m.labels().condition())) {
                        pod.setScheduled(true);
                    }
                }
                default -> log.debug("no pod status handling for {}", query);
            }
        }
    }

    void containerStatus(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        for (MetricValues m : metrics) {
            Instance instance = knownPod(ctx, m.labels());
            if (instance == null) {
                continue;
            }
            Container container = instance.getOrCreateContainer(m.labels().container());
            boolean active = m.values().last() > 0;
            switch (query) {
                case KUBE_POD_INIT_CONTAINER_INFO -> {
                    container.setInitContainer(true);
                    setImage(container, m.labels());
                }
                case KUBE_POD_CONTAINER_INFO -> setImage(container, m.labels());
                case KUBE_POD_CONTAINER_STATUS_READY -> container.setReady(active);
                case KUBE_POD_CONTAINER_STATUS_WAITING -> {
                    if (active) {
                        container.setStatus(ContainerStatus.WAITING);
                    }
                }
                case KUBE_POD_CONTAINER_STATUS_RUNNING -> {
                    if (active) {
                        container.setStatus(ContainerStatus.RUNNING);
                        container.setReason("");
                    }
                }
                case KUBE_POD_CONTAINER_STATUS_TERMINATED -> {
                    if (active) {
                        container.setStatus(ContainerStatus.TERMINATED);
                    }
                }
                case KUBE_POD_CONTAINER_STATUS_WAITING_REASON -> {
                    if (active) {
                        container.setStatus(ContainerStatus.WAITING);
                        container.setReason(m.labels().reason());
                    }
                }
                case KUBE_POD_CONTAINER_STATUS_TERMINATED_REASON -> {
                    if (active) {
                        container.setStatus(ContainerStatus.TERMINATED);
                        container.setReason(m.labels().reason());
                    }
                }
                case KUBE_POD_CONTAINER_STATUS_LAST_TERMINATED_REASON -> {
                    if (active) {
                        container.setLastTerminatedReason(m.labels().reason());
                    }
                }
                default -> log.debug("no container status handling for {}", query);
            }
        }
    }

    private static void setImage(Container container, LabelSet labels) {
        if (labels.has("image")) {
            container.setImage(labels.image());
        }
    }

    void desiredReplicas(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx) {
        ApplicationKind kind;
        String nameLabel;
        switch (query) {
            case KUBE_DEPLOYMENT_SPEC_REPLICAS -> {
                kind = ApplicationKind.DEPLOYMENT;
                nameLabel = "deployment";
            }
            case KUBE_STATEFULSET_REPLICAS -> {
                kind = ApplicationKind.STATEFUL_SET;
                nameLabel = "statefulset";
            }
            case KUBE_DAEMONSET_STATUS_DESIRED_NUMBER_SCHEDULED -> {
                kind = ApplicationKind.DAEMON_SET;
                nameLabel = "daemonset";
            }
            default -> {
                return;
            }
        }
        for (MetricValues m : metrics) {
            ApplicationId id = new ApplicationId(m.labels().namespace(), kind, m.labels().get(nameLabel));
            Application app = ctx.world().getApplication(id);
            if (app == null) {
                continue;
            }
            app.setDesiredInstances(TimeSeriesOps.merge(app.getDesiredInstances(), m.values(), Reducer.ANY));
        }
    }

    private static Instance knownPod(ConstructionContext ctx, LabelSet labels) {
        Instance instance = ctx.podByUid(labels.uid());
        if (instance == null || instance.getPod() == null) {
            log.warn("unknown pod: {} {} {}", labels.uid(), labels.pod(), labels.namespace());
            return null;
        }
        return instance;
    }
}
