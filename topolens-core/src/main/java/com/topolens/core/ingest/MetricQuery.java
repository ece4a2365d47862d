package com.topolens.core.ingest;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed catalog of the metric queries the constructor issues. Each query belongs to a
 * {@link Family}; families are processed in declaration order because later ones resolve
 * entities created by earlier ones.
 */
public enum MetricQuery {
    KUBE_NODE_INFO("kube_node_info", "kube_node_info%s", Family.NODES),
    KUBE_SERVICE_INFO("kube_service_info", "kube_service_info%s", Family.SERVICES),
    KUBE_REPLICASET_OWNER("kube_replicaset_owner", "kube_replicaset_owner%s", Family.OWNERS),
    KUBE_POD_INFO("kube_pod_info", "kube_pod_info%s", Family.PODS),
    KUBE_POD_LABELS("kube_pod_labels", "kube_pod_labels%s", Family.POD_LABELS),
    KUBE_POD_STATUS_PHASE("kube_pod_status_phase", "kube_pod_status_phase%s", Family.POD_STATUS),
    KUBE_POD_STATUS_READY("kube_pod_status_ready", "kube_pod_status_ready%s", Family.POD_STATUS),
    KUBE_POD_STATUS_SCHEDULED("kube_pod_status_scheduled", "kube_pod_status_scheduled%s", Family.POD_STATUS),
    KUBE_POD_INIT_CONTAINER_INFO(
            "kube_pod_init_container_info", "kube_pod_init_container_info%s", Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_INFO("kube_pod_container_info", "kube_pod_container_info%s", Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_READY(
            "kube_pod_container_status_ready", "kube_pod_container_status_ready%s", Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_WAITING(
            "kube_pod_container_status_waiting", "kube_pod_container_status_waiting%s", Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_RUNNING(
            "kube_pod_container_status_running", "kube_pod_container_status_running%s", Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_TERMINATED(
            "kube_pod_container_status_terminated",
            "kube_pod_container_status_terminated%s",
            Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_WAITING_REASON(
            "kube_pod_container_status_waiting_reason",
            "kube_pod_container_status_waiting_reason%s",
            Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_TERMINATED_REASON(
            "kube_pod_container_status_terminated_reason",
            "kube_pod_container_status_terminated_reason%s",
            Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_LAST_TERMINATED_REASON(
            "kube_pod_container_status_last_terminated_reason",
            "kube_pod_container_status_last_terminated_reason%s",
            Family.CONTAINER_STATUS),
    KUBE_POD_CONTAINER_STATUS_RESTARTS_TOTAL(
            "kube_pod_container_status_restarts_total",
            "kube_pod_container_status_restarts_total%s",
            Family.CONTAINER_METRICS),
    CONTAINER_CPU_USAGE(
            "container_cpu_usage", "rate(container_resources_cpu_usage_seconds_total%s[5m])", Family.CONTAINER_METRICS),
    CONTAINER_MEMORY_RSS("container_memory_rss", "container_resources_memory_rss_bytes%s", Family.CONTAINER_METRICS),
    CONTAINER_OOM_KILLS_TOTAL("container_oom_kills_total", "container_oom_kills_total%s", Family.CONTAINER_METRICS),
    CONTAINER_LOG_MESSAGES("container_log_messages", "container_log_messages_total%s", Family.INSTANCE_METRICS),
    CONTAINER_HTTP_REQUESTS(
            "container_http_requests", "rate(container_http_requests_total%s[5m])", Family.INSTANCE_METRICS),
    CONTAINER_HTTP_REQUESTS_HISTOGRAM(
            "container_http_requests_histogram",
            "rate(container_http_requests_duration_seconds_total_bucket%s[5m])",
            Family.INSTANCE_METRICS),
    CONTAINER_NET_TCP_ACTIVE_CONNECTIONS(
            "container_net_tcp_active_connections",
            "container_net_tcp_active_connections%s",
            Family.CONNECTIONS),
    KUBE_DEPLOYMENT_SPEC_REPLICAS("kube_deployment_spec_replicas", "kube_deployment_spec_replicas%s", Family.WORKLOADS),
    KUBE_STATEFULSET_REPLICAS("kube_statefulset_replicas", "kube_statefulset_replicas%s", Family.WORKLOADS),
    KUBE_DAEMONSET_STATUS_DESIRED_NUMBER_SCHEDULED(
            "kube_daemonset_status_desired_number_scheduled",
            "kube_daemonset_status_desired_number_scheduled%s",
            Family.WORKLOADS);

    public enum Family {
        NODES,
        SERVICES,
        OWNERS,
        PODS,
        POD_LABELS,
        POD_STATUS,
        CONTAINER_STATUS,
        CONTAINER_METRICS,
        INSTANCE_METRICS,
        CONNECTIONS,
        WORKLOADS
    }

    private final String queryName;
    private final String template;
    private final Family family;

    MetricQuery(String queryName, String template, Family family) {
        this.queryName = queryName;
        this.template = template;
        this.family = family;
    }

    public String queryName() {
        return queryName;
    }

    public Family family() {
        return family;
    }

    /** PromQL expression with {@code extraSelector} applied to the underlying metric. */
    public String expression(String extraSelector) {
        String selector = extraSelector == null || extraSelector.isBlank() ? "" : "{" + extraSelector.trim() + "}";
        return String.format(template, selector);
    }

    public static Optional<MetricQuery> fromQueryName(String queryName) {
        return Arrays.stream(values()).filter(q -> q.queryName.equals(queryName)).findFirst();
    }
}
