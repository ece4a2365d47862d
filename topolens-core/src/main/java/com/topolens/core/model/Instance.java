package com.topolens.core.model;

import com.topolens.timeseries.Reducer;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.TimeSeriesOps;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

@Getter
public class Instance {
    private final String name;
    private final ApplicationId ownerId;

    @Setter
    private Node node;

    @Setter
    private Pod pod;

    private final Map<String, Container> containers = new LinkedHashMap<>();

    /** Listen address to whether it was active at the end of the window. */
    private final Map<Listen, Boolean> tcpListens = new LinkedHashMap<>();

    private String clusterName = "";
    private TimeSeries clusterRole;
    private final List<Connection> upstreams = new ArrayList<>();
    private final Map<LogLevel, TimeSeries> logMessagesByLevel = new EnumMap<>(LogLevel.class);

    public Instance(String name, ApplicationId ownerId) {
        this.name = name;
        this.ownerId = ownerId;
    }

    public InstanceRef ref() {
        return new InstanceRef(ownerId, name);
    }

    public Container getOrCreateContainer(String containerName) {
        return containers.computeIfAbsent(containerName, Container::new);
    }

    public Collection<Container> getContainerList() {
        return Collections.unmodifiableCollection(containers.values());
    }

    /** Records the cluster name when the labels series was observed during the window. */
    public void updateClusterName(TimeSeries values, String cluster) {
        if (values != null && values.lastNotNull() != null) {
            clusterName = cluster;
        }
    }

    /** Marks the steps where {@code values} is positive with the given role. */
    public void updateClusterRole(String role, TimeSeries values) {
        ClusterRole clusterRoleValue = ClusterRole.fromLabel(role);
        if (clusterRoleValue == ClusterRole.NONE || values == null) {
            return;
        }
        TimeSeries roleSeries = values.map((t, v) -> v > 0 ? clusterRoleValue.value() : TimeSeries.NaN);
        clusterRole = TimeSeriesOps.merge(clusterRole, roleSeries, Reducer.ANY);
    }

    public ClusterRole currentClusterRole() {
        if (clusterRole == null) {
            return ClusterRole.NONE;
        }
        TimeSeries.Point last = clusterRole.lastNotNull();
        return last == null ? ClusterRole.NONE : ClusterRole.fromValue(last.value());
    }

    public void addLogMessages(LogLevel level, TimeSeries messages) {
        logMessagesByLevel.merge(
                level, messages, (acc, ts) -> TimeSeriesOps.merge(acc, ts, Reducer.NAN_SUM));
    }

    public boolean listensOn(String ip) {
        if (ip == null || ip.isEmpty()) {
            return false;
        }
        return tcpListens.keySet().stream().anyMatch(l -> l.ip().equals(ip));
    }
}
