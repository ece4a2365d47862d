package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

@Getter
public class Application {
    private final ApplicationId id;
    private final Map<String, Instance> instancesByName = new LinkedHashMap<>();

    @Setter
    private TimeSeries desiredInstances;

    private final List<AvailabilitySli> availabilitySlis = new ArrayList<>();
    private final List<LatencySli> latencySlis = new ArrayList<>();

    /** Known rollouts, kept in start-time order. */
    private final List<ApplicationDeployment> deployments = new ArrayList<>();

    public Application(ApplicationId id) {
        this.id = id;
    }

    public Collection<Instance> getInstances() {
        return Collections.unmodifiableCollection(instancesByName.values());
    }

    public Instance getInstance(String name) {
        return instancesByName.get(name);
    }

    public Instance getOrCreateInstance(String name, Node node) {
        Instance instance = instancesByName.computeIfAbsent(name, n -> new Instance(n, id));
        if (node != null) {
            instance.setNode(node);
        }
        return instance;
    }

    public void addDeployment(ApplicationDeployment deployment) {
        deployments.add(deployment);
        deployments.sort(Comparator.comparing(ApplicationDeployment::getStartedAt));
    }
}
