package com.topolens.core.model;

import com.topolens.timeseries.TimeContext;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Topology of one project over one query window. Rebuilt from scratch for every window; lookups
 * scan the (small) entity lists.
 */
@Getter
public class World {
    private final TimeContext ctx;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Application> applications = new ArrayList<>();
    private final List<Service> services = new ArrayList<>();

    @Setter
    private boolean kubeStateMetricsInstalled;

    public World(TimeContext ctx) {
        this.ctx = ctx;
    }

    public Application getApplication(ApplicationId id) {
        for (Application app : applications) {
            if (app.getId().equals(id)) {
                return app;
            }
        }
        return null;
    }

    public Application getOrCreateApplication(ApplicationId id) {
        Application app = getApplication(id);
        if (app == null) {
            app = new Application(id);
            applications.add(app);
        }
        return app;
    }

    public Node getNode(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        for (Node node : nodes) {
            if (node.getName().equals(name)) {
                return node;
            }
        }
        return null;
    }

    /**
     * The service a connection went through: matched by cluster IP, or else by a connection of
     * the service that reached the same actual remote IP.
     */
    public Service getServiceForConnection(Connection c) {
        for (Service s : services) {
            if (!s.getClusterIp().isEmpty() && s.getClusterIp().equals(c.serviceRemoteIp())) {
                return s;
            }
            for (Connection sc : s.getConnections()) {
                if (sc.actualRemoteIp() != null
                        && !sc.actualRemoteIp().isEmpty()
                        && sc.actualRemoteIp().equals(c.actualRemoteIp())) {
                    return s;
                }
            }
        }
        return null;
    }

    public Service getServiceByClusterIp(String clusterIp) {
        for (Service s : services) {
            if (s.getClusterIp().equals(clusterIp)) {
                return s;
            }
        }
        return null;
    }

    public Instance findInstance(InstanceRef ref) {
        if (ref == null) {
            return null;
        }
        Application app = getApplication(ref.applicationId());
        return app == null ? null : app.getInstance(ref.name());
    }

    /** First instance with a recorded listen on {@code ip}, or {@code null}. */
    public Instance findInstanceByIp(String ip) {
        for (Application app : applications) {
            for (Instance instance : app.getInstances()) {
                if (instance.listensOn(ip)) {
                    return instance;
                }
            }
        }
        return null;
    }
}
