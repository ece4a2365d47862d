package com.topolens.core.deployment;

import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentDetails;
import com.topolens.core.model.ApplicationDeploymentNotifications;
import com.topolens.core.model.ApplicationDeploymentState;
import com.topolens.core.model.ApplicationKind;
import com.topolens.core.model.Container;
import com.topolens.core.model.Instance;
import com.topolens.timeseries.Aggregate;
import com.topolens.timeseries.TimeSeries;
import com.topolens.timeseries.TimeSeriesIterator;
import com.topolens.timeseries.Timestamps;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Derives rollouts of a Deployment from the life spans of its replica sets.
 *
 * <p>The replica sets are walked step by step. A single active replica set that differs from the
 * previous one is an instantaneous cut-over; several active at once open a rollout to the newcomer
 * which closes at the next step where exactly one replica set is active.
 */
@Component
public class DeploymentDetector {

    public List<ApplicationDeployment> detect(Application app) {
        if (app.getId().kind() != ApplicationKind.DEPLOYMENT || app.getInstances().isEmpty()) {
            return List.of();
        }
        Map<String, Aggregate> lifeSpans = new TreeMap<>();
        Map<String, Set<String>> images = new TreeMap<>();
        for (Instance instance : app.getInstances()) {
            if (instance.getPod() == null || instance.getPod().getReplicaSet().isEmpty()) {
                continue;
            }
            String rs = instance.getPod().getReplicaSet();
            lifeSpans.computeIfAbsent(rs, k -> new Aggregate()).add(instance.getPod().getLifeSpan());
            Set<String> rsImages = images.computeIfAbsent(rs, k -> new TreeSet<>());
            for (Container c : instance.getContainerList()) {
                if (!c.getImage().isEmpty()) {
                    rsImages.add(c.getImage());
                }
            }
        }

        List<ActiveReplicaSets> steps = activeReplicaSets(lifeSpans);
        List<ApplicationDeployment> deployments = new ArrayList<>();
        ApplicationDeployment inProgress = null;
        String prev = "";
        for (ActiveReplicaSets step : steps) {
            Instant t = Timestamps.toInstant(step.time());
            if (step.names().size() == 1) {
                String curr = step.names().get(0);
                if (prev.isEmpty()) {
                    prev = curr;
                    continue;
                }
                if (inProgress != null) {
                    if (curr.equals(inProgress.getName())) {
                        inProgress.setFinishedAt(t);
                    }
                    inProgress = null;
                }
                if (prev.equals(curr)) {
                    continue;
                }
                ApplicationDeployment d = new ApplicationDeployment(app.getId(), curr, t);
                d.setFinishedAt(t);
                deployments.add(d);
                prev = curr;
            } else {
                if (prev.isEmpty() || inProgress != null) {
                    continue;
                }
                String name = "";
                for (String n : step.names()) {
                    if (!n.equals(prev)) {
                        name = n;
                        break;
                    }
                }
                inProgress = new ApplicationDeployment(app.getId(), name, t);
                deployments.add(inProgress);
                prev = name;
            }
        }

        for (ApplicationDeployment d : deployments) {
            Set<String> rsImages = images.get(d.getName());
            if (rsImages != null && !rsImages.isEmpty()) {
                d.setDetails(new ApplicationDeploymentDetails(new ArrayList<>(rsImages)));
            }
        }
        return deployments;
    }

    /**
     * Baseline record for an application seen for the first time: the current replica set,
     * finished at {@code now} and already summarized so that it is never announced.
     */
    public ApplicationDeployment initialDeployment(Application app, Instant now) {
        String name = "";
        Set<String> images = new TreeSet<>();
        for (Instance instance : app.getInstances()) {
            if (instance.getPod() != null && !instance.getPod().getReplicaSet().isEmpty()) {
                name = instance.getPod().getReplicaSet();
            }
            for (Container c : instance.getContainerList()) {
                if (!c.getImage().isEmpty()) {
                    images.add(c.getImage());
                }
            }
        }
        ApplicationDeployment d = new ApplicationDeployment(app.getId(), name, now);
        d.setFinishedAt(now);
        if (!images.isEmpty()) {
            d.setDetails(new ApplicationDeploymentDetails(new ArrayList<>(images)));
        }
        d.setNotifications(new ApplicationDeploymentNotifications(ApplicationDeploymentState.SUMMARY));
        return d;
    }

    /** Steps with at least one active replica set; the walk ends with the shortest series. */
    private static List<ActiveReplicaSets> activeReplicaSets(Map<String, Aggregate> lifeSpans) {
        Map<String, TimeSeriesIterator> iterators = new TreeMap<>();
        lifeSpans.forEach((name, agg) -> {
            TimeSeries ts = agg.get();
            if (ts != null) {
                iterators.put(name, ts.iterator());
            }
        });
        List<ActiveReplicaSets> steps = new ArrayList<>();
        if (iterators.isEmpty()) {
            return steps;
        }
        while (true) {
            List<String> names = new ArrayList<>();
            long t = 0;
            for (Map.Entry<String, TimeSeriesIterator> e : iterators.entrySet()) {
                TimeSeriesIterator iter = e.getValue();
                if (!iter.next()) {
                    return steps;
                }
                t = iter.time();
                if (iter.value() > 0) {
                    names.add(e.getKey());
                }
            }
            if (!names.isEmpty()) {
                steps.add(new ActiveReplicaSets(t, names));
            }
        }
    }

    /** Replica sets with a positive life span at {@code time}, in lexicographic order. */
    private record ActiveReplicaSets(long time, List<String> names) {}
}
