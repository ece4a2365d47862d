package com.topolens.core.constructor;

import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.Instance;
import com.topolens.core.model.LabelSet;
import com.topolens.core.model.World;
import com.topolens.timeseries.Aggregate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/** Indexes shared by the handlers while one world is being built. */
class ConstructionContext {

    private final World world;
    private final Map<String, Instance> podsByUid = new HashMap<>();
    private final Map<String, Instance> podsByName = new HashMap<>();
    private final Map<String, String> replicaSetOwners = new HashMap<>();
    private final Map<ApplicationId, SliAccumulator> slis = new LinkedHashMap<>();

    ConstructionContext(World world) {
        this.world = world;
    }

    World world() {
        return world;
    }

    void registerPod(String uid, String namespace, String pod, Instance instance) {
        if (!uid.isEmpty()) {
            podsByUid.put(uid, instance);
        }
        podsByName.put(key(namespace, pod), instance);
    }

    Instance podByUid(String uid) {
        return podsByUid.get(uid);
    }

    Instance podByName(LabelSet labels) {
        return podsByName.get(key(labels.namespace(), labels.pod()));
    }

    void registerReplicaSetOwner(String namespace, String replicaSet, String deployment) {
        replicaSetOwners.put(key(namespace, replicaSet), deployment);
    }

    String replicaSetOwner(String namespace, String replicaSet) {
        return replicaSetOwners.get(key(namespace, replicaSet));
    }

    SliAccumulator sli(ApplicationId id) {
        return slis.computeIfAbsent(id, i -> new SliAccumulator());
    }

    Map<ApplicationId, SliAccumulator> slis() {
        return slis;
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }

    static final class SliAccumulator {
        final Aggregate totalRequests = new Aggregate();
        final Aggregate failedRequests = new Aggregate();
        final Map<Float, Aggregate> histogram = new TreeMap<>();
    }
}
