package com.topolens.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view over the labels of one metric series, with accessors for the keys entity
 * resolution relies on. Absent labels read as the empty string.
 */
public final class LabelSet {

    public static final LabelSet EMPTY = new LabelSet(Map.of());

    private final Map<String, String> labels;

    private LabelSet(Map<String, String> labels) {
        this.labels = labels;
    }

    public static LabelSet of(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        return new LabelSet(Collections.unmodifiableMap(new TreeMap<>(labels)));
    }

    public static LabelSet of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key/value pairs");
        }
        Map<String, String> labels = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            labels.put(keyValues[i], keyValues[i + 1]);
        }
        return of(labels);
    }

    public String get(String key) {
        String value = labels.get(key);
        return value == null ? "" : value;
    }

    public boolean has(String key) {
        return !get(key).isEmpty();
    }

    public Map<String, String> asMap() {
        return labels;
    }

    public String namespace() {
        return get("namespace");
    }

    public String pod() {
        return get("pod");
    }

    public String uid() {
        return get("uid");
    }

    public String container() {
        return get("container");
    }

    public String node() {
        return get("node");
    }

    public String service() {
        return get("service");
    }

    public String clusterIp() {
        return get("cluster_ip");
    }

    public String createdByKind() {
        return get("created_by_kind");
    }

    public String createdByName() {
        return get("created_by_name");
    }

    public String podIp() {
        return get("pod_ip");
    }

    public String hostIp() {
        return get("host_ip");
    }

    public String internalIp() {
        return get("internal_ip");
    }

    public String phase() {
        return get("phase");
    }

    public String condition() {
        return get("condition");
    }

    public String reason() {
        return get("reason");
    }

    public String image() {
        return get("image");
    }

    public String replicaSet() {
        return get("replicaset");
    }

    public String ownerKind() {
        return get("owner_kind");
    }

    public String ownerName() {
        return get("owner_name");
    }

    public String level() {
        return get("level");
    }

    public String le() {
        return get("le");
    }

    public String status() {
        return get("status");
    }

    public String destination() {
        return get("destination");
    }

    public String actualDestination() {
        return get("actual_destination");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LabelSet other && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
