package com.topolens.core.model;

/** Role of a database instance inside its cluster, encoded as a series value. */
public enum ClusterRole {
    NONE(0),
    PRIMARY(1),
    REPLICA(2);

    private final float value;

    ClusterRole(float value) {
        this.value = value;
    }

    public float value() {
        return value;
    }

    public static ClusterRole fromLabel(String role) {
        if (role == null) {
            return NONE;
        }
        return switch (role) {
            case "primary", "master" -> PRIMARY;
            case "replica", "standby" -> REPLICA;
            default -> NONE;
        };
    }

    public static ClusterRole fromValue(float v) {
        if (v == PRIMARY.value) {
            return PRIMARY;
        }
        if (v == REPLICA.value) {
            return REPLICA;
        }
        return NONE;
    }
}
