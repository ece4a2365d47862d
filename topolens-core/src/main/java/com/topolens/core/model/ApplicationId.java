package com.topolens.core.model;

import java.util.Objects;

/** Value identity of a workload; equal ids denote the same application. */
public record ApplicationId(String namespace, ApplicationKind kind, String name) {

    public ApplicationId {
        Objects.requireNonNull(kind, "kind");
        namespace = namespace == null ? "" : namespace;
        name = name == null ? "" : name;
    }

    /** Parses the {@code namespace:Kind:name} form produced by {@link #toString()}. */
    public static ApplicationId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("application id is null");
        }
        String[] parts = value.split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("invalid application id: " + value);
        }
        ApplicationKind kind = ApplicationKind.fromLabel(parts[1])
                .orElseThrow(() -> new IllegalArgumentException("unknown application kind: " + parts[1]));
        return new ApplicationId(parts[0], kind, parts[2]);
    }

    @Override
    public String toString() {
        return namespace + ":" + kind.label() + ":" + name;
    }
}
