package com.topolens.core.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

@Getter
public class Service {
    private final String name;
    private final String namespace;
    private final String clusterIp;
    private final List<Connection> connections = new ArrayList<>();

    public Service(String name, String namespace, String clusterIp) {
        this.name = name;
        this.namespace = namespace;
        this.clusterIp = clusterIp;
    }
}
