package com.topolens.core.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Node {
    private final String name;
    private String internalIp = "";
    private String osImage = "";
    private String kernelVersion = "";

    public Node(String name) {
        this.name = name;
    }
}
