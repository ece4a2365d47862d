package com.topolens.core.model;

public enum ContainerStatus {
    UNKNOWN,
    WAITING,
    RUNNING,
    TERMINATED
}
