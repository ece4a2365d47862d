package com.topolens.core.model;

/** Index key of an instance inside a {@link World}. */
public record InstanceRef(ApplicationId applicationId, String name) {}
