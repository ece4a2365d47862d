package com.topolens.core.model;

import java.util.List;

public record ApplicationDeploymentDetails(List<String> containerImages) {

    public ApplicationDeploymentDetails {
        containerImages = containerImages == null ? List.of() : List.copyOf(containerImages);
    }
}
