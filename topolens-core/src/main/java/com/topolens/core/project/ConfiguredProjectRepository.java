package com.topolens.core.project;

import com.topolens.core.config.TopolensProperties;
import com.topolens.core.model.Project;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Projects declared under {@code topolens.projects}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredProjectRepository implements ProjectRepository {
    private final TopolensProperties properties;

    @Override
    public List<Project> findAll() {
        List<Project> projects = new ArrayList<>();
        for (TopolensProperties.ProjectConfig cfg : properties.getProjects()) {
            if (cfg.getId() == null || cfg.getId().isBlank()) {
                log.warn("Skipping project without id: name={}", cfg.getName());
                continue;
            }
            if (cfg.getRefreshInterval() == null || cfg.getRefreshInterval().getSeconds() <= 0) {
                log.warn("Skipping project {} with invalid refresh interval {}", cfg.getId(), cfg.getRefreshInterval());
                continue;
            }
            String name = cfg.getName() == null ? cfg.getId() : cfg.getName();
            projects.add(new Project(cfg.getId(), name, cfg.getRefreshInterval(), cfg.getExtraSelector()));
        }
        return projects;
    }
}
