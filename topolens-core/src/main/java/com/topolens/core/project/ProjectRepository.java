package com.topolens.core.project;

import com.topolens.core.model.Project;
import java.util.List;

public interface ProjectRepository {
    List<Project> findAll();
}
