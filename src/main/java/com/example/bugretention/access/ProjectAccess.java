package com.example.bugretention.access;

import com.example.bugretention.models.Project;
import java.util.List;
import java.util.Optional;

public interface ProjectAccess {

    List<Project> findAll();

    Optional<Project> findById(String projectId);

    Project save(Project project);
}
