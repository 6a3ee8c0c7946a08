package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Result of inspecting one directory for project-root markers.
 */
@Value
@Builder
@Jacksonized
public class ProjectRootDetection {
    boolean projectRoot;
    List<String> signals;
    ProjectType projectType;  // null when not a project root
    double confidence;

    public static ProjectRootDetection none() {
        return ProjectRootDetection.builder()
            .projectRoot(false)
            .signals(List.of())
            .confidence(0.0)
            .build();
    }
}
