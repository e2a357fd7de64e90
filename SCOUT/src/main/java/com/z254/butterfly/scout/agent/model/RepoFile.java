package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One file of a scanned repository.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepoFile {

    /**
     * Path relative to the repository root, always with forward slashes.
     */
    private String path;

    /**
     * Extension without the dot for recognised code files, otherwise null.
     */
    private String language;

    private long size;
    private boolean securityRelated;
    private boolean routeDefinition;
    private boolean config;
    private boolean test;
    private boolean dependencyManifest;
}
