package com.z254.butterfly.scout.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepoMetadata {

    private String repository;
    private String localPath;

    /**
     * True when the repository was cloned into the workspace rather than read in place.
     */
    private boolean cloned;

    private int fileCount;
    private int directoryCount;
    private List<String> languages;

    /**
     * True when the scan stopped at the configured file limit.
     */
    private boolean truncated;

    private Instant scannedAt;
}
