package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.agent.model.RepoFile;
import com.z254.butterfly.scout.agent.model.RepoMetadata;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.AgentTask;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * An audit pipeline stage. Implementations are Spring beans collected by {@link AgentRegistry}.
 * Every agent works on the run-scoped context, so paths are those of {@link AuditContextKeys}.
 */
public interface AuditAgent extends AgentTask {

    AuditAgentType getAgentType();

    default String getAgentName() {
        return getAgentType().getAgentName();
    }

    default AnalysisOptions readOptions(SharedContextManager context) {
        return context.get(AuditContextKeys.REQUEST_OPTIONS, AnalysisOptions.class)
                .orElseGet(AnalysisOptions::defaults);
    }

    @SuppressWarnings("unchecked")
    default List<RepoFile> readFiles(SharedContextManager context) {
        return context.get(AuditContextKeys.REPO_FILES, List.class)
                .map(files -> (List<RepoFile>) files)
                .orElse(List.of());
    }

    /**
     * @throws IllegalStateException if the repository has not been fetched
     */
    default Path readRepositoryRoot(SharedContextManager context) {
        return context.get(AuditContextKeys.REPO_METADATA, RepoMetadata.class)
                .map(metadata -> Paths.get(metadata.getLocalPath()))
                .orElseThrow(() -> new IllegalStateException("Repository metadata is not available"));
    }
}
