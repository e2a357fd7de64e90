package com.z254.butterfly.scout.agent.impl;

import com.z254.butterfly.scout.agent.AuditAgent;
import com.z254.butterfly.scout.agent.AuditAgentType;
import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.GitRepositoryFetcher;
import com.z254.butterfly.scout.agent.RepositoryScanner;
import com.z254.butterfly.scout.agent.model.RepoMetadata;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.TaskResult;
import com.z254.butterfly.scout.messaging.MessageBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Repository Cloner agent.
 * Resolves the requested repository to a working tree, scans it and publishes the
 * file inventory and detected endpoints for the analysts.
 */
@Component
@Slf4j
public class RepositoryClonerAgent implements AuditAgent {

    private final GitRepositoryFetcher fetcher;
    private final RepositoryScanner scanner;

    public RepositoryClonerAgent(GitRepositoryFetcher fetcher, RepositoryScanner scanner) {
        this.fetcher = fetcher;
        this.scanner = scanner;
    }

    @Override
    public AuditAgentType getAgentType() {
        return AuditAgentType.REPOSITORY_CLONER;
    }

    @Override
    public TaskResult runTask(String agentName, SharedContextManager context, MessageBroker broker) throws Exception {
        String repository = context.get(AuditContextKeys.REQUEST_REPOSITORY, String.class)
                .filter(value -> !value.isBlank())
                .orElse(null);
        if (repository == null) {
            return TaskResult.failure("No repository requested");
        }

        GitRepositoryFetcher.FetchedRepository fetched = fetcher.fetch(repository);
        RepositoryScanner.ScanResult scan;
        try {
            scan = scanner.scan(fetched.path());
        } catch (IOException | RuntimeException e) {
            if (fetched.cloned()) {
                fetcher.release(fetched.path());
            }
            throw e;
        }

        RepoMetadata metadata = RepoMetadata.builder()
                .repository(repository)
                .localPath(fetched.path().toString())
                .cloned(fetched.cloned())
                .fileCount(scan.files().size())
                .directoryCount(scan.directoryCount())
                .languages(scan.languages())
                .truncated(scan.truncated())
                .scannedAt(Instant.now())
                .build();

        // repo/files goes last: analysts wait on it and read the other two
        context.set(AuditContextKeys.REPO_METADATA, metadata, agentName);
        context.set(AuditContextKeys.REPO_ENDPOINTS, scan.endpoints(), agentName);
        context.set(AuditContextKeys.REPO_FILES, scan.files(), agentName);

        broker.publish(AuditContextKeys.TOPIC_REPO_READY,
                Map.of("repository", repository, "files", scan.files().size()), agentName);

        log.info("Scanned {}: {} files, {} endpoints, languages {}",
                repository, scan.files().size(), scan.endpoints().size(), scan.languages());
        return TaskResult.success(Map.of(
                "files", scan.files().size(),
                "endpoints", scan.endpoints().size(),
                "truncated", scan.truncated()));
    }
}
