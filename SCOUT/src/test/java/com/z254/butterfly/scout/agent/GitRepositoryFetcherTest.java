package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.config.ScoutProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitRepositoryFetcherTest {

    @TempDir
    Path workspace;

    @Test
    void shouldUseLocalDirectoryInPlace() throws Exception {
        GitRepositoryFetcher fetcher = new GitRepositoryFetcher(properties());

        GitRepositoryFetcher.FetchedRepository fetched = fetcher.fetch(workspace.toString());

        assertThat(fetched.cloned()).isFalse();
        assertThat(fetched.path()).isEqualTo(workspace.toAbsolutePath().normalize());
    }

    @Test
    void shouldRejectRepositoryThatIsNeitherDirectoryNorUrl() {
        GitRepositoryFetcher fetcher = new GitRepositoryFetcher(properties());

        assertThatThrownBy(() -> fetcher.fetch(workspace.resolve("missing").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("neither a directory nor a git URL");
    }

    @Test
    void shouldLeaveNothingBehindWhenCloneFails() throws Exception {
        GitRepositoryFetcher fetcher = new GitRepositoryFetcher(properties());
        String missingRemote = workspace.resolve("no-such-remote").toUri().toString();

        assertThatThrownBy(() -> fetcher.fetch(missingRemote))
                .isInstanceOf(IOException.class);

        Path clones = workspace.resolve("clones");
        try (Stream<Path> leftovers = Files.list(clones)) {
            assertThat(leftovers).isEmpty();
        }
    }

    @Test
    void shouldDeleteClonedTreeInsideWorkspace() throws Exception {
        GitRepositoryFetcher fetcher = new GitRepositoryFetcher(properties());
        Path clone = workspace.resolve("clones/repo-1234");
        Files.createDirectories(clone.resolve("src"));
        Files.writeString(clone.resolve("src/app.py"), "print('hi')\n");

        assertThat(fetcher.release(clone)).isTrue();
        assertThat(clone).doesNotExist();
    }

    @Test
    void shouldRefuseToDeleteOutsideWorkspace() throws Exception {
        GitRepositoryFetcher fetcher = new GitRepositoryFetcher(properties());
        Path project = workspace.resolve("project");
        Files.createDirectories(project);

        assertThat(fetcher.release(project)).isFalse();
        assertThat(fetcher.release(workspace.resolve("clones"))).isFalse();
        assertThat(project).isDirectory();
    }

    @Test
    void shouldRecognizeRemoteUrls() {
        assertThat(GitRepositoryFetcher.isRemote("https://github.com/org/repo.git")).isTrue();
        assertThat(GitRepositoryFetcher.isRemote("git@github.com:org/repo.git")).isTrue();
        assertThat(GitRepositoryFetcher.isRemote("ssh://git@host/org/repo")).isTrue();
        assertThat(GitRepositoryFetcher.isRemote("/home/user/repo")).isFalse();
        assertThat(GitRepositoryFetcher.isRemote("repo")).isFalse();
    }

    @Test
    void shouldDeriveDirectoryNameFromUrl() {
        assertThat(GitRepositoryFetcher.repositoryName("https://github.com/org/AI-Security-Agent.git"))
                .isEqualTo("AI-Security-Agent");
        assertThat(GitRepositoryFetcher.repositoryName("git@github.com:org/repo")).isEqualTo("repo");
        assertThat(GitRepositoryFetcher.repositoryName("https://host/org/repo/")).isEqualTo("repo");
    }

    private ScoutProperties properties() {
        ScoutProperties properties = new ScoutProperties();
        properties.getAnalysis().setWorkspaceDir(workspace.resolve("clones").toString());
        return properties;
    }
}
