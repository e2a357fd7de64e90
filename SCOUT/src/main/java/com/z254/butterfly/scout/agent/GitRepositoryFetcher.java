package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.config.ScoutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Resolves a repository identifier to a local directory: an existing directory is used in
 * place, a remote URL is cloned with the {@code git} command line into the workspace.
 */
@Component
@Slf4j
public class GitRepositoryFetcher {

    private static final Pattern REMOTE = Pattern.compile("^(?:https?|ssh|git|file)://.+|^[\\w.-]+@[\\w.-]+:.+");

    private final Path workspace;
    private final Duration cloneTimeout;

    public GitRepositoryFetcher(ScoutProperties scoutProperties) {
        this.workspace = Paths.get(scoutProperties.getAnalysis().getWorkspaceDir());
        this.cloneTimeout = scoutProperties.getAnalysis().getCloneTimeout();
    }

    /**
     * @param repository a local directory or a git URL
     * @return the directory holding the working tree
     */
    public FetchedRepository fetch(String repository) throws IOException, InterruptedException {
        Path local = asLocalDirectory(repository);
        if (local != null) {
            log.info("Using local repository {}", local);
            return new FetchedRepository(local, false);
        }
        if (!isRemote(repository)) {
            throw new IllegalArgumentException("Repository is neither a directory nor a git URL: " + repository);
        }

        Files.createDirectories(workspace);
        Path target = workspace.resolve(repositoryName(repository) + "-" + UUID.randomUUID().toString().substring(0, 8));
        Path output = Files.createTempFile(workspace, "clone-", ".log");
        List<String> command = List.of("git", "clone", "--depth", "1", "--quiet", repository, target.toString());

        log.info("Cloning {} into {}", repository, target);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        builder.redirectOutput(output.toFile());
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            Files.deleteIfExists(output);
            throw new IOException("Failed to start git: " + e.getMessage(), e);
        }
        boolean cloned = false;
        try {
            if (!process.waitFor(cloneTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
                throw new IOException("git clone timed out after " + cloneTimeout.toSeconds() + "s: " + repository);
            }
            if (process.exitValue() != 0) {
                String detail = Files.readString(output, StandardCharsets.UTF_8).trim();
                throw new IOException("git clone failed with exit code " + process.exitValue() + ": " + detail);
            }
            cloned = true;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            Files.deleteIfExists(output);
            if (!cloned) {
                deleteTree(target);
            }
        }
        return new FetchedRepository(target, true);
    }

    /**
     * Delete a working tree cloned into the workspace. Paths outside the workspace, such as
     * local repositories analysed in place, are left alone.
     *
     * @return true if the tree existed and was deleted
     */
    public boolean release(Path path) {
        Path root = workspace.toAbsolutePath().normalize();
        Path tree = path.toAbsolutePath().normalize();
        if (!tree.startsWith(root) || tree.equals(root)) {
            log.warn("Refusing to delete {}: not inside workspace {}", tree, root);
            return false;
        }
        boolean deleted = deleteTree(tree);
        if (deleted) {
            log.info("Deleted cloned repository {}", tree);
        }
        return deleted;
    }

    static boolean isRemote(String repository) {
        return REMOTE.matcher(repository).matches();
    }

    static String repositoryName(String repository) {
        String trimmed = repository.replaceAll("/+$", "");
        String name = trimmed.substring(Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':')) + 1);
        if (name.toLowerCase(Locale.ROOT).endsWith(".git")) {
            name = name.substring(0, name.length() - 4);
        }
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() ? "repository" : name;
    }

    private static Path asLocalDirectory(String repository) {
        if (isRemote(repository)) {
            return null;
        }
        try {
            Path path = Paths.get(repository).toAbsolutePath().normalize();
            return Files.isDirectory(path) ? path : null;
        } catch (java.nio.file.InvalidPathException e) {
            return null;
        }
    }

    private static boolean deleteTree(Path tree) {
        try {
            return FileSystemUtils.deleteRecursively(tree);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", tree, e.getMessage());
            return false;
        }
    }

    public record FetchedRepository(Path path, boolean cloned) {
    }
}
