package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.agent.model.Endpoint;
import com.z254.butterfly.scout.agent.model.RepoFile;
import com.z254.butterfly.scout.config.ScoutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.regex.Matcher;

/**
 * Walks a repository tree, classifies its files and extracts HTTP routes from route files.
 */
@Component
@Slf4j
public class RepositoryScanner {

    private final int maxFiles;
    private final long maxFileBytes;

    public RepositoryScanner(ScoutProperties scoutProperties) {
        this.maxFiles = scoutProperties.getAnalysis().getMaxFilesScanned();
        this.maxFileBytes = scoutProperties.getAnalysis().getMaxFileBytes();
    }

    /**
     * Scan a repository.
     *
     * @param root the repository root directory
     * @return classified files, extracted endpoints and detected languages
     */
    public ScanResult scan(Path root) throws IOException {
        List<RepoFile> files = new ArrayList<>();
        Set<String> languages = new TreeSet<>();
        int[] directories = {0};
        boolean[] truncated = {false};

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || AuditPatterns.SKIPPED_DIRECTORIES.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                directories[0]++;
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                if (files.size() >= maxFiles) {
                    truncated[0] = true;
                    return FileVisitResult.TERMINATE;
                }
                RepoFile repoFile = classify(root.relativize(file), attrs.size());
                if (repoFile.getLanguage() != null) {
                    languages.add(repoFile.getLanguage());
                }
                files.add(repoFile);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(Comparator.comparing(RepoFile::getPath));
        List<Endpoint> endpoints = extractEndpoints(root, files);
        log.debug("Scanned {}: files={}, directories={}, endpoints={}, truncated={}",
                root, files.size(), directories[0], endpoints.size(), truncated[0]);
        return new ScanResult(files, endpoints, new ArrayList<>(languages), directories[0], truncated[0]);
    }

    /**
     * Read a scanned file as UTF-8, malformed bytes replaced.
     *
     * @return the content, or empty if the file is missing or larger than the configured limit
     */
    public Optional<String> read(Path root, String relativePath) {
        Path file = root.resolve(relativePath).normalize();
        if (!file.startsWith(root.normalize())) {
            return Optional.empty();
        }
        try {
            if (!Files.isRegularFile(file) || Files.size(file) > maxFileBytes) {
                return Optional.empty();
            }
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    RepoFile classify(Path relative, long size) {
        String path = relative.toString().replace('\\', '/');
        String name = relative.getFileName().toString();
        String extension = AuditPatterns.extension(name);
        return RepoFile.builder()
                .path(path)
                .language(AuditPatterns.CODE_EXTENSIONS.contains(extension) ? extension.substring(1) : null)
                .size(size)
                .securityRelated(AuditPatterns.isSecurityRelated(name))
                .routeDefinition(AuditPatterns.isRouteDefinition(name))
                .config(AuditPatterns.isConfig(name))
                .test(AuditPatterns.isTest(path))
                .dependencyManifest(AuditPatterns.isDependencyManifest(name))
                .build();
    }

    private List<Endpoint> extractEndpoints(Path root, List<RepoFile> files) {
        Map<String, Endpoint> endpoints = new LinkedHashMap<>();
        for (RepoFile file : files) {
            if (!file.isRouteDefinition()) {
                continue;
            }
            read(root, file.getPath()).ifPresent(content -> {
                for (AuditPatterns.EndpointPattern pattern : AuditPatterns.ENDPOINT_PATTERNS) {
                    Matcher matcher = pattern.pattern().matcher(content);
                    while (matcher.find()) {
                        String method = pattern.methodGroup() > 0
                                ? matcher.group(pattern.methodGroup()).toUpperCase(Locale.ROOT)
                                : "ANY";
                        if ("REQUEST".equals(method) || "ALL".equals(method)) {
                            method = "ANY";
                        }
                        String route = matcher.group(pattern.pathGroup());
                        Endpoint endpoint = Endpoint.builder()
                                .path(route)
                                .method(method)
                                .framework(pattern.framework())
                                .file(file.getPath())
                                .line(lineOf(content, matcher.start()))
                                .build();
                        endpoints.putIfAbsent(method + " " + route + " " + file.getPath(), endpoint);
                    }
                }
            });
        }
        return new ArrayList<>(endpoints.values());
    }

    public static int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    public record ScanResult(List<RepoFile> files,
                             List<Endpoint> endpoints,
                             List<String> languages,
                             int directoryCount,
                             boolean truncated) {
    }
}
