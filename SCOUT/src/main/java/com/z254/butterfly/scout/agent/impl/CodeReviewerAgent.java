package com.z254.butterfly.scout.agent.impl;

import com.z254.butterfly.scout.agent.AuditAgent;
import com.z254.butterfly.scout.agent.AuditAgentType;
import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.AuditPatterns;
import com.z254.butterfly.scout.agent.RepositoryScanner;
import com.z254.butterfly.scout.agent.model.CodeReview;
import com.z254.butterfly.scout.agent.model.RepoFile;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.TaskResult;
import com.z254.butterfly.scout.messaging.MessageBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Code Reviewer agent.
 * Derives maintainability indicators from the repository's source files: file sizes,
 * TODO/FIXME density, test coverage by file count and documentation presence.
 * Without deep analysis only the first {@value #SAMPLE_SIZE} source files are read.
 */
@Component
@Slf4j
public class CodeReviewerAgent implements AuditAgent {

    static final int SAMPLE_SIZE = 50;
    static final int LARGE_FILE_LINES = 500;

    private static final Pattern MARKER = Pattern.compile("\\b(?:TODO|FIXME|XXX|HACK)\\b");

    private final RepositoryScanner scanner;

    public CodeReviewerAgent(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public AuditAgentType getAgentType() {
        return AuditAgentType.CODE_REVIEWER;
    }

    @Override
    public TaskResult runTask(String agentName, SharedContextManager context, MessageBroker broker) {
        Path root = readRepositoryRoot(context);
        List<RepoFile> files = readFiles(context);
        boolean deep = readOptions(context).isDeepAnalysis();

        List<RepoFile> sources = files.stream()
                .filter(file -> AuditPatterns.SOURCE_EXTENSIONS.contains(AuditPatterns.extension(file.getPath())))
                .collect(Collectors.toList());
        List<RepoFile> sample = deep ? sources : sources.stream().limit(SAMPLE_SIZE).collect(Collectors.toList());

        int totalLines = 0;
        int markers = 0;
        int reviewed = 0;
        Map<String, Integer> largeFiles = new LinkedHashMap<>();
        for (RepoFile file : sample) {
            Optional<String> content = scanner.read(root, file.getPath());
            if (content.isEmpty()) {
                continue;
            }
            reviewed++;
            int lines = countLines(content.get());
            totalLines += lines;
            if (lines > LARGE_FILE_LINES) {
                largeFiles.put(file.getPath(), lines);
            }
            Matcher matcher = MARKER.matcher(content.get());
            while (matcher.find()) {
                markers++;
            }
        }

        long tests = sources.stream().filter(RepoFile::isTest).count();
        double testRatio = sources.isEmpty() ? 0.0 : (double) tests / sources.size();
        boolean hasReadme = files.stream()
                .anyMatch(file -> !file.getPath().contains("/")
                        && file.getPath().toLowerCase(Locale.ROOT).startsWith("readme"));
        double markerDensity = totalLines == 0 ? 0.0 : markers * 1000.0 / totalLines;

        List<String> violations = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        List<String> architecture = new ArrayList<>();
        List<String> documentation = new ArrayList<>();

        double score = 10.0;
        if (!largeFiles.isEmpty()) {
            score -= Math.min(3.0, 0.5 * largeFiles.size());
            violations.add(largeFiles.size() + " source files exceed " + LARGE_FILE_LINES + " lines");
            largeFiles.forEach((path, lines) -> issues.add(path + " has " + lines + " lines"));
            architecture.add("Split large source files into smaller, single-purpose modules");
        }
        if (!sources.isEmpty() && tests == 0) {
            score -= 2.0;
            violations.add("No automated tests found");
            architecture.add("Add an automated test suite and run it in continuous integration");
        } else if (testRatio < 0.1 && !sources.isEmpty()) {
            score -= 1.0;
            violations.add(String.format(Locale.ROOT, "Low test coverage by file count (%.0f%%)", testRatio * 100));
            architecture.add("Increase test coverage of core modules");
        }
        if (markerDensity > 5.0) {
            score -= 1.0;
            violations.add(markers + " TODO/FIXME markers left in code");
            issues.add(String.format(Locale.ROOT, "%.1f TODO/FIXME markers per 1000 lines", markerDensity));
        }
        if (!hasReadme) {
            score -= 1.5;
            documentation.add("Repository has no README");
            architecture.add("Document setup, configuration and architecture in a README");
        }
        if (sources.isEmpty()) {
            documentation.add("No source files were found to review");
        }
        score = Math.round(Math.max(0.0, Math.min(10.0, score)) * 10.0) / 10.0;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("sourceFiles", sources.size());
        metrics.put("filesReviewed", reviewed);
        metrics.put("totalLines", totalLines);
        metrics.put("averageLines", reviewed == 0 ? 0 : totalLines / reviewed);
        metrics.put("largeFiles", largeFiles.size());
        metrics.put("todoMarkers", markers);
        metrics.put("testFiles", tests);
        metrics.put("testRatio", Math.round(testRatio * 100.0) / 100.0);
        metrics.put("hasReadme", hasReadme);
        metrics.put("deepAnalysis", deep);

        CodeReview review = CodeReview.builder()
                .maintainabilityScore(score)
                .bestPracticesViolations(violations)
                .codeQualityIssues(issues)
                .architectureRecommendations(architecture)
                .documentationGaps(documentation)
                .metrics(metrics)
                .build();
        context.set(AuditContextKeys.ANALYSIS_CODE_REVIEW, review, agentName);

        log.info("Code review finished: score {}, {} of {} source files reviewed", score, reviewed, sources.size());
        return TaskResult.success(Map.of("maintainabilityScore", score, "filesReviewed", reviewed));
    }

    static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
