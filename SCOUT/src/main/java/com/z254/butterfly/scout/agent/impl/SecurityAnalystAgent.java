package com.z254.butterfly.scout.agent.impl;

import com.z254.butterfly.scout.agent.AuditAgent;
import com.z254.butterfly.scout.agent.AuditAgentType;
import com.z254.butterfly.scout.agent.AuditContextKeys;
import com.z254.butterfly.scout.agent.AuditPatterns;
import com.z254.butterfly.scout.agent.RepositoryScanner;
import com.z254.butterfly.scout.agent.model.RepoFile;
import com.z254.butterfly.scout.agent.model.SecurityAnalysis;
import com.z254.butterfly.scout.agent.model.SecurityFinding;
import com.z254.butterfly.scout.agent.model.Severity;
import com.z254.butterfly.scout.context.SharedContextManager;
import com.z254.butterfly.scout.domain.model.AnalysisOptions;
import com.z254.butterfly.scout.domain.model.TaskResult;
import com.z254.butterfly.scout.messaging.MessageBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Security Analyst agent.
 * Applies the secret and weakness rules of {@link AuditPatterns#SECURITY_RULES} to the
 * security-related, configuration and source files of the scanned repository, flags
 * committed key material and, when dependencies are included, unpinned requirements.
 */
@Component
@Slf4j
public class SecurityAnalystAgent implements AuditAgent {

    private static final Set<String> KEY_SUFFIXES = Set.of(".pem", ".key", ".p12", ".pfx", ".jks");
    private static final String NO_FINDINGS_RECOMMENDATION =
            "No issues matched the rule set; keep secrets out of source control and review access controls";

    private final RepositoryScanner scanner;

    public SecurityAnalystAgent(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public AuditAgentType getAgentType() {
        return AuditAgentType.SECURITY_ANALYST;
    }

    @Override
    public TaskResult runTask(String agentName, SharedContextManager context, MessageBroker broker) {
        Path root = readRepositoryRoot(context);
        List<RepoFile> files = readFiles(context);
        AnalysisOptions options = readOptions(context);

        Map<String, SecurityFinding> findings = new LinkedHashMap<>();
        List<String> manifests = new ArrayList<>();
        int scanned = 0;

        for (RepoFile file : files) {
            if (file.isDependencyManifest()) {
                manifests.add(file.getPath());
            }
            if (!shouldScan(file, options)) {
                continue;
            }
            sensitiveFile(file).ifPresent(finding -> add(findings, finding));
            Optional<String> content = scanner.read(root, file.getPath());
            if (content.isEmpty()) {
                continue;
            }
            scanned++;
            applyRules(file.getPath(), content.get()).forEach(finding -> add(findings, finding));
            if (options.isIncludeDeps() && isRequirementsFile(file)) {
                unpinnedRequirements(file.getPath(), content.get()).forEach(finding -> add(findings, finding));
            }
        }

        List<SecurityFinding> sorted = findings.values().stream()
                .sorted(Comparator.comparing((SecurityFinding f) -> f.getSeverity().getRank()).reversed()
                        .thenComparing(SecurityFinding::getFile)
                        .thenComparingInt(SecurityFinding::getLine))
                .collect(Collectors.toList());

        Severity risk = sorted.isEmpty() ? Severity.LOW : sorted.get(0).getSeverity();
        List<String> recommendations = sorted.stream()
                .map(SecurityFinding::getRecommendation)
                .distinct()
                .collect(Collectors.toList());
        if (recommendations.isEmpty()) {
            recommendations.add(NO_FINDINGS_RECOMMENDATION);
        }

        SecurityAnalysis analysis = SecurityAnalysis.builder()
                .riskLevel(risk)
                .confidenceScore(confidence(scanned, files.size()))
                .filesScanned(scanned)
                .findings(sorted)
                .vulnerabilities(sorted.stream().map(SecurityFinding::describe).collect(Collectors.toList()))
                .dependencyManifests(options.isIncludeDeps() ? manifests : List.of())
                .recommendations(recommendations)
                .build();
        context.set(AuditContextKeys.ANALYSIS_SECURITY, analysis, agentName);

        log.info("Security analysis finished: risk {}, {} findings in {} files", risk, sorted.size(), scanned);
        return TaskResult.success(Map.of("riskLevel", risk.name(), "findings", sorted.size()));
    }

    private static boolean shouldScan(RepoFile file, AnalysisOptions options) {
        if (file.isSecurityRelated() || file.isConfig()) {
            return true;
        }
        if (file.isDependencyManifest()) {
            return options.isIncludeDeps();
        }
        return AuditPatterns.SOURCE_EXTENSIONS.contains(AuditPatterns.extension(fileName(file)));
    }

    static Optional<SecurityFinding> sensitiveFile(RepoFile file) {
        String name = fileName(file).toLowerCase(Locale.ROOT);
        boolean keyMaterial = KEY_SUFFIXES.contains(AuditPatterns.extension(name))
                || name.matches("id_(rsa|dsa|ecdsa|ed25519)");
        boolean environment = name.equals(".env")
                || (name.startsWith(".env.") && !name.endsWith(".example") && !name.endsWith(".sample"));
        if (!keyMaterial && !environment) {
            return Optional.empty();
        }
        return Optional.of(SecurityFinding.builder()
                .ruleId(keyMaterial ? "committed-key-material" : "committed-env-file")
                .title(keyMaterial ? "Key or certificate material committed" : "Environment file committed")
                .severity(Severity.HIGH)
                .file(file.getPath())
                .line(0)
                .recommendation(keyMaterial
                        ? "Remove key material from the repository and rotate it"
                        : "Remove environment files from the repository and add them to .gitignore")
                .build());
    }

    static List<SecurityFinding> applyRules(String path, String content) {
        List<SecurityFinding> findings = new ArrayList<>();
        for (AuditPatterns.SecurityRule rule : AuditPatterns.SECURITY_RULES) {
            Matcher matcher = rule.pattern().matcher(content);
            while (matcher.find()) {
                findings.add(SecurityFinding.builder()
                        .ruleId(rule.id())
                        .title(rule.title())
                        .severity(rule.severity())
                        .file(path)
                        .line(RepositoryScanner.lineOf(content, matcher.start()))
                        .recommendation(rule.recommendation())
                        .build());
            }
        }
        return findings;
    }

    static List<SecurityFinding> unpinnedRequirements(String path, String content) {
        List<SecurityFinding> findings = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("-")) {
                continue;
            }
            if (!line.contains("==")) {
                findings.add(SecurityFinding.builder()
                        .ruleId("unpinned-dependency")
                        .title("Unpinned dependency " + line.split("[\\s;<>=~!\\[]")[0])
                        .severity(Severity.LOW)
                        .file(path)
                        .line(i + 1)
                        .recommendation("Pin dependency versions to get reproducible, auditable builds")
                        .build());
            }
        }
        return findings;
    }

    private static boolean isRequirementsFile(RepoFile file) {
        String name = fileName(file).toLowerCase(Locale.ROOT);
        return name.startsWith("requirements") && name.endsWith(".txt");
    }

    private static double confidence(int scanned, int total) {
        if (total == 0) {
            return 0.0;
        }
        return scanned == 0 ? 0.5 : 0.8;
    }

    private static void add(Map<String, SecurityFinding> findings, SecurityFinding finding) {
        findings.putIfAbsent(finding.getRuleId() + "|" + finding.getFile() + "|" + finding.getLine(), finding);
    }

    private static String fileName(RepoFile file) {
        String path = file.getPath();
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
