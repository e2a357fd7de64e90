package com.z254.butterfly.scout.agent;

import com.z254.butterfly.scout.agent.model.Severity;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * File classification and route detection tables used by the audit agents.
 */
public final class AuditPatterns {

    private AuditPatterns() {
    }

    /**
     * Directory names never descended into, in addition to hidden directories.
     */
    public static final Set<String> SKIPPED_DIRECTORIES = Set.of("node_modules", "__pycache__", "venv");

    public static final Set<String> CODE_EXTENSIONS = Set.of(
            // Popular languages
            ".py", ".js", ".ts", ".java", ".php", ".rb", ".go", ".rs", ".cpp", ".cs",
            ".kt", ".scala", ".swift", ".dart", ".c", ".h", ".hpp", ".cc",
            // Web technologies
            ".html", ".css", ".scss", ".jsx", ".tsx", ".vue", ".svelte",
            // Scripting
            ".sh", ".bash", ".ps1", ".pl", ".lua", ".r",
            // Functional
            ".clj", ".hs", ".ml", ".fs", ".ex", ".exs", ".erl",
            // Data and markup
            ".sql", ".json", ".xml", ".yaml", ".yml", ".toml", ".ini", ".md"
    );

    /**
     * Extensions reviewed as source code. Data and markup files are classified but not reviewed.
     */
    public static final Set<String> SOURCE_EXTENSIONS = Set.of(
            ".py", ".js", ".ts", ".java", ".php", ".rb", ".go", ".rs", ".cpp", ".cs",
            ".kt", ".scala", ".swift", ".dart", ".c", ".h", ".hpp", ".cc",
            ".jsx", ".tsx", ".vue", ".svelte", ".sh", ".bash", ".ps1", ".pl", ".lua",
            ".clj", ".hs", ".ml", ".fs", ".ex", ".exs", ".erl"
    );

    /**
     * Case-insensitive substrings of security-sensitive file names.
     */
    public static final List<String> SECURITY_NAME_PATTERNS = List.of(
            // Environment and configuration
            ".env", "config.py", "settings.py", "appsettings", "application.properties", "application.yml",
            "application.yaml", "web.config", "config.json", "config.xml", "config.toml", "config.ini",
            // Secrets and keys
            "secret", "password", "credential", "token", "private_key", "keystore", "truststore",
            "id_rsa", "id_dsa", "id_ecdsa", "id_ed25519", "auth",
            // Containers and infrastructure
            "dockerfile", "docker-compose", "kubernetes.yml", "k8s.yml", "deployment.yml", "terraform.tfvars",
            "serverless.yml", "cloudformation",
            // Databases
            "database.yml", "datasource.xml", "hibernate.cfg.xml", "schema.sql"
    );

    /**
     * Suffixes of key and certificate material.
     */
    public static final List<String> SECURITY_SUFFIXES = List.of(
            ".pem", ".crt", ".cer", ".p12", ".pfx", ".jks", ".key", ".tfvars"
    );

    public static final Set<String> DEPENDENCY_MANIFESTS = Set.of(
            "requirements.txt", "requirements-dev.txt", "pipfile", "pipfile.lock", "poetry.lock", "pyproject.toml",
            "package.json", "package-lock.json", "yarn.lock", "pnpm-lock.yaml",
            "pom.xml", "build.gradle", "build.gradle.kts", "gradle.properties",
            "gemfile", "gemfile.lock", "composer.json", "composer.lock",
            "go.mod", "go.sum", "cargo.toml", "cargo.lock", "mix.exs"
    );

    /**
     * Case-insensitive substrings of file names that usually define HTTP routes.
     */
    public static final List<String> ROUTE_NAME_PATTERNS = List.of(
            "routes.", "urls.py", "app.py", "main.py", "server.py", "views.py", "handlers.", "api.",
            "controller", "router.", "index.js", "app.js", "server.js", "index.ts", "app.ts", "server.ts",
            "web.php", "config.ru", "main.go", "startup.cs", "program.cs", "main.rs", "resource.java"
    );

    public static final Set<String> CONFIG_EXTENSIONS = Set.of(
            ".yml", ".yaml", ".json", ".toml", ".ini", ".properties", ".xml", ".cfg", ".conf", ".env"
    );

    /**
     * Route patterns. Each names the framework and the groups holding the method and the path;
     * a method group of 0 means the pattern does not capture one.
     */
    public static final List<EndpointPattern> ENDPOINT_PATTERNS = List.of(
            // Python - Flask
            new EndpointPattern("flask", Pattern.compile("@(?:app|bp|blueprint)\\.route\\(\\s*['\"]([^'\"]+)"), 0, 1),
            // Python - FastAPI
            new EndpointPattern("fastapi",
                    Pattern.compile("@(?:app|router)\\.(get|post|put|delete|patch|head|options)\\(\\s*['\"]([^'\"]+)"), 1, 2),
            // Python - Django
            new EndpointPattern("django", Pattern.compile("\\b(?:re_)?path\\(\\s*r?['\"]([^'\"]*)"), 0, 1),
            // JavaScript - Express, Koa, Fastify
            new EndpointPattern("express",
                    Pattern.compile("\\b(?:app|router|server|fastify)\\.(get|post|put|delete|patch|head|options|all)\\(\\s*['\"`]([^'\"`]+)"), 1, 2),
            // Java - Spring
            new EndpointPattern("spring",
                    Pattern.compile("@(Get|Post|Put|Delete|Patch|Request)Mapping\\(\\s*(?:(?:value|path)\\s*=\\s*)?\\{?\\s*\"([^\"]*)"), 1, 2),
            // Java - JAX-RS
            new EndpointPattern("jax-rs", Pattern.compile("@Path\\(\\s*\"([^\"]+)"), 0, 1),
            // PHP - Laravel
            new EndpointPattern("laravel",
                    Pattern.compile("Route::(get|post|put|delete|patch|options|any)\\(\\s*['\"]([^'\"]+)"), 1, 2),
            // Go - Gin, Echo
            new EndpointPattern("gin",
                    Pattern.compile("\\b(?:r|e|router|group)\\.(GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS)\\(\\s*\"([^\"]+)"), 1, 2),
            // Go - net/http, Gorilla
            new EndpointPattern("net/http", Pattern.compile("\\.HandleFunc\\(\\s*\"([^\"]+)"), 0, 1),
            // C# - ASP.NET Core
            new EndpointPattern("aspnet",
                    Pattern.compile("\\[Http(Get|Post|Put|Delete|Patch)\\(\\s*\"([^\"]+)"), 1, 2),
            new EndpointPattern("aspnet",
                    Pattern.compile("\\bMap(Get|Post|Put|Delete|Patch)\\(\\s*\"([^\"]+)"), 1, 2),
            // Ruby - Rails, Sinatra
            new EndpointPattern("rails",
                    Pattern.compile("^\\s*(get|post|put|delete|patch)\\s+['\"]([^'\"]+)", Pattern.MULTILINE), 1, 2)
    );

    /**
     * Text rules applied to security-related and source files.
     */
    public static final List<SecurityRule> SECURITY_RULES = List.of(
            new SecurityRule("aws-access-key", "AWS access key ID", Severity.CRITICAL,
                    Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
                    "Revoke the exposed AWS key and load credentials from the environment or a secret manager"),
            new SecurityRule("private-key", "Private key material", Severity.CRITICAL,
                    Pattern.compile("-----BEGIN (?:RSA |EC |DSA |OPENSSH )?PRIVATE KEY-----"),
                    "Remove private keys from the repository and rotate them"),
            new SecurityRule("hardcoded-password", "Hardcoded password", Severity.HIGH,
                    Pattern.compile("(?i)\\b(?:password|passwd|pwd)\\s*[:=]\\s*['\"][^'\"\\s]{4,}['\"]"),
                    "Move passwords to environment variables or a secret manager"),
            new SecurityRule("hardcoded-secret", "Hardcoded API key or token", Severity.HIGH,
                    Pattern.compile("(?i)\\b(?:api[_-]?key|secret(?:[_-]?key)?|access[_-]?token|auth[_-]?token)\\s*[:=]\\s*['\"][A-Za-z0-9_\\-/+=]{16,}['\"]"),
                    "Move API keys and tokens out of source control"),
            new SecurityRule("tls-verification-disabled", "TLS certificate verification disabled", Severity.HIGH,
                    Pattern.compile("verify\\s*=\\s*False|rejectUnauthorized\\s*:\\s*false|InsecureSkipVerify\\s*:\\s*true"),
                    "Keep TLS certificate verification enabled"),
            new SecurityRule("sql-concatenation", "SQL built by string concatenation", Severity.MEDIUM,
                    Pattern.compile("(?i)\\b(?:select|insert|update|delete)\\b[^;\\n]*['\"]\\s*\\+\\s*[A-Za-z_]"),
                    "Use parameterized queries"),
            new SecurityRule("dynamic-eval", "Dynamic code evaluation", Severity.MEDIUM,
                    Pattern.compile("(?<![\\w.])eval\\s*\\("),
                    "Avoid eval on data that can be influenced by users"),
            new SecurityRule("debug-enabled", "Debug mode enabled", Severity.LOW,
                    Pattern.compile("(?i)\\bdebug\\s*[:=]\\s*(?:true|True|1)\\b"),
                    "Disable debug mode outside development"),
            new SecurityRule("plain-http", "Plain HTTP URL", Severity.LOW,
                    Pattern.compile("http://(?!localhost|127\\.0\\.0\\.1|0\\.0\\.0\\.0)[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"),
                    "Use HTTPS for external endpoints")
    );

    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isSecurityRelated(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return SECURITY_NAME_PATTERNS.stream().anyMatch(lower::contains)
                || SECURITY_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    public static boolean isRouteDefinition(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return ROUTE_NAME_PATTERNS.stream().anyMatch(lower::contains);
    }

    public static boolean isDependencyManifest(String fileName) {
        return DEPENDENCY_MANIFESTS.contains(fileName.toLowerCase(Locale.ROOT));
    }

    public static boolean isConfig(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return CONFIG_EXTENSIONS.contains(extension(lower))
                || lower.startsWith(".env")
                || lower.contains("config")
                || lower.contains("settings");
    }

    public static boolean isTest(String relativePath) {
        String lower = relativePath.toLowerCase(Locale.ROOT);
        return lower.contains("test") || lower.contains("spec");
    }

    public record EndpointPattern(String framework, Pattern pattern, int methodGroup, int pathGroup) {
    }

    public record SecurityRule(String id, String title, Severity severity, Pattern pattern, String recommendation) {
    }
}
