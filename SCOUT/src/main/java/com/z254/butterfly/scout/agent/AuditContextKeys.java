package com.z254.butterfly.scout.agent;

/**
 * Context paths, relative to the run namespace, exchanged by the audit agents.
 */
public final class AuditContextKeys {

    private AuditContextKeys() {
    }

    public static final String REQUEST_REPOSITORY = "request/repository";
    public static final String REQUEST_OPTIONS = "request/options";

    public static final String REPO = "repo";
    public static final String REPO_METADATA = "repo/metadata";
    public static final String REPO_FILES = "repo/files";
    public static final String REPO_ENDPOINTS = "repo/endpoints";

    public static final String ANALYSIS_SECURITY = "analysis/security";
    public static final String ANALYSIS_CODE_REVIEW = "analysis/code_review";

    public static final String REPORT_SUMMARY = "report/summary";

    /**
     * Broadcast topic announcing that the repository scan is available.
     */
    public static final String TOPIC_REPO_READY = "repo/ready";
}
