package org.rostilos.devopsbridge.azdoclient.config;

import java.time.Duration;

public final class AzureDevOpsConfig {

    /**
     * Object id Azure DevOps expects as {@code oldObjectId} when a ref did not exist before the update.
     */
    public static final String ZERO_OBJECT_ID = "0000000000000000000000000000000000000000";

    public static final String REFS_PREFIX = "refs/";
    public static final String BRANCH_REF_PREFIX = "refs/heads/";

    public static final String API_VERSION_PROJECTS = "7.1-preview.4";
    public static final String API_VERSION_GIT = "7.1-preview.1";
    public static final String API_VERSION_PUSHES = "7.1-preview.2";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_USER_AGENT = "azure-devops-mcp/1.0";

    private AzureDevOpsConfig() {
        // Utility class
    }

    /**
     * {@code main} and {@code refs/heads/main} both become {@code refs/heads/main}.
     */
    public static String toBranchRef(String branchName) {
        if (branchName == null || branchName.isBlank()) {
            throw new IllegalArgumentException("Branch name cannot be null or empty");
        }
        String trimmed = branchName.trim();
        return trimmed.startsWith(REFS_PREFIX) ? trimmed : BRANCH_REF_PREFIX + trimmed;
    }

    public static String toShortBranchName(String branchRef) {
        if (branchRef == null) {
            return null;
        }
        return branchRef.startsWith(BRANCH_REF_PREFIX) ? branchRef.substring(BRANCH_REF_PREFIX.length()) : branchRef;
    }

    public static boolean isQualifiedRef(String refName) {
        return refName != null && refName.startsWith(REFS_PREFIX) && refName.length() > REFS_PREFIX.length();
    }
}
