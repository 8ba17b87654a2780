package org.rostilos.devopsbridge.azdoclient.model;

/**
 * A Git repository inside an Azure DevOps project.
 */
public record RepositoryRef(
    /**
     * Server-assigned GUID. Every call after repository resolution addresses the repository by this id.
     */
    String id,

    String name,

    /**
     * Name of the owning project, when the API reported it.
     */
    String projectName,

    /**
     * Fully qualified default branch (e.g. {@code refs/heads/main}); null for an empty repository.
     */
    String defaultBranchName,

    String webUrl,

    String remoteUrl
) {
    public RepositoryRef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Repository id cannot be null or empty");
        }
    }
}
