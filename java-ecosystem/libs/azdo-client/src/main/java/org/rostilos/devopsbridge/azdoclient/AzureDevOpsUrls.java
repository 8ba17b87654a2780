package org.rostilos.devopsbridge.azdoclient;

import okhttp3.HttpUrl;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfig;

/**
 * Builds REST endpoint URLs below an organization URL.
 * Project, repository and ref values are added as encoded path segments / query parameters.
 */
public class AzureDevOpsUrls {

    private static final String API_VERSION = "api-version";

    private final HttpUrl organizationUrl;

    public AzureDevOpsUrls(String organizationUrl) {
        HttpUrl parsed = HttpUrl.parse(organizationUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Organization URL is not a valid http(s) URL: " + organizationUrl);
        }
        this.organizationUrl = parsed;
    }

    public String projects() {
        return organizationUrl.newBuilder()
                .addPathSegments("_apis/projects")
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_PROJECTS)
                .build()
                .toString();
    }

    public String repositories(String project) {
        return gitApi(project)
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    public String repository(String project, String repository) {
        return gitApi(project)
                .addPathSegment(repository)
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    /**
     * Filtered refs listing. The remote filter is a prefix match on the name without its {@code refs/} head.
     */
    public String refs(String project, String repositoryId, String refName) {
        String filter = refName.startsWith(AzureDevOpsConfig.REFS_PREFIX)
                ? refName.substring(AzureDevOpsConfig.REFS_PREFIX.length())
                : refName;
        return gitApi(project)
                .addPathSegment(repositoryId)
                .addPathSegment("refs")
                .addQueryParameter("filter", filter)
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    public String refUpdates(String project, String repositoryId) {
        return gitApi(project)
                .addPathSegment(repositoryId)
                .addPathSegment("refs")
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    public String pushes(String project, String repositoryId) {
        return gitApi(project)
                .addPathSegment(repositoryId)
                .addPathSegment("pushes")
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_PUSHES)
                .build()
                .toString();
    }

    public String pullRequests(String project, String repositoryId) {
        return gitApi(project)
                .addPathSegment(repositoryId)
                .addPathSegment("pullrequests")
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    public String item(String project, String repository, String path, String branchName) {
        return gitApi(project)
                .addPathSegment(repository)
                .addPathSegment("items")
                .addQueryParameter("path", path)
                .addQueryParameter("includeContent", "true")
                .addQueryParameter("versionDescriptor.versionType", "branch")
                .addQueryParameter("versionDescriptor.version", AzureDevOpsConfig.toShortBranchName(branchName))
                .addQueryParameter(API_VERSION, AzureDevOpsConfig.API_VERSION_GIT)
                .build()
                .toString();
    }

    private HttpUrl.Builder gitApi(String project) {
        return organizationUrl.newBuilder()
                .addPathSegment(project)
                .addPathSegments("_apis/git/repositories");
    }
}
