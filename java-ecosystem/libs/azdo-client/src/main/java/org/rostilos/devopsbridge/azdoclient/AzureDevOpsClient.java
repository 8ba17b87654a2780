package org.rostilos.devopsbridge.azdoclient;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.rostilos.devopsbridge.azdoclient.actions.CreatePullRequestAction;
import org.rostilos.devopsbridge.azdoclient.actions.CreatePushAction;
import org.rostilos.devopsbridge.azdoclient.actions.GetFileContentAction;
import org.rostilos.devopsbridge.azdoclient.actions.GetRepositoryAction;
import org.rostilos.devopsbridge.azdoclient.actions.ListProjectsAction;
import org.rostilos.devopsbridge.azdoclient.actions.ListRepositoriesAction;
import org.rostilos.devopsbridge.azdoclient.actions.PublishBranchAction;
import org.rostilos.devopsbridge.azdoclient.actions.ResolveRefAction;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfiguration;
import org.rostilos.devopsbridge.azdoclient.model.BranchPointer;
import org.rostilos.devopsbridge.azdoclient.model.ChangeType;
import org.rostilos.devopsbridge.azdoclient.model.Commit;
import org.rostilos.devopsbridge.azdoclient.model.FileContent;
import org.rostilos.devopsbridge.azdoclient.model.Project;
import org.rostilos.devopsbridge.azdoclient.model.PullRequest;
import org.rostilos.devopsbridge.azdoclient.model.PushResult;
import org.rostilos.devopsbridge.azdoclient.model.RefLookup;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;
import org.rostilos.devopsbridge.azdoclient.service.FileChangePullRequestService;
import org.rostilos.devopsbridge.azdoclient.service.PublishResult;

import java.util.List;

/**
 * Entry point for one Azure DevOps organization. Wires the actions over a single authorized HTTP client.
 */
public class AzureDevOpsClient {

    private final AzureDevOpsConfiguration configuration;
    private final ListProjectsAction listProjectsAction;
    private final ListRepositoriesAction listRepositoriesAction;
    private final GetRepositoryAction getRepositoryAction;
    private final GetFileContentAction getFileContentAction;
    private final ResolveRefAction resolveRefAction;
    private final PublishBranchAction publishBranchAction;
    private final CreatePushAction createPushAction;
    private final CreatePullRequestAction createPullRequestAction;
    private final FileChangePullRequestService fileChangePullRequestService;

    public AzureDevOpsClient(AzureDevOpsConfiguration configuration) {
        this(configuration, new AzureDevOpsHttpClientFactory().createClient(configuration), new ObjectMapper());
    }

    public AzureDevOpsClient(AzureDevOpsConfiguration configuration, OkHttpClient authorizedOkHttpClient,
                             ObjectMapper objectMapper) {
        this.configuration = configuration;
        AzureDevOpsTransport transport =
                new AzureDevOpsTransport(authorizedOkHttpClient, objectMapper, configuration.getTimeout());
        AzureDevOpsUrls urls = new AzureDevOpsUrls(configuration.getOrganizationUrl());

        this.listProjectsAction = new ListProjectsAction(transport, urls);
        this.listRepositoriesAction = new ListRepositoriesAction(transport, urls);
        this.getRepositoryAction = new GetRepositoryAction(transport, urls);
        this.getFileContentAction = new GetFileContentAction(transport, urls);
        this.resolveRefAction = new ResolveRefAction(transport, urls);
        this.publishBranchAction = new PublishBranchAction(transport, urls, resolveRefAction);
        this.createPushAction = new CreatePushAction(transport, urls);
        this.createPullRequestAction = new CreatePullRequestAction(transport, urls);
        this.fileChangePullRequestService = new FileChangePullRequestService(getRepositoryAction, resolveRefAction,
                publishBranchAction, createPushAction, createPullRequestAction);
    }

    public AzureDevOpsConfiguration getConfiguration() {
        return configuration;
    }

    public List<Project> listProjects() {
        return listProjectsAction.listProjects();
    }

    public List<RepositoryRef> listRepositories(String project) {
        return listRepositoriesAction.listRepositories(project);
    }

    public RepositoryRef getRepository(String project, String repository) {
        return getRepositoryAction.getRepository(project, repository);
    }

    public FileContent getFileContent(String project, String repository, String path, String branch) {
        return getFileContentAction.getFileContent(project, repository, path, branch);
    }

    public RefLookup lookupRef(String project, String repositoryId, String refName) {
        return resolveRefAction.lookup(project, repositoryId, refName);
    }

    public String resolveRef(String project, String repositoryId, String refName) {
        return resolveRefAction.resolveRef(project, repositoryId, refName);
    }

    public BranchPointer publishBranch(String project, String repositoryId, String sourceRefName, String baseObjectId) {
        return publishBranchAction.publish(project, repositoryId, sourceRefName, baseObjectId);
    }

    public PushResult push(String project, String repositoryId, String refName, String expectedObjectId, Commit commit) {
        return createPushAction.push(project, repositoryId, refName, expectedObjectId, commit);
    }

    public PullRequest openPullRequest(String project, String repositoryId, String sourceRef, String targetRef,
                                       String title, String description) {
        return createPullRequestAction.open(project, repositoryId, sourceRef, targetRef, title, description);
    }

    public PublishResult publishFileChangeAsPullRequest(String project, String repository, String filePath,
                                                        String newContent, String prTitle, String baseBranchName,
                                                        String workingBranchName, String prDescription,
                                                        ChangeType changeType) {
        return fileChangePullRequestService.publishFileChangeAsPullRequest(project, repository, filePath, newContent,
                prTitle, baseBranchName, workingBranchName, prDescription, changeType);
    }

    public PublishResult publishFileChangeAsPullRequest(String project, String repository, String filePath,
                                                        String newContent, String prTitle, String baseBranchName,
                                                        String workingBranchName, String prDescription) {
        return publishFileChangeAsPullRequest(project, repository, filePath, newContent, prTitle,
                baseBranchName, workingBranchName, prDescription, ChangeType.EDIT);
    }
}
