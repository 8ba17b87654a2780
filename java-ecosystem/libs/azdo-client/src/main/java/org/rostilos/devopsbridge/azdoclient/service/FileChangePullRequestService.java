package org.rostilos.devopsbridge.azdoclient.service;

import org.rostilos.devopsbridge.azdoclient.actions.CreatePullRequestAction;
import org.rostilos.devopsbridge.azdoclient.actions.CreatePushAction;
import org.rostilos.devopsbridge.azdoclient.actions.GetRepositoryAction;
import org.rostilos.devopsbridge.azdoclient.actions.PublishBranchAction;
import org.rostilos.devopsbridge.azdoclient.actions.ResolveRefAction;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfig;
import org.rostilos.devopsbridge.azdoclient.exception.AzureDevOpsException;
import org.rostilos.devopsbridge.azdoclient.model.BranchPointer;
import org.rostilos.devopsbridge.azdoclient.model.ChangeType;
import org.rostilos.devopsbridge.azdoclient.model.Commit;
import org.rostilos.devopsbridge.azdoclient.model.FileChange;
import org.rostilos.devopsbridge.azdoclient.model.PullRequest;
import org.rostilos.devopsbridge.azdoclient.model.PushResult;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proposes a single-file change as a pull request:
 * resolve repository, read base ref, create or reset the working branch at the base commit,
 * push one commit on it, open the pull request against the base.
 * <p>
 * Steps run strictly in order and stop at the first failure. Nothing already applied is undone:
 * a failure after the push leaves the working branch with the new commit and no pull request.
 */
public class FileChangePullRequestService {

    private static final Logger log = LoggerFactory.getLogger(FileChangePullRequestService.class);

    private final GetRepositoryAction getRepositoryAction;
    private final ResolveRefAction resolveRefAction;
    private final PublishBranchAction publishBranchAction;
    private final CreatePushAction createPushAction;
    private final CreatePullRequestAction createPullRequestAction;

    public FileChangePullRequestService(GetRepositoryAction getRepositoryAction,
                                        ResolveRefAction resolveRefAction,
                                        PublishBranchAction publishBranchAction,
                                        CreatePushAction createPushAction,
                                        CreatePullRequestAction createPullRequestAction) {
        this.getRepositoryAction = getRepositoryAction;
        this.resolveRefAction = resolveRefAction;
        this.publishBranchAction = publishBranchAction;
        this.createPushAction = createPushAction;
        this.createPullRequestAction = createPullRequestAction;
    }

    public PublishResult publishFileChangeAsPullRequest(String project, String repository, String filePath,
                                                        String newContent, String prTitle, String baseBranchName,
                                                        String workingBranchName, String prDescription) {
        return publishFileChangeAsPullRequest(project, repository, filePath, newContent, prTitle,
                baseBranchName, workingBranchName, prDescription, ChangeType.EDIT);
    }

    /**
     * @param baseBranchName    target of the pull request, short ({@code main}) or qualified form
     * @param workingBranchName branch created or reset to the base commit; must differ from the base
     * @param changeType        {@code EDIT} for an existing file, {@code ADD} for a new one
     * @throws IllegalArgumentException  on invalid input, before any remote call
     * @throws PublishWorkflowException  wrapping the typed failure of the step that stopped the run
     */
    public PublishResult publishFileChangeAsPullRequest(String project, String repository, String filePath,
                                                        String newContent, String prTitle, String baseBranchName,
                                                        String workingBranchName, String prDescription,
                                                        ChangeType changeType) {
        requireNonBlank(project, "Project");
        requireNonBlank(repository, "Repository");
        requireNonBlank(prTitle, "Pull request title");

        String baseRef = AzureDevOpsConfig.toBranchRef(baseBranchName);
        String sourceRef = AzureDevOpsConfig.toBranchRef(workingBranchName);
        if (baseRef.equals(sourceRef)) {
            throw new IllegalArgumentException("Working branch must differ from the base branch: " + baseRef);
        }
        Commit commit = Commit.of(prTitle, new FileChange(filePath, newContent, changeType));

        log.info("Publishing {} to {} in {}/{} for pull request into {}", filePath, sourceRef, project, repository, baseRef);

        WorkflowStep step = WorkflowStep.RESOLVE_REPOSITORY;
        Long completedPushId = null;
        try {
            RepositoryRef repo = getRepositoryAction.getRepository(project, repository);

            step = WorkflowStep.RESOLVE_BASE_REF;
            String baseObjectId = resolveRefAction.resolveRef(project, repo.id(), baseRef);

            step = WorkflowStep.PUBLISH_BRANCH;
            BranchPointer branch = publishBranchAction.publish(project, repo.id(), sourceRef, baseObjectId);

            step = WorkflowStep.PUSH_COMMIT;
            PushResult push = createPushAction.push(project, repo.id(), sourceRef, branch.objectId(), commit);
            completedPushId = push.pushId();

            step = WorkflowStep.OPEN_PULL_REQUEST;
            PullRequest pr = createPullRequestAction.open(project, repo.id(), sourceRef, baseRef,
                    prTitle, prDescription);

            log.info("Published pull request {} for {}/{}", pr.id(), project, repository);
            return new PublishResult(repo, baseRef, sourceRef, baseObjectId, push.pushId(), push.newObjectId(),
                    pr.id(), pr.url(), pr.webUrl());
        } catch (AzureDevOpsException e) {
            log.warn("Publishing {} in {}/{} failed at {}: {}", sourceRef, project, repository, step, e.getMessage());
            throw new PublishWorkflowException(step, project, repository, baseRef, sourceRef, completedPushId, e);
        }
    }

    private static void requireNonBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
    }
}
