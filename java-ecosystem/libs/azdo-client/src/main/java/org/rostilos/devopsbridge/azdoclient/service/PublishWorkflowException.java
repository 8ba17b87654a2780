package org.rostilos.devopsbridge.azdoclient.service;

import org.rostilos.devopsbridge.azdoclient.exception.AzureDevOpsException;

/**
 * A branch-publish run stopped at {@link #getStep()}.
 * Steps before it stay applied; {@link #getCompletedPushId()} is set when the commit had already been pushed.
 */
public class PublishWorkflowException extends RuntimeException {

    private final WorkflowStep step;
    private final String project;
    private final String repository;
    private final String baseRef;
    private final String sourceRef;
    private final Long completedPushId;

    public PublishWorkflowException(WorkflowStep step, String project, String repository, String baseRef,
                                    String sourceRef, Long completedPushId, AzureDevOpsException cause) {
        super(String.format("Publishing %s -> %s in %s/%s failed at %s: %s",
                sourceRef, baseRef, project, repository, step, cause.getMessage()), cause);
        this.step = step;
        this.project = project;
        this.repository = repository;
        this.baseRef = baseRef;
        this.sourceRef = sourceRef;
        this.completedPushId = completedPushId;
    }

    public WorkflowStep getStep() {
        return step;
    }

    public String getProject() {
        return project;
    }

    public String getRepository() {
        return repository;
    }

    public String getBaseRef() {
        return baseRef;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public Long getCompletedPushId() {
        return completedPushId;
    }

    public AzureDevOpsException getFailure() {
        return (AzureDevOpsException) getCause();
    }
}
