package org.rostilos.devopsbridge.azdoclient.service;

public enum WorkflowStep {
    RESOLVE_REPOSITORY,
    RESOLVE_BASE_REF,
    PUBLISH_BRANCH,
    PUSH_COMMIT,
    OPEN_PULL_REQUEST
}
