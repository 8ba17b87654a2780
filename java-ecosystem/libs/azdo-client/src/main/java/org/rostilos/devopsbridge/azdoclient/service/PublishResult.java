package org.rostilos.devopsbridge.azdoclient.service;

import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;

/**
 * Everything a completed branch-publish run produced.
 *
 * @param baseObjectId  commit the working branch was created or reset to
 * @param headObjectId  tip of the working branch after the push, as reported by the server
 * @param url           REST url of the pull request
 * @param webUrl        browser link of the pull request
 */
public record PublishResult(
        RepositoryRef repository,
        String baseRef,
        String sourceRef,
        String baseObjectId,
        long pushId,
        String headObjectId,
        long pullRequestId,
        String url,
        String webUrl
) {
}
