package org.rostilos.devopsbridge.azdoclient.model;

/**
 * A pull request as returned by the create call.
 *
 * @param url    REST resource url
 * @param webUrl browser link; falls back to the repository web url when the response has no web link
 */
public record PullRequest(
        long id,
        String sourceRef,
        String targetRef,
        String title,
        String description,
        String url,
        String webUrl
) {
}
