package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.model.PullRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CreatePullRequestAction {

    private static final Logger log = LoggerFactory.getLogger(CreatePullRequestAction.class);
    private static final String OPERATION = "createPullRequest";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public CreatePullRequestAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    /**
     * Open a pull request merging {@code sourceRef} into {@code targetRef}.
     * A rejection, including the conflict raised for an already active pull request on the same pair,
     * surfaces as the transport reported it.
     */
    public PullRequest open(String project, String repositoryId, String sourceRef, String targetRef,
                            String title, String description) {
        if (sourceRef == null || sourceRef.equals(targetRef)) {
            throw new IllegalArgumentException("Source and target refs must differ: " + sourceRef);
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("sourceRefName", sourceRef)
                .put("targetRefName", targetRef)
                .put("title", title)
                .put("description", description == null ? "" : description);

        String url = urls.pullRequests(project, repositoryId);
        JsonNode response = transport.postRequired(OPERATION, url, payload);

        long id = ResponseReader.requiredLong(response, "pullRequestId", OPERATION, url);
        String webUrl = ResponseReader.text(response.path("_links").path("web"), "href");
        if (webUrl == null) {
            String repositoryWebUrl = ResponseReader.text(response.path("repository"), "webUrl");
            webUrl = repositoryWebUrl != null ? repositoryWebUrl + "/pullrequest/" + id : null;
        }

        log.info("Opened pull request {} ({} -> {})", id, sourceRef, targetRef);
        return new PullRequest(
                id,
                sourceRef,
                targetRef,
                title,
                description,
                ResponseReader.text(response, "url"),
                webUrl
        );
    }
}
