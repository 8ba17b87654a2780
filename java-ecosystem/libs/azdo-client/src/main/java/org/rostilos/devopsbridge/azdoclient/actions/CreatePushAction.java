package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.exception.ConcurrencyConflictException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.model.Commit;
import org.rostilos.devopsbridge.azdoclient.model.FileChange;
import org.rostilos.devopsbridge.azdoclient.model.PushResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CreatePushAction {

    private static final Logger log = LoggerFactory.getLogger(CreatePushAction.class);
    private static final String OPERATION = "createPush";
    /** "The reference has already been updated by another client" */
    private static final String STALE_REF_ERROR = "TF401028";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public CreatePushAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    /**
     * Push one commit onto {@code refName}, accepted only while the ref still points at {@code expectedObjectId}.
     *
     * @throws ConcurrencyConflictException when the ref moved since {@code expectedObjectId} was read
     */
    public PushResult push(String project, String repositoryId, String refName, String expectedObjectId, Commit commit) {
        ObjectNode payload = buildPayload(refName, expectedObjectId, commit);
        String url = urls.pushes(project, repositoryId);

        JsonNode response;
        try {
            response = transport.postRequired(OPERATION, url, payload);
        } catch (RemoteApiException e) {
            String body = e.getResponseBody();
            if (e.isConflict() || (body != null && body.contains(STALE_REF_ERROR))) {
                throw new ConcurrencyConflictException(OPERATION, refName, expectedObjectId,
                        e.getStatusCode(), url, body);
            }
            throw e;
        }

        long pushId = ResponseReader.requiredLong(response, "pushId", OPERATION, url);
        String newObjectId = ResponseReader.text(response.path("refUpdates").path(0), "newObjectId");
        if (newObjectId == null) {
            JsonNode commits = response.path("commits");
            newObjectId = commits.isArray() && commits.size() > 0
                    ? ResponseReader.text(commits.get(commits.size() - 1), "commitId")
                    : null;
        }
        log.info("Pushed {} change(s) to {} as push {} (tip {})", commit.changes().size(), refName, pushId, newObjectId);
        return new PushResult(pushId, newObjectId);
    }

    ObjectNode buildPayload(String refName, String expectedObjectId, Commit commit) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode payload = factory.objectNode();

        payload.putArray("refUpdates").addObject()
                .put("name", refName)
                .put("oldObjectId", expectedObjectId);

        ObjectNode commitNode = payload.putArray("commits").addObject();
        commitNode.put("comment", commit.message());
        ArrayNode changes = commitNode.putArray("changes");
        for (FileChange change : commit.changes()) {
            ObjectNode changeNode = changes.addObject();
            changeNode.put("changeType", change.changeType().getWireValue());
            changeNode.putObject("item").put("path", change.path());
            changeNode.putObject("newContent")
                    .put("content", change.newContent())
                    .put("contentType", "rawtext");
        }
        return payload;
    }
}
