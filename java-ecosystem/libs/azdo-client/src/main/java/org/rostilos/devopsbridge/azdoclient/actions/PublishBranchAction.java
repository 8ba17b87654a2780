package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfig;
import org.rostilos.devopsbridge.azdoclient.exception.AuthenticationException;
import org.rostilos.devopsbridge.azdoclient.exception.ConcurrencyConflictException;
import org.rostilos.devopsbridge.azdoclient.exception.MalformedResponseException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.model.BranchPointer;
import org.rostilos.devopsbridge.azdoclient.model.RefLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes a working branch point at a base commit: created when absent, reset when present.
 * Both paths are a single compare-and-swap ref update keyed on the object id read just before.
 */
public class PublishBranchAction {

    private static final Logger log = LoggerFactory.getLogger(PublishBranchAction.class);
    private static final String OPERATION = "updateRef";
    private static final String STALE_OLD_OBJECT_ID = "staleOldObjectId";
    private static final String PERMISSION_REQUIRED_SUFFIX = "PermissionRequired";
    private static final String FORCE_PUSH_REQUIRED = "forcePushRequired";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;
    private final ResolveRefAction resolveRefAction;

    public PublishBranchAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls, ResolveRefAction resolveRefAction) {
        this.transport = transport;
        this.urls = urls;
        this.resolveRefAction = resolveRefAction;
    }

    public BranchPointer publish(String project, String repositoryId, String sourceRefName, String baseObjectId) {
        RefLookup current = resolveRefAction.lookup(project, repositoryId, sourceRefName);

        String oldObjectId;
        if (current instanceof RefLookup.Found found) {
            oldObjectId = found.objectId();
            log.info("Resetting branch {} from {} to {}", sourceRefName, oldObjectId, baseObjectId);
        } else {
            oldObjectId = AzureDevOpsConfig.ZERO_OBJECT_ID;
            log.info("Creating branch {} at {}", sourceRefName, baseObjectId);
        }
        return updateRef(project, repositoryId, sourceRefName, oldObjectId, baseObjectId);
    }

    /**
     * Move {@code refName} from {@code oldObjectId} to {@code newObjectId}. The server applies the update only
     * if the ref still points at {@code oldObjectId}; {@link AzureDevOpsConfig#ZERO_OBJECT_ID} means "must not exist".
     *
     * @throws ConcurrencyConflictException when the ref moved in between
     */
    public BranchPointer updateRef(String project, String repositoryId, String refName,
                                   String oldObjectId, String newObjectId) {
        ArrayNode body = JsonNodeFactory.instance.arrayNode();
        body.addObject()
                .put("name", refName)
                .put("oldObjectId", oldObjectId)
                .put("newObjectId", newObjectId);

        String url = urls.refUpdates(project, repositoryId);
        JsonNode response;
        try {
            response = transport.postRequired(OPERATION, url, body);
        } catch (RemoteApiException e) {
            if (e.isConflict()) {
                throw new ConcurrencyConflictException(OPERATION, refName, oldObjectId,
                        e.getStatusCode(), url, e.getResponseBody());
            }
            throw e;
        }

        JsonNode result = findResult(ResponseReader.values(response, OPERATION, url), refName, url, response);
        String updateStatus = result.path("updateStatus").asText("");
        if (result.path("success").asBoolean(false)) {
            String applied = ResponseReader.text(result, "newObjectId");
            return new BranchPointer(refName, applied != null ? applied : newObjectId);
        }

        log.warn("Ref update for {} rejected with status {}", refName, updateStatus);
        if (STALE_OLD_OBJECT_ID.equalsIgnoreCase(updateStatus)) {
            throw new ConcurrencyConflictException(OPERATION, refName, oldObjectId, 200, url, response.toString());
        }
        if (updateStatus.endsWith(PERMISSION_REQUIRED_SUFFIX) || FORCE_PUSH_REQUIRED.equals(updateStatus)) {
            throw new AuthenticationException(OPERATION, url,
                    String.format("update of %s rejected: %s", refName, updateStatus), response.toString());
        }
        throw new RemoteApiException(OPERATION, url,
                String.format("update of %s rejected with status '%s'", refName, updateStatus), response.toString());
    }

    private JsonNode findResult(JsonNode values, String refName, String url, JsonNode response) {
        for (JsonNode value : values) {
            if (refName.equals(ResponseReader.text(value, "name"))) {
                return value;
            }
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        throw new MalformedResponseException(OPERATION, url, "no update result for " + refName, response.toString());
    }
}
