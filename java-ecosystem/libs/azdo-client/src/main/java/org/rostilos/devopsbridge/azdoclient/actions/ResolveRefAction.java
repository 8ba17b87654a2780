package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.config.AzureDevOpsConfig;
import org.rostilos.devopsbridge.azdoclient.exception.AmbiguousRefException;
import org.rostilos.devopsbridge.azdoclient.exception.RefNotFoundException;
import org.rostilos.devopsbridge.azdoclient.model.BranchPointer;
import org.rostilos.devopsbridge.azdoclient.model.RefLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the current object id of a single ref.
 * <p>
 * The refs listing filters by prefix, so {@code refs/heads/main} also returns
 * {@code refs/heads/main-old}. Only an entry whose name equals the requested name counts.
 */
public class ResolveRefAction {

    private static final Logger log = LoggerFactory.getLogger(ResolveRefAction.class);
    private static final String OPERATION = "resolveRef";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public ResolveRefAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    public RefLookup lookup(String project, String repositoryId, String refName) {
        if (!AzureDevOpsConfig.isQualifiedRef(refName)) {
            throw new IllegalArgumentException("Ref name must be fully qualified (refs/...): " + refName);
        }

        String url = urls.refs(project, repositoryId, refName);
        JsonNode values = ResponseReader.values(transport.getRequired(OPERATION, url), OPERATION, url);

        List<String> exactObjectIds = new ArrayList<>();
        List<String> prefixMatches = new ArrayList<>();
        for (JsonNode ref : values) {
            String name = ResponseReader.text(ref, "name");
            if (refName.equals(name)) {
                exactObjectIds.add(ResponseReader.requiredText(ref, "objectId", OPERATION, url));
            } else {
                prefixMatches.add(name);
            }
        }

        if (!prefixMatches.isEmpty()) {
            log.debug("Ignoring refs matching {} only by prefix: {}", refName, prefixMatches);
        }
        if (exactObjectIds.isEmpty()) {
            return new RefLookup.NotFound(refName);
        }
        if (exactObjectIds.size() > 1) {
            throw new AmbiguousRefException(OPERATION, refName, exactObjectIds, url);
        }
        return new RefLookup.Found(new BranchPointer(refName, exactObjectIds.get(0)));
    }

    /**
     * @return object id the ref currently points at
     * @throws RefNotFoundException when no ref carries exactly this name
     */
    public String resolveRef(String project, String repositoryId, String refName) {
        RefLookup lookup = lookup(project, repositoryId, refName);
        if (lookup instanceof RefLookup.Found found) {
            return found.objectId();
        }
        throw new RefNotFoundException(OPERATION, refName);
    }
}
