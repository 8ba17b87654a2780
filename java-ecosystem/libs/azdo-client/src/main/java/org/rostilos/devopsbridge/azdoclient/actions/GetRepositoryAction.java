package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.exception.NotFoundException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GetRepositoryAction {

    private static final Logger log = LoggerFactory.getLogger(GetRepositoryAction.class);
    private static final String OPERATION = "getRepository";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public GetRepositoryAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    /**
     * Resolve a repository by name or id within a project.
     *
     * @throws NotFoundException when the project or repository does not exist
     */
    public RepositoryRef getRepository(String project, String repository) {
        requireNonBlank(project, "Project");
        requireNonBlank(repository, "Repository");

        String url = urls.repository(project, repository);
        JsonNode node;
        try {
            node = transport.getRequired(OPERATION, url);
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                throw new NotFoundException(OPERATION,
                        String.format("Repository %s not found in project %s", repository, project), e);
            }
            throw e;
        }

        RepositoryRef ref = ResponseReader.repository(node, OPERATION, url);
        log.debug("Resolved repository {}/{} to id {}", project, repository, ref.id());
        return ref;
    }

    static void requireNonBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
    }
}
