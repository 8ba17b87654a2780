package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.exception.NotFoundException;
import org.rostilos.devopsbridge.azdoclient.exception.RemoteApiException;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;

import java.util.ArrayList;
import java.util.List;

public class ListRepositoriesAction {

    private static final String OPERATION = "listRepositories";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public ListRepositoriesAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    public List<RepositoryRef> listRepositories(String project) {
        GetRepositoryAction.requireNonBlank(project, "Project");

        String url = urls.repositories(project);
        JsonNode response;
        try {
            response = transport.getRequired(OPERATION, url);
        } catch (RemoteApiException e) {
            if (e.isNotFound()) {
                throw new NotFoundException(OPERATION, "Project not found: " + project, e);
            }
            throw e;
        }

        List<RepositoryRef> repositories = new ArrayList<>();
        for (JsonNode node : ResponseReader.values(response, OPERATION, url)) {
            repositories.add(ResponseReader.repository(node, OPERATION, url));
        }
        return repositories;
    }
}
