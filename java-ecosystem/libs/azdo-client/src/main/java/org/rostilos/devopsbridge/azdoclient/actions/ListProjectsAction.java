package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsTransport;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsUrls;
import org.rostilos.devopsbridge.azdoclient.model.Project;

import java.util.ArrayList;
import java.util.List;

public class ListProjectsAction {

    private static final String OPERATION = "listProjects";

    private final AzureDevOpsTransport transport;
    private final AzureDevOpsUrls urls;

    public ListProjectsAction(AzureDevOpsTransport transport, AzureDevOpsUrls urls) {
        this.transport = transport;
        this.urls = urls;
    }

    public List<Project> listProjects() {
        String url = urls.projects();
        JsonNode values = ResponseReader.values(transport.getRequired(OPERATION, url), OPERATION, url);

        List<Project> projects = new ArrayList<>();
        for (JsonNode node : values) {
            projects.add(new Project(
                    ResponseReader.text(node, "id"),
                    ResponseReader.text(node, "name"),
                    ResponseReader.text(node, "state")
            ));
        }
        return projects;
    }
}
