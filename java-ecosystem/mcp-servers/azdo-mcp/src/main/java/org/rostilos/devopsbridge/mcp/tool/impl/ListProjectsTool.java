package org.rostilos.devopsbridge.mcp.tool.impl;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.model.Project;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsTool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListProjectsTool implements AzureDevOpsTool {

    private final AzureDevOpsClient client;

    public ListProjectsTool(AzureDevOpsClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "azdo_list_projects";
    }

    @Override
    public String getDescription() {
        return "List Azure DevOps projects in the organization.";
    }

    @Override
    public String getInputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {}
                }
                """;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        List<Map<String, Object>> projects = new ArrayList<>();
        for (Project project : client.listProjects()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", project.id());
            entry.put("name", project.name());
            entry.put("state", project.state());
            projects.add(entry);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", projects.size());
        result.put("projects", projects);
        return result;
    }
}
