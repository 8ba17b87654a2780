package org.rostilos.devopsbridge.mcp.tool.impl;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsTool;
import org.rostilos.devopsbridge.mcp.tool.ToolArguments;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListReposTool implements AzureDevOpsTool {

    private final AzureDevOpsClient client;

    public ListReposTool(AzureDevOpsClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "azdo_list_repos";
    }

    @Override
    public String getDescription() {
        return "List Git repositories in a given Azure DevOps project.";
    }

    @Override
    public String getInputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "project": {
                      "type": "string",
                      "description": "Azure DevOps project name"
                    }
                  },
                  "required": ["project"]
                }
                """;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String project = ToolArguments.requireStringArg(arguments, "project");

        List<Map<String, Object>> repos = new ArrayList<>();
        for (RepositoryRef repository : client.listRepositories(project)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", repository.id());
            entry.put("name", repository.name());
            entry.put("webUrl", repository.webUrl());
            entry.put("remoteUrl", repository.remoteUrl());
            entry.put("defaultBranch", repository.defaultBranchName());
            repos.add(entry);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", repos.size());
        result.put("repos", repos);
        return result;
    }
}
