package org.rostilos.devopsbridge.mcp.tool.impl;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.model.FileContent;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsTool;
import org.rostilos.devopsbridge.mcp.tool.ToolArguments;

import java.util.LinkedHashMap;
import java.util.Map;

public class GetFileTool implements AzureDevOpsTool {

    static final String DEFAULT_BRANCH = "refs/heads/main";

    private final AzureDevOpsClient client;

    public GetFileTool(AzureDevOpsClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "azdo_get_file";
    }

    @Override
    public String getDescription() {
        return "Fetch the text content of a file from a repository branch.";
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
                    },
                    "repo": {
                      "type": "string",
                      "description": "Repository name or id"
                    },
                    "path": {
                      "type": "string",
                      "description": "File path like /README.md"
                    },
                    "branch": {
                      "type": "string",
                      "description": "Branch, e.g. refs/heads/main or main (default: refs/heads/main)"
                    }
                  },
                  "required": ["project", "repo", "path"]
                }
                """;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String project = ToolArguments.requireStringArg(arguments, "project");
        String repo = ToolArguments.requireStringArg(arguments, "repo");
        String path = ToolArguments.requireStringArg(arguments, "path");
        String branch = ToolArguments.getStringArg(arguments, "branch", DEFAULT_BRANCH);

        FileContent file = client.getFileContent(project, repo, path, branch);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("path", file.path());
        result.put("branch", file.branch());
        result.put("content", file.content());
        return result;
    }
}
