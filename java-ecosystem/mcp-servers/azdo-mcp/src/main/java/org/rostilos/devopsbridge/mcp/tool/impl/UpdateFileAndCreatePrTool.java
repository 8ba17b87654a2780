package org.rostilos.devopsbridge.mcp.tool.impl;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.model.ChangeType;
import org.rostilos.devopsbridge.azdoclient.service.PublishResult;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsTool;
import org.rostilos.devopsbridge.mcp.tool.ToolArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Proposes a single-file edit: working branch reset to the base, one commit, one pull request.
 */
public class UpdateFileAndCreatePrTool implements AzureDevOpsTool {

    private static final Logger log = LoggerFactory.getLogger(UpdateFileAndCreatePrTool.class);

    static final String DEFAULT_BASE_BRANCH = "main";
    static final String DEFAULT_NEW_BRANCH = "mcp/update-file";

    private final AzureDevOpsClient client;

    public UpdateFileAndCreatePrTool(AzureDevOpsClient client) {
        this.client = client;
    }

    @Override
    public String getName() {
        return "azdo_update_file_and_create_pr";
    }

    @Override
    public String getDescription() {
        return "Update a single file in a repo by creating (or resetting) a branch from the base branch, "
                + "pushing one commit and opening a pull request against the base branch.";
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
                    "file_path": {
                      "type": "string",
                      "description": "File path, e.g. /README.md"
                    },
                    "new_content": {
                      "type": "string",
                      "description": "Full file contents (text)"
                    },
                    "pr_title": {
                      "type": "string",
                      "description": "Pull request title, also used as commit message"
                    },
                    "base_branch": {
                      "type": "string",
                      "description": "Base branch (default: main)"
                    },
                    "new_branch": {
                      "type": "string",
                      "description": "Working branch, reset to the base if it exists (default: mcp/update-file)"
                    },
                    "pr_description": {
                      "type": "string",
                      "description": "Optional pull request description"
                    },
                    "change_type": {
                      "type": "string",
                      "enum": ["edit", "add"],
                      "description": "edit for an existing file, add for a new one (default: edit)"
                    }
                  },
                  "required": ["project", "repo", "file_path", "new_content", "pr_title"]
                }
                """;
    }

    @Override
    public Object execute(Map<String, Object> arguments) {
        String project = ToolArguments.requireStringArg(arguments, "project");
        String repo = ToolArguments.requireStringArg(arguments, "repo");
        String filePath = ToolArguments.requireStringArg(arguments, "file_path");
        String newContent = ToolArguments.requireRawStringArg(arguments, "new_content");
        String prTitle = ToolArguments.requireStringArg(arguments, "pr_title");
        String baseBranch = ToolArguments.getStringArg(arguments, "base_branch", DEFAULT_BASE_BRANCH);
        String newBranch = ToolArguments.getStringArg(arguments, "new_branch", DEFAULT_NEW_BRANCH);
        String prDescription = ToolArguments.getStringArg(arguments, "pr_description", "");
        ChangeType changeType = ChangeType.fromWireValue(ToolArguments.getStringArg(arguments, "change_type"));

        log.info("Proposing change to {} in {}/{} from {} into {}", filePath, project, repo, newBranch, baseBranch);
        PublishResult published = client.publishFileChangeAsPullRequest(project, repo, filePath, newContent, prTitle,
                baseBranch, newBranch, prDescription, changeType);

        Map<String, Object> repoInfo = new LinkedHashMap<>();
        repoInfo.put("id", published.repository().id());
        repoInfo.put("name", published.repository().name());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("repo", repoInfo);
        result.put("baseRef", published.baseRef());
        result.put("sourceRef", published.sourceRef());
        result.put("baseObjectId", published.baseObjectId());
        result.put("pushId", published.pushId());
        result.put("headObjectId", published.headObjectId());
        result.put("pullRequestId", published.pullRequestId());
        result.put("prUrl", published.url());
        result.put("webUrl", published.webUrl());
        return result;
    }
}
