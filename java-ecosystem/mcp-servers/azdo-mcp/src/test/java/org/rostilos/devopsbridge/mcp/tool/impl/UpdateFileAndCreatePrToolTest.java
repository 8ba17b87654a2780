package org.rostilos.devopsbridge.mcp.tool.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.model.ChangeType;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;
import org.rostilos.devopsbridge.azdoclient.service.PublishResult;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("azdo_update_file_and_create_pr")
class UpdateFileAndCreatePrToolTest {

    @Mock
    private AzureDevOpsClient client;

    private UpdateFileAndCreatePrTool tool;

    @BeforeEach
    void setUp() {
        tool = new UpdateFileAndCreatePrTool(client);
    }

    private static Map<String, Object> requiredArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put("project", "proj");
        arguments.put("repo", "web");
        arguments.put("file_path", "/README.md");
        arguments.put("new_content", "hello\n");
        arguments.put("pr_title", "Update README");
        return arguments;
    }

    private static PublishResult published() {
        return new PublishResult(
                new RepositoryRef("r1", "web", "proj", "refs/heads/main", null, null),
                "refs/heads/main", "refs/heads/mcp/update-file", "base1", 5, "head2", 9,
                "https://dev.azure.com/contoso/_apis/git/repositories/r1/pullRequests/9",
                "https://dev.azure.com/contoso/proj/_git/web/pullrequest/9");
    }

    @Test
    @DisplayName("should apply defaults for optional arguments")
    @SuppressWarnings("unchecked")
    void shouldApplyDefaults() {
        when(client.publishFileChangeAsPullRequest("proj", "web", "/README.md", "hello\n", "Update README",
                "main", "mcp/update-file", "", ChangeType.EDIT)).thenReturn(published());

        Map<String, Object> result = (Map<String, Object>) tool.execute(requiredArguments());

        assertThat((Map<String, Object>) result.get("repo")).containsEntry("id", "r1").containsEntry("name", "web");
        assertThat(result)
                .containsEntry("baseRef", "refs/heads/main")
                .containsEntry("sourceRef", "refs/heads/mcp/update-file")
                .containsEntry("pushId", 5L)
                .containsEntry("pullRequestId", 9L)
                .containsEntry("prUrl", "https://dev.azure.com/contoso/_apis/git/repositories/r1/pullRequests/9")
                .containsEntry("webUrl", "https://dev.azure.com/contoso/proj/_git/web/pullrequest/9");
    }

    @Test
    @DisplayName("should pass explicit branches, description and change type")
    void shouldPassExplicitArguments() {
        Map<String, Object> arguments = requiredArguments();
        arguments.put("base_branch", "develop");
        arguments.put("new_branch", "feature/readme");
        arguments.put("pr_description", "Rewrites the intro");
        arguments.put("change_type", "add");
        when(client.publishFileChangeAsPullRequest("proj", "web", "/README.md", "hello\n", "Update README",
                "develop", "feature/readme", "Rewrites the intro", ChangeType.ADD)).thenReturn(published());

        tool.execute(arguments);

        verify(client).publishFileChangeAsPullRequest("proj", "web", "/README.md", "hello\n", "Update README",
                "develop", "feature/readme", "Rewrites the intro", ChangeType.ADD);
    }

    @Test
    @DisplayName("should keep empty content as a valid new file body")
    void shouldAllowEmptyContent() {
        Map<String, Object> arguments = requiredArguments();
        arguments.put("new_content", "");
        when(client.publishFileChangeAsPullRequest("proj", "web", "/README.md", "", "Update README",
                "main", "mcp/update-file", "", ChangeType.EDIT)).thenReturn(published());

        assertThat(tool.execute(arguments)).isNotNull();
    }

    @Test
    @DisplayName("should reject missing required arguments before calling Azure DevOps")
    void shouldRejectMissingArguments() {
        Map<String, Object> arguments = requiredArguments();
        arguments.remove("pr_title");

        assertThatThrownBy(() -> tool.execute(arguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("pr_title is required");
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("should reject unknown change type")
    void shouldRejectUnknownChangeType() {
        Map<String, Object> arguments = requiredArguments();
        arguments.put("change_type", "delete");

        assertThatThrownBy(() -> tool.execute(arguments))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delete");
        verifyNoInteractions(client);
    }
}
