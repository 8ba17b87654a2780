package org.rostilos.devopsbridge.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.azdoclient.exception.AuthenticationException;
import org.rostilos.devopsbridge.azdoclient.model.Project;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsMcpTools;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McpStdioServerTest {

    @Mock
    private AzureDevOpsClient client;

    private AzureDevOpsMcpTools mcpTools;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        mcpTools = new AzureDevOpsMcpTools(client);
    }

    private JsonNode payload(CallToolResult result) throws Exception {
        return objectMapper.readTree(((TextContent) result.content().get(0)).text());
    }

    @Test
    void testGetToolSpecifications_RegistersAllTools() {
        List<McpServerFeatures.SyncToolSpecification> specifications = McpStdioServer.getToolSpecifications(mcpTools);

        assertThat(specifications).extracting(spec -> spec.tool().name()).containsExactly(
                "azdo_list_projects", "azdo_list_repos", "azdo_get_file", "azdo_update_file_and_create_pr");
        assertThat(specifications.get(3).tool().inputSchema().required())
                .containsExactly("project", "repo", "file_path", "new_content", "pr_title");
    }

    @Test
    void testCallTool_Success_ReturnsJsonText() throws Exception {
        when(client.listProjects()).thenReturn(List.of(new Project("p1", "Alpha", "wellFormed")));

        CallToolResult result = McpStdioServer.callTool(mcpTools, "azdo_list_projects", Map.of());

        assertThat(result.isError()).isFalse();
        JsonNode json = payload(result);
        assertThat(json.path("count").asInt()).isEqualTo(1);
        assertThat(json.at("/projects/0/name").asText()).isEqualTo("Alpha");
    }

    @Test
    void testCallTool_ClientFailure_ReturnsErrorPayload() throws Exception {
        when(client.listProjects()).thenThrow(new AuthenticationException("listProjects", 203,
                "https://dev.azure.com/contoso/_apis/projects", "<html>"));

        CallToolResult result = McpStdioServer.callTool(mcpTools, "azdo_list_projects", Map.of());

        assertThat(result.isError()).isTrue();
        JsonNode json = payload(result);
        assertThat(json.path("kind").asText()).isEqualTo("AuthenticationError");
        assertThat(json.path("statusCode").asInt()).isEqualTo(203);
    }

    @Test
    void testCallTool_MissingArgument_ReturnsInvalidArgument() throws Exception {
        CallToolResult result = McpStdioServer.callTool(mcpTools, "azdo_list_repos", Map.of());

        assertThat(result.isError()).isTrue();
        assertThat(payload(result).path("kind").asText()).isEqualTo("InvalidArgument");
        assertThat(payload(result).path("error").asText()).isEqualTo("project is required");
    }

    @Test
    void testCallTool_UnknownTool_ReturnsError() throws Exception {
        CallToolResult result = McpStdioServer.callTool(mcpTools, "azdo_delete_repo", null);

        assertThat(result.isError()).isTrue();
        assertThat(payload(result).path("error").asText()).isEqualTo("Unknown tool: azdo_delete_repo");
    }
}
