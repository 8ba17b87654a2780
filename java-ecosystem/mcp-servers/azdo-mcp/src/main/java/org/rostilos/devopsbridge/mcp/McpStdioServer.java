package org.rostilos.devopsbridge.mcp;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsMcpTools;
import org.rostilos.devopsbridge.mcp.tool.AzureDevOpsTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * MCP server exposing Azure DevOps repository tools over stdio.
 * <p>
 * Stdout carries the protocol; all logging goes to stderr.
 */
public class McpStdioServer {

    private static final Logger log = LoggerFactory.getLogger(McpStdioServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        try {
            log.info("Starting Azure DevOps MCP Server...");
            AzureDevOpsMcpTools mcpTools = new AzureDevOpsMcpTools(new AzureDevOpsClientFactory().createClient());

            var transportProvider = new StdioServerTransportProvider(objectMapper);

            McpSyncServer syncServer = McpServer.sync(transportProvider)
                    .serverInfo("azure-devops", "1.0.0")
                    .capabilities(McpSchema.ServerCapabilities.builder()
                            .tools(true)
                            .logging()
                            .build())
                    .tools(getToolSpecifications(mcpTools))
                    .build();

            log.info("Azure DevOps MCP server running on stdio...");
        } catch (Exception e) {
            log.error("Server initialization error", e);
            System.exit(1);
        }
    }

    static List<McpServerFeatures.SyncToolSpecification> getToolSpecifications(AzureDevOpsMcpTools mcpTools) {
        List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();

        for (AzureDevOpsTool definition : mcpTools.getTools()) {
            Tool tool = new Tool(definition.getName(), definition.getDescription(), definition.getInputSchema());
            specifications.add(new McpServerFeatures.SyncToolSpecification(
                    tool,
                    (exchange, arguments) -> callTool(mcpTools, tool.name(), arguments)
            ));
        }

        return specifications;
    }

    static CallToolResult callTool(AzureDevOpsMcpTools mcpTools, String toolName, Map<String, Object> arguments) {
        try {
            Object result = mcpTools.execute(toolName, arguments);
            return new CallToolResult(List.of(new TextContent(objectMapper.writeValueAsString(result))), false);
        } catch (Exception e) {
            log.error("Tool execution error for {}: {}", toolName, e.getMessage(), e);
            return new CallToolResult(List.of(new TextContent(toJson(ToolErrorRenderer.render(e)))), true);
        }
    }

    private static String toJson(Map<String, Object> error) {
        try {
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize tool error", e);
            return "{\"error\":\"Error executing tool\",\"kind\":\"InternalError\"}";
        }
    }
}
