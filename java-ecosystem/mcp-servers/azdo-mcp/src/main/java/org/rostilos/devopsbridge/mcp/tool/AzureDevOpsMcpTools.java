package org.rostilos.devopsbridge.mcp.tool;

import org.rostilos.devopsbridge.azdoclient.AzureDevOpsClient;
import org.rostilos.devopsbridge.mcp.tool.impl.GetFileTool;
import org.rostilos.devopsbridge.mcp.tool.impl.ListProjectsTool;
import org.rostilos.devopsbridge.mcp.tool.impl.ListReposTool;
import org.rostilos.devopsbridge.mcp.tool.impl.UpdateFileAndCreatePrTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry and executor for Azure DevOps MCP tools.
 */
public class AzureDevOpsMcpTools {

    private static final Logger log = LoggerFactory.getLogger(AzureDevOpsMcpTools.class);

    private final Map<String, AzureDevOpsTool> tools = new LinkedHashMap<>();

    public AzureDevOpsMcpTools(AzureDevOpsClient client) {
        register(new ListProjectsTool(client));
        register(new ListReposTool(client));
        register(new GetFileTool(client));
        register(new UpdateFileAndCreatePrTool(client));
    }

    private void register(AzureDevOpsTool tool) {
        tools.put(tool.getName(), tool);
        log.debug("Registered tool: {}", tool.getName());
    }

    public List<AzureDevOpsTool> getTools() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Execute a tool by name with the given arguments.
     */
    public Object execute(String toolName, Map<String, Object> arguments) {
        AzureDevOpsTool tool = tools.get(toolName);
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool: " + toolName);
        }

        log.info("Executing tool: {} with {} arguments", toolName, arguments != null ? arguments.size() : 0);
        return tool.execute(arguments != null ? arguments : Map.of());
    }
}
