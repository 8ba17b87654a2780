package org.rostilos.devopsbridge.mcp.tool;

import java.util.Map;

/**
 * Interface for Azure DevOps MCP tools.
 */
public interface AzureDevOpsTool {

    /**
     * Get the tool name as exposed to MCP clients.
     */
    String getName();

    String getDescription();

    /**
     * JSON schema of the tool arguments.
     */
    String getInputSchema();

    /**
     * Execute the tool with the given arguments.
     *
     * @param arguments The tool arguments as a map
     * @return The result object (will be serialized to JSON)
     */
    Object execute(Map<String, Object> arguments);
}
