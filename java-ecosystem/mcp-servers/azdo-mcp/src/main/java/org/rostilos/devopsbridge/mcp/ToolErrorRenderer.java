package org.rostilos.devopsbridge.mcp;

import org.rostilos.devopsbridge.azdoclient.exception.AzureDevOpsException;
import org.rostilos.devopsbridge.azdoclient.service.PublishWorkflowException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a failed tool call into the error payload returned to the agent.
 * Keys without a value for the given failure are left out.
 */
public final class ToolErrorRenderer {

    private ToolErrorRenderer() {
        // Utility class
    }

    public static Map<String, Object> render(Exception e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", e.getMessage());

        if (e instanceof PublishWorkflowException workflow) {
            describe(error, workflow.getFailure());
            error.put("step", workflow.getStep().name());
            error.put("project", workflow.getProject());
            error.put("repository", workflow.getRepository());
            error.put("baseRef", workflow.getBaseRef());
            error.put("sourceRef", workflow.getSourceRef());
            putIfPresent(error, "pushId", workflow.getCompletedPushId());
        } else if (e instanceof AzureDevOpsException failure) {
            describe(error, failure);
        } else if (e instanceof IllegalArgumentException) {
            error.put("kind", "InvalidArgument");
        } else {
            error.put("kind", "InternalError");
        }
        return error;
    }

    private static void describe(Map<String, Object> error, AzureDevOpsException failure) {
        error.put("kind", failure.getKind());
        error.put("operation", failure.getOperation());
        if (failure.hasStatus()) {
            error.put("statusCode", failure.getStatusCode());
        }
        putIfPresent(error, "url", failure.getUrl());
        putIfPresent(error, "responseBody", failure.getResponseBody());
    }

    private static void putIfPresent(Map<String, Object> error, String key, Object value) {
        if (value != null) {
            error.put(key, value);
        }
    }
}
