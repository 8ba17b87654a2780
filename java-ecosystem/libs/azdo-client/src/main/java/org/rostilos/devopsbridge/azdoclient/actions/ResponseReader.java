package org.rostilos.devopsbridge.azdoclient.actions;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.devopsbridge.azdoclient.exception.MalformedResponseException;
import org.rostilos.devopsbridge.azdoclient.model.RepositoryRef;

final class ResponseReader {

    private ResponseReader() {
        // Utility class
    }

    /**
     * The {@code value} array every Azure DevOps listing wraps its items in.
     */
    static JsonNode values(JsonNode node, String operation, String url) {
        JsonNode values = node.path("value");
        if (!values.isArray()) {
            throw new MalformedResponseException(operation, url, "missing 'value' array", node.toString());
        }
        return values;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static String requiredText(JsonNode node, String field, String operation, String url) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new MalformedResponseException(operation, url, "missing '" + field + "'", node.toString());
        }
        return value;
    }

    static long requiredLong(JsonNode node, String field, String operation, String url) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new MalformedResponseException(operation, url, "missing numeric '" + field + "'", node.toString());
        }
        return value.asLong();
    }

    static RepositoryRef repository(JsonNode node, String operation, String url) {
        return new RepositoryRef(
                requiredText(node, "id", operation, url),
                text(node, "name"),
                text(node.path("project"), "name"),
                text(node, "defaultBranch"),
                text(node, "webUrl"),
                text(node, "remoteUrl")
        );
    }
}
