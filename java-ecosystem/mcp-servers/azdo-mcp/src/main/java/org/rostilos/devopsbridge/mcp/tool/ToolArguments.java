package org.rostilos.devopsbridge.mcp.tool;

import java.util.Map;

public final class ToolArguments {

    private ToolArguments() {
        // Utility class
    }

    public static String getStringArg(Map<String, Object> args, String key) {
        if (args == null) return null;
        Object value = args.get(key);
        if (value == null) return null;
        return value.toString();
    }

    public static String getStringArg(Map<String, Object> args, String key, String defaultValue) {
        String value = getStringArg(args, key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    /**
     * Content arguments keep their exact text; only absence is rejected.
     */
    public static String requireRawStringArg(Map<String, Object> args, String key) {
        String value = getStringArg(args, key);
        if (value == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    public static String requireStringArg(Map<String, Object> args, String key) {
        String value = getStringArg(args, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }
}
