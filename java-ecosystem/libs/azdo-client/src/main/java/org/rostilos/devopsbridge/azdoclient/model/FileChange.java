package org.rostilos.devopsbridge.azdoclient.model;

/**
 * Full replacement text for one file. Content is sent as raw text.
 */
public record FileChange(String path, String newContent, ChangeType changeType) {

    public FileChange {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        if (newContent == null) {
            throw new IllegalArgumentException("File content cannot be null");
        }
        if (changeType == null) {
            changeType = ChangeType.EDIT;
        }
    }

    public static FileChange edit(String path, String newContent) {
        return new FileChange(path, newContent, ChangeType.EDIT);
    }

    public static FileChange add(String path, String newContent) {
        return new FileChange(path, newContent, ChangeType.ADD);
    }
}
