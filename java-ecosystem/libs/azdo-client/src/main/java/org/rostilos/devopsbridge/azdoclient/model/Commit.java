package org.rostilos.devopsbridge.azdoclient.model;

import java.util.List;

public record Commit(String message, List<FileChange> changes) {

    public Commit {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Commit message cannot be null or empty");
        }
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("A commit needs at least one change");
        }
        changes = List.copyOf(changes);
    }

    public static Commit of(String message, FileChange change) {
        return new Commit(message, List.of(change));
    }
}
