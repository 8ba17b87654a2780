package org.rostilos.devopsbridge.azdoclient.model;

/**
 * Text content of a file at the tip of a branch.
 */
public record FileContent(String path, String branch, String content) {
}
