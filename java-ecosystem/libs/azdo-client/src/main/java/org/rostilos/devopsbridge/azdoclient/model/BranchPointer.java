package org.rostilos.devopsbridge.azdoclient.model;

/**
 * Snapshot of a ref and the commit it pointed at when it was read.
 */
public record BranchPointer(String refName, String objectId) {
}
