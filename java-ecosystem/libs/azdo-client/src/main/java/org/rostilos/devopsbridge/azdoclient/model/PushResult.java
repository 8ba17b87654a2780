package org.rostilos.devopsbridge.azdoclient.model;

/**
 * @param pushId      server-assigned push id
 * @param newObjectId tip of the pushed ref as reported by the server; null if the response omitted it
 */
public record PushResult(long pushId, String newObjectId) {
}
