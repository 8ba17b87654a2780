package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * Non-success response (or transport failure) that has no more specific meaning.
 */
public class RemoteApiException extends AzureDevOpsException {

    public RemoteApiException(String operation, int statusCode, String url, String responseBody) {
        super(operation,
                String.format("Azure DevOps API error during %s: HTTP %d for %s - %s",
                        operation, statusCode, url, responseBody),
                statusCode, url, responseBody, null);
    }

    public RemoteApiException(String operation, String url, String message, String responseBody) {
        super(operation, String.format("Azure DevOps API error during %s: %s", operation, message),
                NO_STATUS, url, responseBody, null);
    }

    public RemoteApiException(String operation, String url, Throwable cause) {
        super(operation, String.format("Azure DevOps request failed during %s for %s: %s",
                        operation, url, cause.getMessage()),
                NO_STATUS, url, null, cause);
    }

    public boolean isNotFound() {
        return getStatusCode() == 404;
    }

    public boolean isConflict() {
        return getStatusCode() == 409;
    }

    @Override
    public String getKind() {
        return "RemoteApiError";
    }
}
