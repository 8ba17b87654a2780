package org.rostilos.devopsbridge.azdoclient.exception;

/**
 * Credential missing, or rejected by Azure DevOps.
 */
public class AuthenticationException extends AzureDevOpsException {

    public AuthenticationException(String operation, String message) {
        super(operation, message, NO_STATUS, null, null, null);
    }

    public AuthenticationException(String operation, int statusCode, String url, String responseBody) {
        super(operation,
                String.format("Azure DevOps rejected the credential during %s: HTTP %d for %s",
                        operation, statusCode, url),
                statusCode, url, responseBody, null);
    }

    public AuthenticationException(String operation, String url, String message, String responseBody) {
        super(operation, String.format("Azure DevOps denied %s: %s", operation, message),
                NO_STATUS, url, responseBody, null);
    }

    @Override
    public String getKind() {
        return "AuthenticationError";
    }
}
